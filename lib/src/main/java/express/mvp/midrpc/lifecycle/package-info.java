/** Lifecycle states of the persistent socket and the listeners that observe them. */
package express.mvp.midrpc.lifecycle;
