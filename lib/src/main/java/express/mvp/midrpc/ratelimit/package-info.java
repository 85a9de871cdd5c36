/** Admission control and bounded retry around a transport. */
package express.mvp.midrpc.ratelimit;
