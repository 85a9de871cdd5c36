/**
 * Client for the storage appliance's management middleware.
 *
 * <p>{@link express.mvp.midrpc.MiddlewareClient} is the transport contract, {@link
 * express.mvp.midrpc.ClientFactory} builds a configured client, and {@link
 * express.mvp.midrpc.CallContext} carries cancellation and deadlines through every call.
 */
package express.mvp.midrpc;
