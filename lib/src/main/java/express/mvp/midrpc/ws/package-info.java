/**
 * Persistent-socket transport.
 *
 * <p>{@link express.mvp.midrpc.ws.WebSocketClient} multiplexes JSON-RPC calls over one
 * authenticated connection owned by a single thread, and completes jobs from pushed {@code
 * core.get_jobs} events. {@link express.mvp.midrpc.ws.RpcConnector} is the seam to the socket
 * library; {@link express.mvp.midrpc.ws.NettyRpcConnector} is the production implementation.
 */
package express.mvp.midrpc.ws;
