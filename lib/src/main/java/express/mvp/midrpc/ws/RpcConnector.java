package express.mvp.midrpc.ws;

import java.net.URI;

/** Opens {@link RpcConnection}s. */
public interface RpcConnector extends AutoCloseable {

    /**
     * Dials and completes the WebSocket upgrade.
     *
     * @param endpoint {@code ws://} or {@code wss://} URI
     * @param config transport settings (timeouts, TLS verification)
     * @return the open connection
     * @throws express.mvp.midrpc.ClientException if the connection cannot be established
     */
    RpcConnection open(URI endpoint, WebSocketConfig config);

    /** Releases resources shared by all connections, such as I/O threads. */
    @Override
    default void close() {}
}
