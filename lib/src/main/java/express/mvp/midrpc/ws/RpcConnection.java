package express.mvp.midrpc.ws;

import java.time.Duration;

/**
 * An open text-frame connection to the middleware.
 *
 * <p>A connection has two phases. Right after opening, the caller performs the authentication
 * handshake synchronously with {@link #send(String)} and {@link #receive(Duration)}. Then {@link
 * #start(RpcConnectionListener)} switches it to push mode: every later frame, and any frame
 * received but not yet consumed, goes to the listener.
 */
public interface RpcConnection {

    /**
     * Sends a text frame.
     *
     * @param text frame content
     * @throws express.mvp.midrpc.ClientException if the connection is already closed
     */
    void send(String text);

    /**
     * Receives the next text frame. Only valid before {@link #start}.
     *
     * @param timeout maximum wait
     * @return the frame
     * @throws express.mvp.midrpc.ClientException on timeout or if the connection closed
     */
    String receive(Duration timeout);

    /**
     * Switches to push mode.
     *
     * @param listener receives all further traffic
     */
    void start(RpcConnectionListener listener);

    /** Sends a liveness ping; the answer arrives as {@link RpcConnectionListener#onPong()}. */
    void ping();

    /** Closes the connection. Idempotent. */
    void close();
}
