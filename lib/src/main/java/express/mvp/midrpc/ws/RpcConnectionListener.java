package express.mvp.midrpc.ws;

/**
 * Receives inbound traffic of a started {@link RpcConnection}.
 *
 * <p>Callbacks run on the connection's I/O thread and may block while the client's mailbox is
 * full, which pauses reading from the socket.
 */
public interface RpcConnectionListener {

    void onText(String text);

    void onPong();

    /**
     * Called once when the connection ends for any reason.
     *
     * @param cause why the connection ended
     */
    void onClosed(Throwable cause);
}
