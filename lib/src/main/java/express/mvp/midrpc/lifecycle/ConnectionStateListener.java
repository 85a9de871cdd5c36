package express.mvp.midrpc.lifecycle;

/**
 * Observer of socket lifecycle moves.
 *
 * <p>Invoked synchronously on the thread performing the transition, which for the socket
 * transport is its owner thread. Implementations must be quick and must not call back into the
 * client.
 *
 * @see ConnectionStateMachine
 */
@FunctionalInterface
public interface ConnectionStateListener {

    /**
     * @param from state being left
     * @param to state just entered
     * @param cause the read error or timeout behind a drop, otherwise {@code null}
     */
    void onStateChanged(ConnectionState from, ConnectionState to, Throwable cause);
}
