package express.mvp.midrpc.lifecycle;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lifecycle of the reconnecting socket, with transitions checked against a fixed table.
 *
 * <h2>Transitions</h2>
 *
 * <pre>
 * NEW          → CONNECTING, CLOSED
 * CONNECTING   → CONNECTED, DISCONNECTED, CLOSING
 * CONNECTED    → DISCONNECTED, CLOSING
 * DISCONNECTED → CONNECTING, CLOSING, CLOSED
 * CLOSING      → CLOSED
 * CLOSED       → (none)
 * </pre>
 *
 * <p>A disconnected socket may be dialed again any number of times; only closing is final.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Written by a single thread (the socket's owner), readable from any thread.
 *
 * @see ConnectionStateListener
 */
public final class ConnectionStateMachine {

    private static final Logger LOGGER = Logger.getLogger(ConnectionStateMachine.class.getName());

    private static final Map<ConnectionState, Set<ConnectionState>> NEXT =
            new EnumMap<>(ConnectionState.class);

    static {
        NEXT.put(ConnectionState.NEW, EnumSet.of(ConnectionState.CONNECTING, ConnectionState.CLOSED));
        NEXT.put(
                ConnectionState.CONNECTING,
                EnumSet.of(
                        ConnectionState.CONNECTED,
                        ConnectionState.DISCONNECTED,
                        ConnectionState.CLOSING));
        NEXT.put(
                ConnectionState.CONNECTED,
                EnumSet.of(ConnectionState.DISCONNECTED, ConnectionState.CLOSING));
        NEXT.put(
                ConnectionState.DISCONNECTED,
                EnumSet.of(ConnectionState.CONNECTING, ConnectionState.CLOSING, ConnectionState.CLOSED));
        NEXT.put(ConnectionState.CLOSING, EnumSet.of(ConnectionState.CLOSED));
        NEXT.put(ConnectionState.CLOSED, EnumSet.noneOf(ConnectionState.class));
    }

    private final String endpoint;
    private final List<ConnectionStateListener> listeners = new CopyOnWriteArrayList<>();
    private volatile ConnectionState state = ConnectionState.NEW;

    /**
     * @param endpoint socket address, used in log messages
     */
    public ConnectionStateMachine(String endpoint) {
        this.endpoint = endpoint;
    }

    public ConnectionState getState() {
        return state;
    }

    public boolean isActive() {
        return state.isActive();
    }

    public boolean isClosedOrClosing() {
        return state.isTerminalOrClosing();
    }

    public void addListener(ConnectionStateListener listener) {
        listeners.add(listener);
    }

    public boolean removeListener(ConnectionStateListener listener) {
        return listeners.remove(listener);
    }

    public boolean transitionTo(ConnectionState next) {
        return transitionTo(next, null);
    }

    /**
     * Moves to {@code next} if the table allows it, then tells the listeners.
     *
     * @param next target state
     * @param cause why the socket changed state, may be {@code null}
     * @return false if the move is not allowed from the current state
     */
    public boolean transitionTo(ConnectionState next, Throwable cause) {
        ConnectionState previous = state;
        if (!isValidTransition(previous, next)) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(endpoint + ": ignoring " + previous + " -> " + next);
            }
            return false;
        }
        state = next;
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(endpoint + ": " + previous + " -> " + next);
        }
        for (ConnectionStateListener listener : listeners) {
            try {
                listener.onStateChanged(previous, next, cause);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, endpoint + ": state listener threw", e);
            }
        }
        return true;
    }

    /** Whether the table allows {@code from -> to}. Staying in place is never a transition. */
    public static boolean isValidTransition(ConnectionState from, ConnectionState to) {
        return NEXT.get(from).contains(to);
    }

    @Override
    public String toString() {
        return endpoint + " [" + state + "]";
    }
}
