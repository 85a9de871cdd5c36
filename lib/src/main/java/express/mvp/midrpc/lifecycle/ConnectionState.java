package express.mvp.midrpc.lifecycle;

/**
 * States of the persistent socket connection.
 *
 * <h2>State Diagram</h2>
 *
 * <pre>
 * ┌────────┐ dial  ┌────────────┐ authenticated ┌───────────┐
 * │  NEW   │──────▶│ CONNECTING │──────────────▶│ CONNECTED │
 * └────────┘       └────────────┘               └───────────┘
 *                     │      ▲                       │
 *          dial/auth  │      │ next request          │ read error, ping timeout,
 *          failed     ▼      │                       │ session expired
 *                  ┌──────────────┐                  │
 *                  │ DISCONNECTED │◀─────────────────┘
 *                  └──────────────┘
 *                         │ close()
 *                         ▼
 *                  ┌──────────┐  drained  ┌────────┐
 *                  │ CLOSING  │──────────▶│ CLOSED │
 *                  └──────────┘           └────────┘
 * </pre>
 *
 * <p>Job waiters are told about DISCONNECTED and the following CONNECTED through synthetic job
 * events.
 *
 * @see ConnectionStateMachine
 */
public enum ConnectionState {

    /** No connection attempt made yet. */
    NEW("New", false, false),

    /** Dialing, authenticating and subscribing to job events. */
    CONNECTING("Connecting", false, false),

    /** Authenticated and subscribed; requests can be sent. */
    CONNECTED("Connected", true, false),

    /**
     * Connection lost or attempt failed. The next request reconnects.
     *
     * <p>Also the state after a failed first attempt, so a caller can retry.
     */
    DISCONNECTED("Disconnected", false, false),

    /** {@code close()} is failing outstanding work and releasing the socket. */
    CLOSING("Closing", false, true),

    /** Terminal: no transitions, the client cannot be reused. */
    CLOSED("Closed", false, true);

    private final String displayName;
    private final boolean active;
    private final boolean terminal;

    ConnectionState(String displayName, boolean active, boolean terminal) {
        this.displayName = displayName;
        this.active = active;
        this.terminal = terminal;
    }

    public String displayName() {
        return displayName;
    }

    /** True only in {@link #CONNECTED}, where requests go straight onto the socket. */
    public boolean isActive() {
        return active;
    }

    /** True once {@code close()} has started; the client accepts no further calls. */
    public boolean isTerminalOrClosing() {
        return terminal;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
