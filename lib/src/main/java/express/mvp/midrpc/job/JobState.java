package express.mvp.midrpc.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * States of a middleware job, plus two synthetic states the socket transport injects into job
 * event streams.
 */
public enum JobState {
    RUNNING,
    WAITING,
    SUCCESS,
    FAILED,
    ABORTED,

    /** Any state string this client does not recognise. Polled like {@link #RUNNING}. */
    UNKNOWN,

    /** Synthetic: the socket carrying job events went down. */
    DISCONNECTED,

    /** Synthetic: the socket came back after {@link #DISCONNECTED}. */
    RECONNECTED;

    /**
     * Parses a state string from the wire.
     *
     * @param value state string, may be {@code null}
     * @return the state, {@link #UNKNOWN} if unrecognised
     */
    @JsonCreator
    public static JobState fromWire(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        return switch (value.toUpperCase(Locale.ROOT)) {
            case "RUNNING" -> RUNNING;
            case "WAITING" -> WAITING;
            case "SUCCESS" -> SUCCESS;
            case "FAILED" -> FAILED;
            case "ABORTED" -> ABORTED;
            default -> UNKNOWN;
        };
    }

    @JsonValue
    public String wireName() {
        return name();
    }

    /** SUCCESS, FAILED or ABORTED. */
    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED || this == ABORTED;
    }

    /** FAILED or ABORTED. */
    public boolean isFailure() {
        return this == FAILED || this == ABORTED;
    }

    /** DISCONNECTED or RECONNECTED. */
    public boolean isSynthetic() {
        return this == DISCONNECTED || this == RECONNECTED;
    }
}
