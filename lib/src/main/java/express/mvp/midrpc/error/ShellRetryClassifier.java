package express.mvp.midrpc.error;

import java.util.List;
import java.util.Locale;

/**
 * Classifier for the shell-command transport.
 *
 * <p>Connection-level failures are recognised by message text anywhere in the cause chain, since
 * they arrive as JSch exceptions, socket exceptions or stderr text depending on where the session
 * broke. Middleware errors coded {@code EAGAIN} or {@code EBUSY} are also retried.
 */
public final class ShellRetryClassifier implements RetryClassifier {

    private static final List<String> RETRIABLE_PATTERNS =
            List.of(
                    "failed connection handshake",
                    "unexpected closure of remote connection",
                    "connection refused",
                    "connection reset",
                    "i/o timeout",
                    "no route to host",
                    "network is unreachable",
                    "session is down",
                    "connection is closed by foreign host",
                    "socket is not established");

    @Override
    public boolean isRetriable(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof MiddlewareError me
                    && (me.hasCode(ErrorCodes.EAGAIN) || me.hasCode(ErrorCodes.EBUSY))) {
                return true;
            }
            String msg = t.getMessage();
            if (msg == null) {
                continue;
            }
            String lower = msg.toLowerCase(Locale.ROOT);
            for (String pattern : RETRIABLE_PATTERNS) {
                if (lower.contains(pattern)) {
                    return true;
                }
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}
