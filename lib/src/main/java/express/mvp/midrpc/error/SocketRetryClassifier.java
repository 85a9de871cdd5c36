package express.mvp.midrpc.error;

import express.mvp.midrpc.rpc.JsonRpcCodes;
import express.mvp.midrpc.rpc.JsonRpcError;
import express.mvp.midrpc.rpc.JsonRpcException;
import java.io.EOFException;
import java.net.SocketException;
import java.nio.channels.ClosedChannelException;
import java.util.List;
import java.util.Locale;

/**
 * Classifier for the persistent-socket transport.
 *
 * <h2>Rules</h2>
 *
 * <ul>
 *   <li>{@link JsonRpcCodes#INTERNAL}: the request was lost with its connection; retry.
 *   <li>{@link JsonRpcCodes#TOO_MANY_CONCURRENT_CALLS}: server-side limit; retry.
 *   <li>{@link JsonRpcCodes#CALL_ERROR}: retry only for errno {@code EAGAIN} (11) or {@code EBUSY}
 *       (16), or an expired session ({@code ENOTAUTHENTICATED}).
 *   <li>Other JSON-RPC codes: never.
 *   <li>End of stream, closed channels, socket exceptions (refused, reset, unreachable) and
 *       well-known network failure text in any letter case: retry.
 * </ul>
 */
public final class SocketRetryClassifier implements RetryClassifier {

    private static final List<String> NETWORK_PATTERNS =
            List.of(
                    "connection reset by peer",
                    "broken pipe",
                    "connection refused",
                    "no route to host",
                    "network is unreachable",
                    "i/o timeout",
                    "websocket: close",
                    "connection lost");

    @Override
    public boolean isRetriable(Throwable error) {
        if (error == null) {
            return false;
        }
        JsonRpcException rpc = find(error, JsonRpcException.class);
        if (rpc != null) {
            return isRetriable(rpc.error());
        }
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof EOFException
                    || t instanceof ClosedChannelException
                    || t instanceof SocketException) {
                return true;
            }
            String msg = t.getMessage();
            if (msg != null) {
                String lower = msg.toLowerCase(Locale.ROOT);
                for (String pattern : NETWORK_PATTERNS) {
                    if (lower.contains(pattern)) {
                        return true;
                    }
                }
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    private static boolean isRetriable(JsonRpcError error) {
        return switch (error.code()) {
            case JsonRpcCodes.INTERNAL, JsonRpcCodes.TOO_MANY_CONCURRENT_CALLS -> true;
            case JsonRpcCodes.CALL_ERROR -> error.errno() == JsonRpcCodes.EAGAIN
                    || error.errno() == JsonRpcCodes.EBUSY
                    || error.reasonContains(ErrorCodes.ENOTAUTHENTICATED);
            default -> false;
        };
    }

    private static <T extends Throwable> T find(Throwable error, Class<T> type) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (type.isInstance(t)) {
                return type.cast(t);
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return null;
    }
}
