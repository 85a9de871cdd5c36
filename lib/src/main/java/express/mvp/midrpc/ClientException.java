package express.mvp.midrpc;

/**
 * Unchecked exception thrown when a middleware client operation fails.
 *
 * <p>This is the root of the client's exception hierarchy. It extends {@link RuntimeException} to
 * avoid cluttering every call site with checked exceptions; callers that need to react to a
 * specific failure catch one of the subclasses.
 *
 * <h2>Subclasses</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.midrpc.error.MiddlewareError} - structured error reported by the
 *       middleware (code, field, job id, suggestion)
 *   <li>{@link express.mvp.midrpc.rpc.JsonRpcException} - JSON-RPC error object from the socket
 *       transport
 *   <li>{@link CallCancelledException} - the call context was cancelled or its deadline passed
 *   <li>{@link express.mvp.midrpc.ratelimit.RetriesExhaustedException} - transient failures
 *       outlasted the retry budget
 * </ul>
 */
public class ClientException extends RuntimeException {

    /**
     * Constructs a new client exception with the specified message.
     *
     * @param message the detail message describing the failure
     */
    public ClientException(String message) {
        super(message);
    }

    /**
     * Constructs a new client exception with the specified message and cause.
     *
     * @param message the detail message describing the failure
     * @param cause the underlying cause of the failure
     */
    public ClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
