package express.mvp.midrpc.rpc;

import express.mvp.midrpc.ClientException;
import express.mvp.midrpc.error.ErrorParser;
import express.mvp.midrpc.error.MiddlewareError;

/** A JSON-RPC error returned for a request, or a connection failure affecting one. */
public class JsonRpcException extends ClientException {

    private final JsonRpcError error;

    public JsonRpcException(JsonRpcError error) {
        super(error.describe());
        this.error = error;
    }

    public JsonRpcException(JsonRpcError error, Throwable cause) {
        super(error.describe(), cause);
        this.error = error;
    }

    /**
     * Creates an {@link JsonRpcCodes#INTERNAL} error for a request lost with its connection.
     *
     * @param message description
     * @param cause the connection failure
     * @return the exception
     */
    public static JsonRpcException connectionLost(String message, Throwable cause) {
        return new JsonRpcException(new JsonRpcError(JsonRpcCodes.INTERNAL, message, null), cause);
    }

    public JsonRpcError error() {
        return error;
    }

    public int code() {
        return error.code();
    }

    /**
     * Converts this wire error into a structured error by parsing its reason.
     *
     * @return the structured error, with this exception as cause
     */
    public MiddlewareError toMiddlewareError() {
        return ErrorParser.parse(error.describe()).withCause(this);
    }
}
