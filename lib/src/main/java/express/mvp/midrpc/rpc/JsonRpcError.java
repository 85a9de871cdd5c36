package express.mvp.midrpc.rpc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The {@code error} member of a JSON-RPC response.
 *
 * @param code JSON-RPC error code, see {@link JsonRpcCodes}
 * @param message short message
 * @param data middleware details, may be {@code null}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcError(int code, String message, Data data) {

    /**
     * Middleware details of a failed call.
     *
     * @param reason human readable reason, usually {@code [ECODE] text}
     * @param error errno value
     * @param extra extra diagnostics
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Data(String reason, int error, JsonNode extra) {}

    /**
     * Returns the most useful description: {@code data.reason} when present, else {@code message}.
     *
     * @return the description
     */
    public String describe() {
        if (data != null && data.reason() != null && !data.reason().isEmpty()) {
            return data.reason();
        }
        return message != null ? message : "JSON-RPC error " + code;
    }

    /** Returns the errno carried in {@code data}, or 0. */
    public int errno() {
        return data != null ? data.error() : 0;
    }

    /** Returns whether the reason mentions {@code token}. */
    public boolean reasonContains(String token) {
        return data != null && data.reason() != null && data.reason().contains(token);
    }
}
