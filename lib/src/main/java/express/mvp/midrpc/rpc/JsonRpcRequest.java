package express.mvp.midrpc.rpc;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A JSON-RPC 2.0 request frame.
 *
 * @param jsonrpc protocol version, always {@code "2.0"}
 * @param method method name
 * @param params positional parameters, omitted when {@code null}
 * @param id correlation id
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JsonRpcRequest(String jsonrpc, String method, JsonNode params, String id) {

    public static final String VERSION = "2.0";

    public static JsonRpcRequest of(String id, String method, Object params) {
        return new JsonRpcRequest(VERSION, method, Json.positional(params), id);
    }

    /** Serializes this request to its wire form. */
    public String toJson() {
        return Json.write(this);
    }
}
