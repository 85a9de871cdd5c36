package express.mvp.midrpc.rpc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import express.mvp.midrpc.ClientException;

/**
 * A JSON-RPC 2.0 response frame, or a server notification when {@code id} is absent.
 *
 * @param jsonrpc protocol version
 * @param id correlation id of the request, {@code null} for notifications
 * @param result result on success
 * @param error error on failure
 * @param method notification method, {@code null} for responses
 * @param params notification parameters
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcResponse(
        String jsonrpc, String id, JsonNode result, JsonRpcError error, String method, JsonNode params) {

    /**
     * Parses one frame.
     *
     * @param text frame text
     * @return the parsed frame
     * @throws ClientException if the frame is not valid JSON
     */
    public static JsonRpcResponse parse(String text) {
        try {
            return Json.MAPPER.treeToValue(Json.read(text), JsonRpcResponse.class);
        } catch (JsonProcessingException e) {
            throw new ClientException("malformed JSON-RPC frame", e);
        }
    }

    public boolean isNotification() {
        return id == null && method != null;
    }

    public boolean isError() {
        return error != null;
    }
}
