package movies.catalog.mcp.base;

import io.vertx.core.json.JsonObject;

import movies.catalog.mcp.validation.ValidationResult;

/**
 * JSON-RPC 2.0 response envelope: either a result or an error, never both.
 */
public class MCPResponse {

    private final String jsonrpc = MCPRequest.JSONRPC_VERSION;
    private final Object id;
    private final JsonObject result;
    private final JsonObject error;

    private MCPResponse(Object id, JsonObject result, JsonObject error) {
        this.id = id;
        this.result = result;
        this.error = error;
    }

    public static MCPResponse success(Object id, JsonObject result) {
        return new MCPResponse(id, result, null);
    }

    public static MCPResponse error(Object id, int code, String message) {
        return error(id, code, message, null);
    }

    public static MCPResponse error(Object id, int code, String message, JsonObject data) {
        JsonObject error = new JsonObject()
            .put("code", code)
            .put("message", message);
        if (data != null) {
            error.put("data", data);
        }
        return new MCPResponse(id, null, error);
    }

    /**
     * Rejection of a tools/call whose arguments failed schema validation. The full
     * validation result travels in the error data so clients see every violation.
     */
    public static MCPResponse invalidArguments(Object id, String toolName, ValidationResult validation) {
        return error(id, ErrorCodes.INVALID_PARAMS,
            "Invalid arguments for tool: " + toolName,
            validation.toJson());
    }

    public String getJsonrpc() {
        return jsonrpc;
    }

    public Object getId() {
        return id;
    }

    public JsonObject getResult() {
        return result;
    }

    public JsonObject getError() {
        return error;
    }

    public boolean isSuccess() {
        return result != null && error == null;
    }

    public boolean isError() {
        return error != null && result == null;
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject()
            .put("jsonrpc", jsonrpc)
            .put("id", id);

        if (isSuccess()) {
            json.put("result", result);
        } else if (isError()) {
            json.put("error", error);
        }

        return json;
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "MCPResponse{id='" + id + "', result=" + result + "}";
        } else {
            return "MCPResponse{id='" + id + "', error=" + error + "}";
        }
    }

    // Standard JSON-RPC error codes
    public static class ErrorCodes {
        public static final int PARSE_ERROR = -32700;
        public static final int INVALID_REQUEST = -32600;
        public static final int METHOD_NOT_FOUND = -32601;
        public static final int INVALID_PARAMS = -32602;
        public static final int INTERNAL_ERROR = -32603;
    }
}
