package movies.catalog.mcp.base;

import io.vertx.core.json.JsonObject;

/**
 * JSON-RPC 2.0 request envelope. The id may be a string or a number and is echoed back
 * unchanged in the response.
 */
public class MCPRequest {

    public static final String JSONRPC_VERSION = "2.0";

    private final String jsonrpc;
    private final Object id;
    private final String method;
    private final JsonObject params;

    public MCPRequest(String jsonrpc, Object id, String method, JsonObject params) {
        this.jsonrpc = jsonrpc;
        this.id = id;
        this.method = method;
        this.params = params != null ? params : new JsonObject();
    }

    public MCPRequest(Object id, String method, JsonObject params) {
        this(JSONRPC_VERSION, id, method, params);
    }

    public String getJsonrpc() {
        return jsonrpc;
    }

    public Object getId() {
        return id;
    }

    public String getMethod() {
        return method;
    }

    public JsonObject getParams() {
        return params;
    }

    /**
     * Name of the tool for a tools/call request, or null.
     */
    public String getToolName() {
        Object name = params.getValue("name");
        return name instanceof String ? (String) name : null;
    }

    /**
     * Arguments of a tools/call request. Missing arguments read as an empty bag;
     * arguments that are present but not an object read as null.
     */
    public JsonObject getToolArguments() {
        Object arguments = params.getValue("arguments");
        if (arguments == null) {
            return new JsonObject();
        }
        return arguments instanceof JsonObject ? (JsonObject) arguments : null;
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject()
            .put("jsonrpc", jsonrpc)
            .put("id", id)
            .put("method", method);

        if (!params.isEmpty()) {
            json.put("params", params);
        }

        return json;
    }

    /**
     * Read an incoming body. Tolerates a missing or non-object params member.
     */
    public static MCPRequest fromJson(JsonObject json) {
        if (json == null) {
            return new MCPRequest(null, null, null, null);
        }
        Object params = json.getValue("params");
        Object method = json.getValue("method");
        Object version = json.getValue("jsonrpc");
        return new MCPRequest(
            version instanceof String ? (String) version : null,
            json.getValue("id"),
            method instanceof String ? (String) method : null,
            params instanceof JsonObject ? (JsonObject) params : null
        );
    }

    public boolean isValid() {
        boolean idValid = id instanceof Number || (id instanceof String && !((String) id).isEmpty());
        return idValid
            && method != null && !method.isEmpty()
            && JSONRPC_VERSION.equals(jsonrpc);
    }

    @Override
    public String toString() {
        return "MCPRequest{id='" + id + "', method='" + method + "', params=" + params + "}";
    }
}
