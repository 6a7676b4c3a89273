package movies.catalog.mcp.base;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;

import movies.catalog.mcp.validation.ToolCallValidator;
import movies.catalog.mcp.validation.ValidationResult;
import movies.catalog.services.LogUtil;
import movies.catalog.services.MCPRouterService;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import static movies.catalog.Driver.logLevel;

/**
 * Base class for all MCP servers.
 * Provides tools/list and tools/call, and validates every tools/call against the
 * called tool's input schema before the subclass sees it.
 */
public abstract class MCPServerBase extends AbstractVerticle {

    protected Router router;
    protected final Map<String, MCPTool> tools = new LinkedHashMap<>();
    protected final String serverName;
    protected final String serverPath;

    private ToolCallValidator callValidator;

    protected MCPServerBase(String serverName, String serverPath) {
        this.serverName = serverName;
        this.serverPath = serverPath;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        router = Router.router(vertx);

        router.post("/tools/list").handler(this::handleToolsList);
        router.post("/tools/call").handler(this::handleToolCall);

        initializeTools();
        callValidator = new ToolCallValidator(tools.values());

        MCPRouterService.registerRouter(serverPath, router);
        vertx.eventBus().publish("log", serverName + " registered router at path: " + serverPath + " with " + tools.size() + " tools,2," + serverName + ",MCP,System");

        onServerReady();
        startPromise.complete();
    }

    /**
     * Initialize the tools provided by this server.
     * Subclasses must implement this to register their tools.
     */
    protected abstract void initializeTools();

    /**
     * Called when the server is successfully registered and ready.
     * Subclasses can override for additional initialization.
     */
    protected void onServerReady() {
        // Default: no additional action
    }

    protected void registerTool(MCPTool tool) {
        tools.put(tool.getName(), tool);
        if (logLevel >= 3) vertx.eventBus().publish("log", serverName + " registered tool: " + tool.getName() + ",3," + serverName + ",MCP,System");
    }

    private void handleToolsList(RoutingContext ctx) {
        try {
            MCPRequest request = MCPRequest.fromJson(readBody(ctx));

            if (!request.isValid()) {
                sendError(ctx, request.getId(), MCPResponse.ErrorCodes.INVALID_REQUEST, "Invalid request format");
                return;
            }

            JsonArray toolsArray = new JsonArray();
            for (MCPTool tool : tools.values()) {
                toolsArray.add(tool.toJson());
            }

            sendSuccess(ctx, request.getId(), new JsonObject().put("tools", toolsArray));

        } catch (DecodeException e) {
            sendError(ctx, null, MCPResponse.ErrorCodes.PARSE_ERROR, "Parse error: " + e.getMessage());
        } catch (Exception e) {
            LogUtil.logError(vertx, "Error handling tools/list", e, serverName, "MCP", "System");
            sendError(ctx, null, MCPResponse.ErrorCodes.INTERNAL_ERROR, "Internal server error");
        }
    }

    private void handleToolCall(RoutingContext ctx) {
        try {
            MCPRequest request = MCPRequest.fromJson(readBody(ctx));

            if (!request.isValid()) {
                sendError(ctx, request.getId(), MCPResponse.ErrorCodes.INVALID_REQUEST, "Invalid request format");
                return;
            }

            String toolName = request.getToolName();
            if (toolName == null) {
                sendError(ctx, request.getId(), MCPResponse.ErrorCodes.INVALID_PARAMS, "Missing tool name");
                return;
            }

            if (!tools.containsKey(toolName)) {
                sendError(ctx, request.getId(), MCPResponse.ErrorCodes.METHOD_NOT_FOUND,
                    "Tool not found: " + toolName);
                return;
            }

            JsonObject arguments = request.getToolArguments();
            if (arguments == null) {
                sendError(ctx, request.getId(), MCPResponse.ErrorCodes.INVALID_PARAMS, "Tool arguments must be an object");
                return;
            }

            // Reject malformed calls before any tool logic runs
            ValidationResult validation = callValidator.validate(toolName, arguments);
            if (!validation.isValid()) {
                if (logLevel >= 2) vertx.eventBus().publish("log", "Rejected call to " + toolName + " with " + validation.getErrors().size() + " validation errors,2," + serverName + ",MCP,Validation");
                MCPResponse response = MCPResponse.invalidArguments(request.getId(), toolName, validation);
                writeResponse(ctx, 400, response);
                return;
            }

            executeTool(ctx, request.getId(), toolName, arguments);

        } catch (DecodeException e) {
            sendError(ctx, null, MCPResponse.ErrorCodes.PARSE_ERROR, "Parse error: " + e.getMessage());
        } catch (Exception e) {
            LogUtil.logError(vertx, "Error handling tools/call (" + e.getClass().getName() + ")", e, serverName, "MCP", "System");
            sendError(ctx, null, MCPResponse.ErrorCodes.INTERNAL_ERROR, "Internal server error: " + e.getMessage());
        }
    }

    private JsonObject readBody(RoutingContext ctx) {
        if (ctx.body() == null || ctx.body().buffer() == null || ctx.body().length() == 0) {
            return null;
        }
        return ctx.body().asJsonObject();
    }

    /**
     * Execute a specific tool. Arguments have already passed schema validation.
     */
    protected abstract void executeTool(RoutingContext ctx, Object requestId,
                                        String toolName, JsonObject arguments);

    protected void sendSuccess(RoutingContext ctx, Object requestId, JsonObject result) {
        writeResponse(ctx, 200, MCPResponse.success(orGeneratedId(requestId), result));
    }

    protected void sendError(RoutingContext ctx, Object requestId, int code, String message) {
        writeResponse(ctx, 400, MCPResponse.error(orGeneratedId(requestId), code, message));
    }

    protected void sendError(RoutingContext ctx, Object requestId, int code,
                             String message, JsonObject data) {
        writeResponse(ctx, 400, MCPResponse.error(orGeneratedId(requestId), code, message, data));
    }

    private void writeResponse(RoutingContext ctx, int statusCode, MCPResponse response) {
        ctx.response()
            .putHeader("content-type", "application/json")
            .setStatusCode(statusCode)
            .end(response.toJson().encode());
    }

    private Object orGeneratedId(Object requestId) {
        return requestId != null ? requestId : UUID.randomUUID().toString();
    }
}
