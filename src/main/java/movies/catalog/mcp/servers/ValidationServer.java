package movies.catalog.mcp.servers;

import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;

import movies.catalog.mcp.base.MCPResponse;
import movies.catalog.mcp.base.MCPServerBase;
import movies.catalog.mcp.base.MCPTool;
import movies.catalog.mcp.schemas.CatalogToolSchemas;
import movies.catalog.mcp.validation.ToolCallValidator;
import movies.catalog.mcp.validation.ValidationResult;
import movies.catalog.services.LogUtil;

import java.util.List;

/**
 * MCP server that answers "would this call be accepted?" for any catalog tool.
 *
 * <p>Unlike the pre-dispatch check every server performs on its own tools, the result here
 * is returned as a normal tool result, so a client can dry-run a call and read back every
 * violation. The same check is available to other verticles on
 * <code>catalog.validation.validate</code>.</p>
 */
public class ValidationServer extends MCPServerBase {

    public static final String VALIDATE_ADDRESS = "catalog.validation.validate";

    private final ToolCallValidator catalogValidator;

    public ValidationServer() {
        this(CatalogToolSchemas.allTools());
    }

    public ValidationServer(List<MCPTool> catalogTools) {
        super("ValidationServer", "/mcp/servers/validation");
        this.catalogValidator = new ToolCallValidator(catalogTools);
    }

    @Override
    protected void initializeTools() {
        registerTool(CatalogToolSchemas.validateToolCallTool());
    }

    @Override
    protected void onServerReady() {
        vertx.eventBus().<JsonObject>consumer(VALIDATE_ADDRESS, msg -> {
            JsonObject body = msg.body();
            Object toolName = body != null ? body.getValue("tool_name") : null;
            Object arguments = body != null && body.containsKey("arguments") ? body.getValue("arguments") : new JsonObject();
            if (!(toolName instanceof String) || !(arguments instanceof JsonObject)) {
                msg.fail(400, "tool_name must be a string and arguments an object");
                return;
            }
            msg.reply(validate((String) toolName, (JsonObject) arguments).toJson());
        });
        LogUtil.logDetail(vertx, "ValidationServer knows " + catalogValidator.getSchemas().size() + " catalog tools",
            "ValidationServer", "StartUp", "Validation");
    }

    @Override
    protected void executeTool(RoutingContext ctx, Object requestId, String toolName, JsonObject arguments) {
        switch (toolName) {
            case "validate_tool_call":
                ValidationResult result = validate(arguments.getString("tool_name"), arguments.getJsonObject("arguments"));
                sendSuccess(ctx, requestId, result.toJson());
                break;
            default:
                sendError(ctx, requestId, MCPResponse.ErrorCodes.METHOD_NOT_FOUND,
                    "Unknown tool: " + toolName);
        }
    }

    private ValidationResult validate(String toolName, JsonObject arguments) {
        ValidationResult result = catalogValidator.validate(toolName, arguments);
        LogUtil.logDebug(vertx, "Validated " + toolName + ": valid=" + result.isValid() +
            " errors=" + result.getErrors().size(), "ValidationServer", "Validate", "Validation");
        return result;
    }
}
