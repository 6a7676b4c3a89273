package movies.catalog.mcp.servers;

import io.vertx.core.Promise;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;

import movies.catalog.mcp.base.MCPResponse;
import movies.catalog.mcp.base.MCPServerBase;
import movies.catalog.mcp.context.ContextInfo;
import movies.catalog.mcp.context.ContextNotFoundException;
import movies.catalog.mcp.context.PageView;
import movies.catalog.mcp.context.ResultContextManager;
import movies.catalog.mcp.schemas.CatalogToolSchemas;
import movies.catalog.services.LogUtil;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * MCP server for paging through large result sets.
 *
 * <p>Domain servers hand a finished result sequence to <code>catalog.context.create</code>
 * and return the reply (context metadata) to their client. The client then pages with
 * <code>get_context_page</code> until the context expires. Expired contexts are swept on a
 * timer as well as dropped lazily when touched.</p>
 *
 * <p>Deployment config: <code>ttlSeconds</code>, <code>defaultPageSize</code>,
 * <code>maxPageSize</code>, <code>sweepIntervalMs</code>.</p>
 */
public class ContextServer extends MCPServerBase {

    public static final String CREATE_ADDRESS = "catalog.context.create";

    private ResultContextManager contextManager;
    private long sweepTimerId = -1;

    public ContextServer() {
        this(null);
    }

    /**
     * @param contextManager manager to serve from; when null one is built from the deployment config
     */
    public ContextServer(ResultContextManager contextManager) {
        super("ContextServer", "/mcp/servers/context");
        this.contextManager = contextManager;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        if (contextManager == null) {
            try {
                JsonObject config = config();
                contextManager = new ResultContextManager(
                    Duration.ofSeconds(config.getLong("ttlSeconds", ResultContextManager.DEFAULT_TTL.getSeconds())),
                    config.getInteger("defaultPageSize", ResultContextManager.DEFAULT_PAGE_SIZE),
                    config.getInteger("maxPageSize", ResultContextManager.MAX_PAGE_SIZE));
            } catch (IllegalArgumentException e) {
                LogUtil.logError(vertx, "Invalid context configuration", e, "ContextServer", "StartUp", "Context");
                startPromise.fail(e);
                return;
            }
        }
        super.start(startPromise);
    }

    @Override
    protected void initializeTools() {
        CatalogToolSchemas.contextTools().forEach(this::registerTool);
    }

    @Override
    protected void onServerReady() {
        vertx.eventBus().<JsonObject>consumer(CREATE_ADDRESS, msg -> {
            JsonObject body = msg.body();
            Object results = body != null ? body.getValue("results") : null;
            if (!(results instanceof JsonArray)) {
                msg.fail(400, "results must be an array");
                return;
            }
            ContextInfo info = contextManager.createContext(
                toList((JsonArray) results),
                body.getValue("query"),
                clampToInt(body.getValue("pageSize")));
            LogUtil.logDetail(vertx, "Created context " + info.getId() + " with " + info.getTotal() +
                " items in " + info.getTotalPages() + " pages", "ContextServer", "Create", "Context");
            msg.reply(info.toJson());
        });

        long interval = config().getLong("sweepIntervalMs", 60_000L);
        LogUtil.logInfo(vertx, "ContextServer ready: ttl=" + contextManager.getTtl().getSeconds() + "s defaultPageSize=" +
            contextManager.getDefaultPageSize() + " maxPageSize=" + contextManager.getMaxPageSize() +
            " sweepIntervalMs=" + interval, "ContextServer", "StartUp", "Context");
        if (interval > 0) {
            sweepTimerId = vertx.setPeriodic(interval, id -> {
                int removed = contextManager.removeExpired();
                if (removed > 0) {
                    LogUtil.logDetail(vertx, "Swept " + removed + " expired contexts; " +
                        contextManager.activeContextCount() + " active", "ContextServer", "Sweep", "Context");
                }
            });
        }
    }

    @Override
    public void stop() {
        if (sweepTimerId >= 0) {
            vertx.cancelTimer(sweepTimerId);
        }
    }

    @Override
    protected void executeTool(RoutingContext ctx, Object requestId, String toolName, JsonObject arguments) {
        try {
            switch (toolName) {
                case "get_context_page":
                    getContextPage(ctx, requestId, arguments);
                    break;
                case "get_context_info":
                    getContextInfo(ctx, requestId, arguments);
                    break;
                case "delete_context":
                    deleteContext(ctx, requestId, arguments);
                    break;
                default:
                    sendError(ctx, requestId, MCPResponse.ErrorCodes.METHOD_NOT_FOUND,
                        "Unknown tool: " + toolName);
            }
        } catch (ContextNotFoundException e) {
            LogUtil.logDebug(vertx, e.getMessage(), "ContextServer", toolName, "Context");
            sendError(ctx, requestId, MCPResponse.ErrorCodes.INVALID_PARAMS, e.getMessage(),
                new JsonObject().put("contextId", e.getContextId()));
        }
    }

    private void getContextPage(RoutingContext ctx, Object requestId, JsonObject arguments) {
        PageView page = contextManager.getPage(
            arguments.getString("context_id"),
            clampToInt(arguments.getValue("page")),
            clampToInt(arguments.getValue("page_size")));
        sendSuccess(ctx, requestId, page.toJson());
    }

    private void getContextInfo(RoutingContext ctx, Object requestId, JsonObject arguments) {
        ContextInfo info = contextManager.getContextInfo(arguments.getString("context_id"));
        sendSuccess(ctx, requestId, info.toJson());
    }

    private void deleteContext(RoutingContext ctx, Object requestId, JsonObject arguments) {
        String contextId = arguments.getString("context_id");
        boolean deleted = contextManager.deleteContext(contextId);
        sendSuccess(ctx, requestId, new JsonObject()
            .put("contextId", contextId)
            .put("deleted", deleted));
    }

    /**
     * Integer arguments arrive as any JSON number; out-of-range values saturate so page
     * clamping still applies. Absent values read as 0.
     */
    static int clampToInt(Object value) {
        if (!(value instanceof Number)) {
            return 0;
        }
        double d = ((Number) value).doubleValue();
        if (d >= Integer.MAX_VALUE) return Integer.MAX_VALUE;
        if (d <= Integer.MIN_VALUE) return Integer.MIN_VALUE;
        return ((Number) value).intValue();
    }

    private static List<Object> toList(JsonArray array) {
        List<Object> items = new ArrayList<>(array.size());
        for (Object item : array) {
            items.add(item);
        }
        return items;
    }
}
