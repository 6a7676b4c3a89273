package movies.catalog.services;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.ext.web.handler.CorsHandler;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static movies.catalog.Driver.logLevel;

/**
 * Master router for the catalog's MCP servers.
 * Runs the HTTP server and mounts each server's sub-router under its path.
 * Publishes <code>mcp.router.ready</code> with the bound port once listening.
 */
public class MCPRouterService extends AbstractVerticle {

    public static final String READY_ADDRESS = "mcp.router.ready";

    private static final int DEFAULT_HTTP_PORT = 8080;
    private static final long BODY_LIMIT = 10L * 1024 * 1024;

    private static final Map<String, Router> pendingRouters = new ConcurrentHashMap<>();
    private static volatile MCPRouterService instance;

    private Router mainRouter;
    private HttpServer httpServer;

    @Override
    public void start(Promise<Void> startPromise) {
        mainRouter = Router.router(vertx);

        addGlobalHandlers();

        mainRouter.get("/health").handler(ctx -> {
            ctx.response()
                .putHeader("content-type", "application/json")
                .end(new JsonObject()
                    .put("status", "healthy")
                    .put("timestamp", System.currentTimeMillis())
                    .encode());
        });

        instance = this;
        // Servers that started before the router are mounted now
        mountRegisteredRouters();

        int port = config().getInteger("httpPort", DEFAULT_HTTP_PORT);
        HttpServerOptions options = new HttpServerOptions()
            .setPort(port)
            .setCompressionSupported(true)
            .setHandle100ContinueAutomatically(true);

        httpServer = vertx.createHttpServer(options);

        httpServer
            .requestHandler(mainRouter)
            .listen()
            .onSuccess(server -> {
                int actualPort = server.actualPort();
                LogUtil.logInfo(vertx, "MCPRouterService started on port " + actualPort, "MCPRouterService", "StartUp", "System");

                vertx.eventBus().publish(READY_ADDRESS, new JsonObject()
                    .put("port", actualPort)
                    .put("address", "localhost")
                    .put("timestamp", System.currentTimeMillis()));

                startPromise.complete();
            })
            .onFailure(err -> {
                LogUtil.logError(vertx, "Failed to start MCPRouterService on port " + port, err, "MCPRouterService", "StartUp", "System");
                instance = null;
                startPromise.fail(err);
            });
    }

    private void addGlobalHandlers() {
        Set<String> allowedHeaders = new HashSet<>();
        allowedHeaders.add("content-type");
        allowedHeaders.add("authorization");

        Set<HttpMethod> allowedMethods = new HashSet<>();
        allowedMethods.add(HttpMethod.GET);
        allowedMethods.add(HttpMethod.POST);
        allowedMethods.add(HttpMethod.OPTIONS);

        mainRouter.route().handler(CorsHandler.create()
            .addOrigin("*")
            .allowedHeaders(allowedHeaders)
            .allowedMethods(allowedMethods));

        mainRouter.route().handler(BodyHandler.create().setBodyLimit(BODY_LIMIT));

        mainRouter.route("/mcp/*").handler(ctx -> {
            ctx.response().putHeader("content-type", "application/json");
            ctx.next();
        });

        // Anything that escapes a tool handler still answers in JSON-RPC shape
        mainRouter.route("/mcp/*").failureHandler(ctx -> {
            Throwable failure = ctx.failure();
            int statusCode = ctx.statusCode();

            if (statusCode == -1) {
                statusCode = 500;
            }
            if (failure != null) {
                LogUtil.logError(vertx, "Unhandled failure on " + ctx.normalizedPath(), failure, "MCPRouterService", "HTTP", "Router");
            }

            JsonObject error = new JsonObject()
                .put("jsonrpc", "2.0")
                .put("error", new JsonObject()
                    .put("code", statusCode)
                    .put("message", failure != null ? failure.getMessage() : "Unknown error"));

            ctx.response()
                .setStatusCode(statusCode)
                .putHeader("content-type", "application/json")
                .end(error.encode());
        });
    }

    /**
     * Register a server's router at the given path. Called by server verticles; mounted
     * immediately when the router service is running, otherwise held until it starts.
     */
    public static void registerRouter(String path, Router subRouter) {
        MCPRouterService current = instance;
        if (current != null && current.mainRouter != null) {
            current.mountRouter(path, subRouter);
        } else {
            pendingRouters.put(path, subRouter);
        }
    }

    private void mountRouter(String path, Router subRouter) {
        mainRouter.route(path + "/*").subRouter(subRouter);
        if (logLevel >= 2) vertx.eventBus().publish("log", "Mounted router at path: " + path + ",2,MCPRouterService,Service,System");
    }

    private void mountRegisteredRouters() {
        for (Map.Entry<String, Router> entry : pendingRouters.entrySet()) {
            mountRouter(entry.getKey(), entry.getValue());
        }
        pendingRouters.clear();
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        if (instance == this) {
            instance = null;
        }
        if (httpServer != null) {
            httpServer.close().onComplete(result -> {
                if (result.succeeded()) {
                    stopPromise.complete();
                } else {
                    stopPromise.fail(result.cause());
                }
            });
        } else {
            stopPromise.complete();
        }
    }
}
