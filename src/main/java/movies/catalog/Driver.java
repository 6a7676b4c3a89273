package movies.catalog;

import io.github.cdimascio.dotenv.Dotenv;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.json.JsonObject;

import movies.catalog.config.ServerConfig;
import movies.catalog.mcp.servers.ContextServer;
import movies.catalog.mcp.servers.ValidationServer;
import movies.catalog.services.Logger;
import movies.catalog.services.MCPRouterService;

import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public class Driver {
  public static int logLevel = 3; // 0=errors, 1=info, 2=detail, 3=debug, 4=data
  // created in main()
  public static Vertx vertx;

  // Emergency log buffer - captures logs before Logger is ready
  private static final int EMERGENCY_BUFFER_SIZE = 500;
  private static final List<String> emergencyLogBuffer = Collections.synchronizedList(new LinkedList<>());
  private static volatile boolean loggerReady = false;

  private final ServerConfig config;
  private boolean serversDeployed = false;

  private Driver(ServerConfig config) {
    this.config = config;
  }

  /**
   * Captures log messages to the emergency buffer, or publishes directly once the logger is ready.
   * Keeps the last EMERGENCY_BUFFER_SIZE entries.
   */
  public static void captureOrPublishLog(String message) {
    if (!loggerReady) {
      synchronized (emergencyLogBuffer) {
        if (emergencyLogBuffer.size() >= EMERGENCY_BUFFER_SIZE) {
          emergencyLogBuffer.remove(0);
        }
        emergencyLogBuffer.add(message);
      }
    } else {
      vertx.eventBus().publish("log", message);
    }
  }

  private static void flushEmergencyBuffer() {
    synchronized (emergencyLogBuffer) {
      for (String entry : emergencyLogBuffer) {
        vertx.eventBus().publish("log", entry);
      }
      emergencyLogBuffer.clear();
    }
  }

  public static void main(String[] args) {
    captureOrPublishLog("=== Movie Catalog MCP Server Starting ===,1,Driver,System,System");
    captureOrPublishLog("Java version: " + System.getProperty("java.version") + ",2,Driver,System,System");
    captureOrPublishLog("Working directory: " + System.getProperty("user.dir") + ",2,Driver,System,System");

    loadEnvironment();
    vertx = Vertx.vertx(new VertxOptions()
        .setWorkerPoolSize(4)
        .setEventLoopPoolSize(1));

    ServerConfig config;
    try {
      config = ServerConfig.load();
    } catch (IllegalStateException e) {
      System.err.println("FATAL: " + e.getMessage());
      System.exit(1);
      return;
    }
    logLevel = config.getLogLevel();

    // Logger goes first so nothing after this point is lost
    System.out.println("Deploying Logger as first component...");
    vertx.deployVerticle(new Logger(), new DeploymentOptions().setConfig(config.loggerConfig()), res -> {
      if (res.succeeded()) {
        loggerReady = true;
        flushEmergencyBuffer();
        captureOrPublishLog("Logger ready - emergency buffer flushed,2,Driver,StartUp,System");
        new Driver(config).doIt();
      } else {
        System.err.println("FATAL: Logger deployment failed: " + res.cause().getMessage());
        System.exit(1);
      }
    });
  }

  private static void loadEnvironment() {
    // Load .env.local as system properties so ServerConfig sees them
    try {
      Dotenv.configure()
          .filename(".env.local")
          .systemProperties()
          .ignoreIfMissing()
          .load();
      captureOrPublishLog("Loaded environment configuration from .env.local,3,Driver,StartUp,Config");
    } catch (Exception e) {
      captureOrPublishLog("Could not load .env.local file: " + String.valueOf(e.getMessage()).replace(",", ";") + ",1,Driver,StartUp,Config");
      System.err.println("Warning: Could not load .env.local file: " + e.getMessage());
    }
  }

  private void doIt() {
    if (logLevel >= 2) captureOrPublishLog("Configuration: " + config.toJsonObject().encode().replace(",", ";") + ",2,Driver,StartUp,Config");

    installShutdownHook();

    // Servers deploy once the router is listening
    vertx.eventBus().<JsonObject>consumer(MCPRouterService.READY_ADDRESS, msg -> {
      if (serversDeployed) {
        return;
      }
      serversDeployed = true;
      if (logLevel >= 1) captureOrPublishLog("MCP router listening on port " + msg.body().getInteger("port") + ",1,Driver,StartUp,MCP");
      deployServers();
    });

    deployMCPRouter();
  }

  private void deployMCPRouter() {
    if (logLevel >= 1) captureOrPublishLog("Deploying MCP Router Service...,1,Driver,StartUp,MCP");

    vertx.deployVerticle(new MCPRouterService(), new DeploymentOptions().setConfig(config.routerConfig()), res -> {
      if (res.succeeded()) {
        if (logLevel >= 3) captureOrPublishLog("MCPRouterService deployed,3,Driver,StartUp,MCP");
      } else {
        captureOrPublishLog("MCPRouterService deployment failed: " + res.cause().getMessage() + ",0,Driver,StartUp,MCP");
        System.err.println("MCPRouterService deployment failed: " + res.cause().getMessage());
      }
    });
  }

  private void deployServers() {
    vertx.deployVerticle(new ValidationServer(), res -> {
      if (res.succeeded()) {
        if (logLevel >= 2) captureOrPublishLog("ValidationServer deployed,2,Driver,StartUp,MCP");
      } else {
        captureOrPublishLog("ValidationServer deployment failed: " + res.cause().getMessage() + ",0,Driver,StartUp,MCP");
      }
    });

    vertx.deployVerticle(new ContextServer(), new DeploymentOptions().setConfig(config.contextConfig()), res -> {
      if (res.succeeded()) {
        if (logLevel >= 2) captureOrPublishLog("ContextServer deployed,2,Driver,StartUp,MCP");
      } else {
        captureOrPublishLog("ContextServer deployment failed: " + res.cause().getMessage() + ",0,Driver,StartUp,MCP");
      }
    });
  }

  private void installShutdownHook() {
    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      System.out.println("Shutting down - flushing logs");
      CountDownLatch latch = new CountDownLatch(1);
      vertx.eventBus().request(Logger.FLUSH_ADDRESS, "flush", ar -> latch.countDown());
      try {
        latch.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      vertx.close();
    }));
  }
}
