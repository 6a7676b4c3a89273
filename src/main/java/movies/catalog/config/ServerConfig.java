package movies.catalog.config;

import io.vertx.core.json.JsonObject;

import java.util.function.UnaryOperator;

/**
 * Process-wide settings of the catalog tool server.
 *
 * <p>Values are looked up as system properties first (where dotenv puts the contents of
 * <code>.env.local</code>), then as OS environment variables, then fall back to defaults.
 * Verticles receive the relevant subset through their deployment config.</p>
 */
public class ServerConfig {

    public static final String HTTP_PORT = "CATALOG_HTTP_PORT";
    public static final String CONTEXT_TTL_SECONDS = "CATALOG_CONTEXT_TTL_SECONDS";
    public static final String DEFAULT_PAGE_SIZE = "CATALOG_DEFAULT_PAGE_SIZE";
    public static final String MAX_PAGE_SIZE = "CATALOG_MAX_PAGE_SIZE";
    public static final String SWEEP_INTERVAL_MS = "CATALOG_SWEEP_INTERVAL_MS";
    public static final String DATA_PATH = "CATALOG_DATA_PATH";
    public static final String LOG_LEVEL = "CATALOG_LOG_LEVEL";

    private final int httpPort;
    private final long contextTtlSeconds;
    private final int defaultPageSize;
    private final int maxPageSize;
    private final long sweepIntervalMs;
    private final String dataPath;
    private final int logLevel;

    public ServerConfig(int httpPort, long contextTtlSeconds, int defaultPageSize, int maxPageSize,
                        long sweepIntervalMs, String dataPath, int logLevel) {
        this.httpPort = httpPort;
        this.contextTtlSeconds = contextTtlSeconds;
        this.defaultPageSize = defaultPageSize;
        this.maxPageSize = maxPageSize;
        this.sweepIntervalMs = sweepIntervalMs;
        this.dataPath = dataPath;
        this.logLevel = logLevel;
    }

    public static ServerConfig load() {
        return load(ServerConfig::lookup);
    }

    /**
     * Build from an arbitrary key lookup. A value that is present but not a number fails
     * fast, so a typo in <code>.env.local</code> does not silently become the default.
     */
    public static ServerConfig load(UnaryOperator<String> source) {
        return new ServerConfig(
            readInt(source, HTTP_PORT, 8080),
            readLong(source, CONTEXT_TTL_SECONDS, 3600),
            readInt(source, DEFAULT_PAGE_SIZE, 50),
            readInt(source, MAX_PAGE_SIZE, 1000),
            readLong(source, SWEEP_INTERVAL_MS, 60_000),
            readString(source, DATA_PATH, "./data/catalog"),
            readInt(source, LOG_LEVEL, 3)
        );
    }

    private static String lookup(String key) {
        String value = System.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            value = System.getenv(key);
        }
        return value;
    }

    private static String readString(UnaryOperator<String> source, String key, String defaultValue) {
        String value = source.apply(key);
        return value == null || value.trim().isEmpty() ? defaultValue : value.trim();
    }

    private static int readInt(UnaryOperator<String> source, String key, int defaultValue) {
        long value = readLong(source, key, defaultValue);
        try {
            return Math.toIntExact(value);
        } catch (ArithmeticException e) {
            throw new IllegalStateException(
                "Configuration '" + key + "' is out of range: " + value, e);
        }
    }

    private static long readLong(UnaryOperator<String> source, String key, long defaultValue) {
        String value = source.apply(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                "Configuration '" + key + "' must be a whole number but was '" + value + "'", e);
        }
    }

    public int getHttpPort() {
        return httpPort;
    }

    public long getContextTtlSeconds() {
        return contextTtlSeconds;
    }

    public int getDefaultPageSize() {
        return defaultPageSize;
    }

    public int getMaxPageSize() {
        return maxPageSize;
    }

    public long getSweepIntervalMs() {
        return sweepIntervalMs;
    }

    public String getDataPath() {
        return dataPath;
    }

    public int getLogLevel() {
        return logLevel;
    }

    /**
     * Deployment config for the router service.
     */
    public JsonObject routerConfig() {
        return new JsonObject().put("httpPort", httpPort);
    }

    /**
     * Deployment config for the context server.
     */
    public JsonObject contextConfig() {
        return new JsonObject()
            .put("ttlSeconds", contextTtlSeconds)
            .put("defaultPageSize", defaultPageSize)
            .put("maxPageSize", maxPageSize)
            .put("sweepIntervalMs", sweepIntervalMs);
    }

    /**
     * Deployment config for the logger.
     */
    public JsonObject loggerConfig() {
        return new JsonObject().put("logsDir", dataPath + "/logs");
    }

    public JsonObject toJsonObject() {
        return new JsonObject()
            .put("httpPort", httpPort)
            .put("contextTtlSeconds", contextTtlSeconds)
            .put("defaultPageSize", defaultPageSize)
            .put("maxPageSize", maxPageSize)
            .put("sweepIntervalMs", sweepIntervalMs)
            .put("dataPath", dataPath)
            .put("logLevel", logLevel);
    }
}
