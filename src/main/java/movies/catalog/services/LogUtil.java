package movies.catalog.services;

import io.vertx.core.Vertx;
import movies.catalog.Driver;

/**
 * Helpers that format structured log lines for the event-bus logger.
 * Lines below the configured {@link Driver#logLevel} are dropped before they are published.
 */
public class LogUtil {

    // Log levels matching Driver.logLevel
    public static final int ERROR = 0;
    public static final int INFO = 1;
    public static final int DETAIL = 2;
    public static final int DEBUG = 3;
    public static final int DATA = 4;

    private LogUtil() {
    }

    /**
     * Log an error with exception details; the stack trace follows at debug level.
     */
    public static void logError(Vertx vertx, String message, Throwable throwable, String component, String operation, String category) {
        String fullMessage = message + ": " + throwable.getMessage();
        publish(vertx, fullMessage, ERROR, component, operation, category);

        if (Driver.logLevel >= DEBUG) {
            StringBuilder stackTrace = new StringBuilder();
            for (StackTraceElement element : throwable.getStackTrace()) {
                stackTrace.append(" at ").append(element.toString());
            }
            publish(vertx, "Stack trace:" + stackTrace, DEBUG, component, operation, category);
        }
    }

    public static void logError(Vertx vertx, String message, String component, String operation, String category) {
        publish(vertx, message, ERROR, component, operation, category);
    }

    public static void logInfo(Vertx vertx, String message, String component, String operation, String category) {
        if (Driver.logLevel >= INFO) {
            publish(vertx, message, INFO, component, operation, category);
        }
    }

    public static void logDetail(Vertx vertx, String message, String component, String operation, String category) {
        if (Driver.logLevel >= DETAIL) {
            publish(vertx, message, DETAIL, component, operation, category);
        }
    }

    /**
     * Log a debug message (file only, never console)
     */
    public static void logDebug(Vertx vertx, String message, String component, String operation, String category) {
        if (Driver.logLevel >= DEBUG) {
            publish(vertx, message, DEBUG, component, operation, category);
        }
    }

    private static void publish(Vertx vertx, String message, int level, String component, String operation, String category) {
        if (vertx != null) {
            vertx.eventBus().publish("log", formatLogMessage(message, level, component, operation, category));
        }
    }

    /**
     * Format a line for the CSV logger.
     */
    static String formatLogMessage(String message, int level, String component, String operation, String category) {
        // Commas would shift the CSV columns
        String cleanMessage = String.valueOf(message).replace(",", ";").replace("\n", " ");
        return cleanMessage + "," + level + "," + component + "," + operation + "," + category;
    }
}
