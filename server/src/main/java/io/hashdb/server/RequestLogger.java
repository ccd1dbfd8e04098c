package io.hashdb.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Central place for request-level logging of RPCs and admin HTTP calls.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed RPC.
     *
     * @param method      RPC name (Set, Get, Flush, ...)
     * @param outcome     result code name, or the gRPC status code when the call failed
     * @param totalMillis wall-clock latency of the call
     * @param error       exception that failed the call, null if none
     */
    public static void logRpc(String method, String outcome, long totalMillis, Throwable error) {
        String msg = String.format("RPC %s -> %s (total=%dms)", method, outcome, totalMillis);
        if (error != null) {
            log.log(Level.WARNING, msg, error);
        } else {
            log.log(Level.INFO, msg);
        }
    }

    /** Log a completed admin HTTP request. 5xx answers are warnings. */
    public static void logHttp(String method, String path, int status, long totalMillis, Throwable error) {
        String msg = String.format("HTTP %s %s -> %d (total=%dms)", method, path, status, totalMillis);
        if (error != null && status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (status >= 500) {
            log.log(Level.WARNING, msg);
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
