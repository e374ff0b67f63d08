package io.joblog.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Request-level logging.
 *
 * Responsibilities:
 *  - Central place to log method/path/status, latency and bytes served.
 *  - 5xx responses are logged at WARNING, with the stack trace when available.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param method      HTTP method
     * @param path        request path
     * @param status      HTTP status code
     * @param totalMillis wall-clock latency for the whole request
     * @param bytes       log bytes served, or -1 if the request did not serve log content
     * @param error       optional exception (for 5xx logging), null if none
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            long bytes,
            Throwable error
    ) {
        String msg = String.format(
                "HTTP %s %s -> %d (total=%dms%s)",
                method,
                path,
                status,
                totalMillis,
                bytes >= 0 ? ", bytes=" + bytes : ""
        );

        if (error != null && status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (status >= 500) {
            log.log(Level.WARNING, msg);
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
