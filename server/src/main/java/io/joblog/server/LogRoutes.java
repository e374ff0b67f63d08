package io.joblog.server;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * URL layout of the HTTP API.
 *
 *   GET /jobs/{id}/logs                    visible log names of a job
 *   GET /jobs/{id}/log/{logName}           raw download (format=raw), inline HTML or text snippet
 *   GET /jobs/{id}/log-json/{logName}      JSON poll for tailing clients
 *   GET /admin/health                      liveness
 *
 * {logName} may contain '/' (logs in sub-directories); each segment is URL-encoded.
 */
public final class LogRoutes {

    public static final String JOBS_PREFIX = "/jobs/";
    public static final String LOGS = "logs";
    public static final String VIEW = "log/";
    public static final String POLL = "log-json/";
    public static final String HEALTH = "/admin/health";

    private LogRoutes() {
        // utility
    }

    public static String viewPath(long jobId, String logName) {
        return JOBS_PREFIX + jobId + "/" + VIEW + encodeSegments(logName);
    }

    public static String pollPath(long jobId, String logName) {
        return JOBS_PREFIX + jobId + "/" + POLL + encodeSegments(logName);
    }

    static String encodeSegments(String logName) {
        String[] segments = logName.split("/", -1);
        StringBuilder sb = new StringBuilder(logName.length() + 8);
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) sb.append('/');
            sb.append(URLEncoder.encode(segments[i], StandardCharsets.UTF_8).replace("+", "%20"));
        }
        return sb.toString();
    }
}
