package io.joblog.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.joblog.core.OffsetCursor;
import io.joblog.core.Principal;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;

import java.nio.ByteBuffer;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Thin HTTP adapter over {@link LogEndpoint}.
 *
 * Responsibilities:
 *  - Parse HTTP method + path + query parameters.
 *  - Resolve the calling principal.
 *  - Write the reply: streamed bytes, rendered snippet or JSON.
 *  - Map Java exceptions to HTTP status codes.
 *  - Emit one log line per request.
 *
 * Path layout: see {@link LogRoutes}.
 *
 * Query parameters:
 *   - offset: byte offset to start from (default 0)
 *   - format: "raw" to download the log as an attachment (view endpoint only)
 *
 * All handlers run on worker threads in blocking mode, so log bytes are
 * written to the socket as they are read.
 */
public final class WebServer {

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final LogEndpoint endpoint;
    private final PrincipalResolver principals;
    private final SnippetRenderer renderer;

    /**
     * Default wiring: principal from {@value RemoteUserPrincipalResolver#DEFAULT_HEADER}
     * without admins, snippets as JSON.
     */
    public WebServer(int port, LogEndpoint endpoint) {
        this(port, endpoint,
                new RemoteUserPrincipalResolver(RemoteUserPrincipalResolver.DEFAULT_HEADER, Set.of()),
                new JsonSnippetRenderer());
    }

    public WebServer(int port,
                     LogEndpoint endpoint,
                     PrincipalResolver principals,
                     SnippetRenderer renderer) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.principals = Objects.requireNonNull(principals, "principals");
        this.renderer = Objects.requireNonNull(renderer, "renderer");

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(new BlockingHandler(this::route))
                .build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    private void route(HttpServerExchange exchange) {
        String path = exchange.getRequestPath();
        String method = exchange.getRequestMethod().toString();

        if (LogRoutes.HEALTH.equals(path)) {
            sendJson(exchange, 200, Map.of("status", "ok"));
            RequestLogger.logRequest(method, path, 200, 0, -1, null);
            return;
        }
        if (!path.startsWith(LogRoutes.JOBS_PREFIX)) {
            sendJson(exchange, 404, Map.of("error", "not found"));
            RequestLogger.logRequest(method, path, 404, 0, -1, null);
            return;
        }
        if (!"GET".equals(method)) {
            sendJson(exchange, 405, Map.of("error", "method not allowed"));
            RequestLogger.logRequest(method, path, 405, 0, -1, null);
            return;
        }
        handleJobs(exchange, path.substring(LogRoutes.JOBS_PREFIX.length()));
    }

    /** Dispatch on "{id}/logs", "{id}/log/{name}" and "{id}/log-json/{name}". */
    private void handleJobs(HttpServerExchange ex, String rest) {
        long start = System.nanoTime();
        int status = 200;
        long bytes = -1L;
        Throwable error = null;

        try {
            int slash = rest.indexOf('/');
            if (slash <= 0) {
                status = 404;
                sendJson(ex, status, Map.of("error", "not found"));
                return;
            }
            long jobId = parseJobId(rest.substring(0, slash));
            String action = rest.substring(slash + 1);
            Principal principal = principals.resolve(ex);

            LogReply reply;
            if (LogRoutes.LOGS.equals(action)) {
                reply = endpoint.listLogs(jobId, principal);
            } else if (action.startsWith(LogRoutes.VIEW)) {
                String logName = requireLogName(action.substring(LogRoutes.VIEW.length()));
                OffsetCursor offset = OffsetCursor.parse(firstOrNull(ex.getQueryParameters().get("offset")));
                String format = firstOrNull(ex.getQueryParameters().get("format"));
                reply = endpoint.view(jobId, logName, offset, format, principal);
            } else if (action.startsWith(LogRoutes.POLL)) {
                String logName = requireLogName(action.substring(LogRoutes.POLL.length()));
                OffsetCursor offset = OffsetCursor.parse(firstOrNull(ex.getQueryParameters().get("offset")));
                reply = endpoint.poll(jobId, logName, offset, principal);
            } else {
                status = 404;
                sendJson(ex, status, Map.of("error", "not found"));
                return;
            }

            status = reply.status();
            bytes = write(ex, reply);
        } catch (IllegalArgumentException bad) {
            status = 400;
            error = bad;
            sendJson(ex, status, Map.of("error", String.valueOf(bad.getMessage())));
        } catch (Exception e) {
            status = 500;
            error = e;
            if (!ex.isResponseStarted()) {
                sendJson(ex, status, Map.of("error", e.getClass().getSimpleName(),
                        "message", String.valueOf(e.getMessage())));
            }
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest("GET", ex.getRequestPath(), status, totalMs, bytes, error);
        }
    }

    /** @return log bytes written for streams, -1 otherwise */
    private long write(HttpServerExchange ex, LogReply reply) {
        switch (reply.kind()) {
            case STREAM -> {
                StreamBody body = reply.stream();
                ex.setStatusCode(200);
                ex.getResponseHeaders().put(Headers.CONTENT_TYPE, body.contentType());
                ex.getResponseHeaders().put(Headers.CONTENT_LENGTH, body.contentLength());
                if (body.attachment()) {
                    ex.getResponseHeaders().put(Headers.CONTENT_DISPOSITION,
                            ContentTypes.attachment(body.attachmentName()));
                }
                return body.writeTo(ex.getOutputStream());
            }
            case SNIPPET -> {
                SnippetRenderer.Rendered page = renderer.render(reply.snippet());
                ex.setStatusCode(200);
                ex.getResponseHeaders().put(Headers.CONTENT_TYPE, page.contentType());
                ex.getResponseSender().send(ByteBuffer.wrap(page.body()));
                return -1L;
            }
            case JSON -> {
                sendJson(ex, 200, reply.json());
                return -1L;
            }
            default -> {
                sendJson(ex, reply.status(), Map.of("error", reply.reason()));
                return -1L;
            }
        }
    }

    // ---------- helpers ----------

    private static long parseJobId(String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException nfe) {
            throw new IllegalArgumentException("job id must be an integer", nfe);
        }
    }

    private static String requireLogName(String logName) {
        if (logName.isBlank()) {
            throw new IllegalArgumentException("log name must not be empty");
        }
        return logName;
    }

    private static String firstOrNull(Deque<String> deque) {
        return (deque == null || deque.isEmpty()) ? null : deque.getFirst();
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void sendJson(HttpServerExchange ex, int code, Object body) {
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        try {
            byte[] bytes = json.writeValueAsBytes(body);
            ex.setStatusCode(code);
            ex.getResponseSender().send(ByteBuffer.wrap(bytes));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
