package io.joblog.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * HTTP client for the job log API.
 *
 *   GET /jobs/{id}/logs                         -> listLogs()
 *   GET /jobs/{id}/log/{logName}?format=raw     -> download()
 *   GET /jobs/{id}/log-json/{logName}?offset=N  -> poll()
 *
 * Responses other than 200 raise {@link LogClientException} with the server's
 * error message.
 */
public final class HttpLogClient implements PollSource {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient http;
    private final String baseUrl;
    private final String userHeader;
    private final String user; // may be null

    public HttpLogClient(String baseUrl, String userHeader, String user) {
        Objects.requireNonNull(baseUrl, "baseUrl");
        this.http = HttpClient.newHttpClient();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.userHeader = Objects.requireNonNull(userHeader, "userHeader");
        this.user = user;
    }

    @Override
    public PollResult poll(long jobId, String logName, long offset) throws IOException, InterruptedException {
        HttpResponse<String> resp = http.send(
                get("/jobs/" + jobId + "/log-json/" + encodeSegments(logName) + "?offset=" + offset),
                HttpResponse.BodyHandlers.ofString());
        ensureOk(resp.statusCode(), resp.body());
        return MAPPER.readValue(resp.body(), PollResult.class);
    }

    public List<String> listLogs(long jobId) throws IOException, InterruptedException {
        HttpResponse<String> resp = http.send(get("/jobs/" + jobId + "/logs"), HttpResponse.BodyHandlers.ofString());
        ensureOk(resp.statusCode(), resp.body());
        return MAPPER.readValue(resp.body(), LogList.class).logs;
    }

    /**
     * Stream the log from {@code offset} into {@code out}.
     *
     * @return number of bytes copied
     */
    public long download(long jobId, String logName, long offset, OutputStream out)
            throws IOException, InterruptedException {
        HttpResponse<InputStream> resp = http.send(
                get("/jobs/" + jobId + "/log/" + encodeSegments(logName) + "?format=raw&offset=" + offset),
                HttpResponse.BodyHandlers.ofInputStream());
        try (InputStream in = resp.body()) {
            if (resp.statusCode() != 200) {
                ensureOk(resp.statusCode(), new String(in.readAllBytes(), StandardCharsets.UTF_8));
            }
            return in.transferTo(out);
        }
    }

    private HttpRequest get(String pathAndQuery) {
        HttpRequest.Builder b = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + pathAndQuery))
                .GET();
        if (user != null && !user.isBlank()) {
            b.header(userHeader, user);
        }
        return b.build();
    }

    private static void ensureOk(int status, String body) {
        if (status == 200) {
            return;
        }
        String message = body;
        try {
            ErrorBody err = MAPPER.readValue(body, ErrorBody.class);
            if (err.error != null) {
                message = err.error;
            }
        } catch (IOException ignoredNotJson) {
            // keep raw body as message
        }
        throw new LogClientException(status, "HTTP " + status + ": " + message);
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

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class LogList {
        @JsonProperty("job_id")
        public long jobId;
        public List<String> logs;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ErrorBody {
        public String error;
    }
}
