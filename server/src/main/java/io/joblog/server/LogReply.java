package io.joblog.server;

import io.joblog.server.dto.SnippetContext;

import java.util.Objects;

/**
 * Outcome of a {@link LogEndpoint} call, independent of the HTTP layer.
 * <p>
 * Exactly one payload is set, matching {@code kind}:
 *  - STREAM:    {@code stream}
 *  - SNIPPET:   {@code snippet}
 *  - JSON:      {@code json} (poll payload or log listing)
 *  - FORBIDDEN / NOT_FOUND: {@code reason}
 */
public record LogReply(Kind kind, String reason, StreamBody stream, SnippetContext snippet, Object json) {

    public enum Kind {
        STREAM(200), SNIPPET(200), JSON(200), FORBIDDEN(403), NOT_FOUND(404);

        private final int status;

        Kind(int status) {
            this.status = status;
        }

        public int status() {
            return status;
        }
    }

    public LogReply {
        Objects.requireNonNull(kind, "kind");
    }

    static LogReply stream(StreamBody body) {
        return new LogReply(Kind.STREAM, null, Objects.requireNonNull(body), null, null);
    }

    static LogReply snippet(SnippetContext context) {
        return new LogReply(Kind.SNIPPET, null, null, Objects.requireNonNull(context), null);
    }

    static LogReply json(Object body) {
        return new LogReply(Kind.JSON, null, null, null, Objects.requireNonNull(body));
    }

    static LogReply forbidden(String reason) {
        return new LogReply(Kind.FORBIDDEN, reason, null, null, null);
    }

    static LogReply notFound(String reason) {
        return new LogReply(Kind.NOT_FOUND, reason, null, null, null);
    }

    public int status() {
        return kind.status();
    }
}
