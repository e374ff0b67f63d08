package io.joblog.core;

import java.util.Objects;

/**
 * Picks the response shape for a log request.
 * <p>
 * Decision order for the view endpoint:
 *  1) format=raw                 -> RAW_ATTACHMENT (any extension)
 *  2) *.html / *.htm             -> RAW_INLINE
 *  3) allowed text extension     -> RENDERED_SNIPPET
 *  4) anything else              -> FORBIDDEN, see {@link #forbiddenReason()}
 * <p>
 * The poll endpoint always gets JSON_POLL; it serves programmatic clients and
 * has no extension gate.
 */
public final class FormatNegotiator {

    public static final String RAW_MODE = "raw";

    private final LogFormatConfig config;

    public FormatNegotiator(LogFormatConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public ResponseShape choose(String outputMode, String logName) {
        Objects.requireNonNull(logName, "logName");
        if (RAW_MODE.equals(outputMode)) {
            return ResponseShape.RAW_ATTACHMENT;
        }
        if (LogNames.isHtml(logName)) {
            return ResponseShape.RAW_INLINE;
        }
        if (LogNames.endsWithAny(logName, config.allowedLogExtensions())) {
            return ResponseShape.RENDERED_SNIPPET;
        }
        return ResponseShape.FORBIDDEN;
    }

    public ResponseShape poll() {
        return ResponseShape.JSON_POLL;
    }

    /** Message for FORBIDDEN, listing what the caller may ask for instead. */
    public String forbiddenReason() {
        return "Can display only specific file types: " + String.join(", ", config.allowedLogExtensions());
    }

    public LogFormatConfig config() {
        return config;
    }
}
