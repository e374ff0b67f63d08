package io.joblog.core;

/**
 * The ways a log can be delivered.
 */
public enum ResponseShape {
    /** Remaining bytes as a download with the log's file name. */
    RAW_ATTACHMENT,
    /** Remaining bytes rendered by the browser (HTML reports). */
    RAW_INLINE,
    /** Decoded text plus the offset to continue from. */
    RENDERED_SNIPPET,
    /** Machine-readable poll payload for tailing clients. */
    JSON_POLL,
    /** Extension not allowed for display. */
    FORBIDDEN
}
