package io.joblog.server;

/**
 * Tuning for {@link LogEndpoint}.
 *
 * @param maxInlineBytes       upper bound of bytes read per snippet or poll request
 * @param snippetOffsetPadding added to the next offset of a rendered snippet; 0 continues
 *                             exactly after the last byte shown, 1 reproduces the historic
 *                             "+1" arithmetic some existing pollers were built against
 */
public record EndpointConfig(int maxInlineBytes, int snippetOffsetPadding) {

    public static final int DEFAULT_MAX_INLINE_BYTES = 4 * 1024 * 1024; // 4 MiB

    public EndpointConfig {
        if (maxInlineBytes <= 0) throw new IllegalArgumentException("maxInlineBytes must be > 0");
        if (snippetOffsetPadding < 0) throw new IllegalArgumentException("snippetOffsetPadding must be >= 0");
    }

    public static EndpointConfig defaults() {
        return new EndpointConfig(DEFAULT_MAX_INLINE_BYTES, 0);
    }
}
