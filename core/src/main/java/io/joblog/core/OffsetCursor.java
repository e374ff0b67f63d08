package io.joblog.core;

/**
 * Byte position into a log, owned by the caller between polls.
 * <p>
 * Invariants:
 *  - value >= 0.
 *  - advance() never moves backwards, so a polling session is monotonic.
 */
public record OffsetCursor(long value) {

    public static final OffsetCursor START = new OffsetCursor(0);

    public OffsetCursor {
        if (value < 0) throw new IllegalArgumentException("offset must be >= 0");
    }

    /**
     * Parse the "offset" query parameter. Missing or blank means 0.
     *
     * @throws IllegalArgumentException if the value is not a non-negative integer
     */
    public static OffsetCursor parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return START;
        }
        try {
            return new OffsetCursor(Long.parseLong(raw.trim()));
        } catch (NumberFormatException nfe) {
            throw new IllegalArgumentException("offset must be an integer", nfe);
        }
    }

    /** Move forward by {@code bytes}, saturating at {@link Long#MAX_VALUE}. */
    public OffsetCursor advance(long bytes) {
        if (bytes < 0) throw new IllegalArgumentException("bytes must be >= 0");
        long next = value + bytes;
        return new OffsetCursor(next < value ? Long.MAX_VALUE : next);
    }
}
