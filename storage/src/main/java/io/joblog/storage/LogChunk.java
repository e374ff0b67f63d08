package io.joblog.storage;

/**
 * One bounded slice of a log, starting at {@code offset}.
 * <p>
 * Chunks are handed straight to the response writer and dropped; the array
 * is not copied and must not be modified by consumers.
 */
public record LogChunk(long offset, byte[] data) {

    public int length() {
        return data.length;
    }

    /** Offset of the first byte after this chunk. */
    public long end() {
        return offset + data.length;
    }
}
