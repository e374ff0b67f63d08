package io.joblog.storage;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Physical handle for one (job, log name) pair, valid for a single request.
 * <p>
 * Not cached: the file may still be growing, so every request resolves again.
 *
 * @param path       absolute path of the file that exists on disk
 * @param compressed true if {@code path} is a gzip archive of the log
 * @param size       log length in bytes at resolution time (decompressed length for
 *                   archives); 0 if the size could not be probed
 */
public record LogResource(Path path, boolean compressed, long size) {

    public LogResource {
        Objects.requireNonNull(path, "path");
        if (size < 0) throw new IllegalArgumentException("size must be >= 0");
    }

    /** Bytes available from {@code offset} to the end of the size snapshot, never negative. */
    public long remainingFrom(long offset) {
        return Math.max(0L, size - offset);
    }
}
