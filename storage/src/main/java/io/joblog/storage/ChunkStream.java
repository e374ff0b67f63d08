package io.joblog.storage;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lazy, single-use sequence of {@link LogChunk}s over an open log.
 * <p>
 * Properties:
 *  - Each chunk holds at most {@code chunkBytes} bytes; chunks are contiguous.
 *  - At most {@code limit} bytes are produced in total, fewer if the file ends early.
 *  - A read failure ends the sequence instead of throwing; a still-running job
 *    may rotate its logs and the caller simply polls again.
 *  - The underlying stream is closed as soon as the sequence is exhausted, and
 *    by {@link #close()} when the consumer stops early. Use try-with-resources.
 */
public final class ChunkStream implements Iterator<LogChunk>, AutoCloseable {
    private static final Logger log = Logger.getLogger(ChunkStream.class.getName());

    private final Path path;
    private final int chunkBytes;
    private InputStream in;
    private long position;
    private long remaining;
    private LogChunk pending;

    ChunkStream(InputStream in, Path path, long offset, long limit, int chunkBytes) {
        this.in = in;
        this.path = path;
        this.position = offset;
        this.remaining = limit;
        this.chunkBytes = chunkBytes;
    }

    static ChunkStream empty(long offset) {
        return new ChunkStream(null, null, offset, 0L, 1);
    }

    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (in == null) {
            return false;
        }
        pending = readChunk();
        if (pending == null) {
            close();
        }
        return pending != null;
    }

    @Override
    public LogChunk next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        LogChunk chunk = pending;
        pending = null;
        return chunk;
    }

    /** Offset of the next byte this stream would produce. */
    public long position() {
        return position;
    }

    @Override
    public void close() {
        pending = null;
        if (in == null) {
            return;
        }
        try {
            in.close();
        } catch (IOException e) {
            log.log(Level.FINE, "close failed for " + path, e);
        } finally {
            in = null;
        }
    }

    private LogChunk readChunk() {
        int want = (int) Math.min(chunkBytes, remaining);
        if (want <= 0) {
            return null;
        }
        byte[] buf = new byte[want];
        int n;
        try {
            n = in.readNBytes(buf, 0, want);
        } catch (IOException e) {
            log.log(Level.FINE, "read failed for " + path + " at offset " + position + ", ending stream", e);
            return null;
        }
        if (n <= 0) {
            return null;
        }
        LogChunk chunk = new LogChunk(position, n == want ? buf : Arrays.copyOf(buf, n));
        position += n;
        remaining -= n;
        return chunk;
    }
}
