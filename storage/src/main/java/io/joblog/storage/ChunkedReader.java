package io.joblog.storage;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.zip.GZIPInputStream;

import static java.nio.file.StandardOpenOption.READ;

/**
 * Reads a {@link LogResource} from a byte offset without loading it into memory.
 * <p>
 * Two access paths:
 *  - stream():  lazy chunks for the raw/inline responses; the response writer
 *               pulls one chunk at a time, so a slow client slows the reader.
 *  - readAll(): eager, bounded read for the text shapes (snippet, poll).
 * <p>
 * Both stop at the resource's size snapshot, so the bytes produced always agree
 * with a Content-Length computed from the same {@link LogResource}. Archives
 * are decompressed on the fly; offsets count decompressed bytes.
 */
public final class ChunkedReader {
    private static final Logger log = Logger.getLogger(ChunkedReader.class.getName());

    public static final int DEFAULT_CHUNK_BYTES = 1024 * 1024; // 1 MiB

    private final int chunkBytes;

    public ChunkedReader() {
        this(DEFAULT_CHUNK_BYTES);
    }

    public ChunkedReader(int chunkBytes) {
        if (chunkBytes <= 0) throw new IllegalArgumentException("chunkBytes must be > 0");
        this.chunkBytes = chunkBytes;
    }

    public int chunkBytes() {
        return chunkBytes;
    }

    /**
     * Open a chunk sequence from {@code offset} to the end of the size snapshot.
     * Returns an empty sequence if {@code offset} is at or past the end, or if the
     * file can no longer be opened.
     */
    public ChunkStream stream(LogResource resource, long offset) {
        return open(resource, offset, resource.remainingFrom(offset));
    }

    /**
     * Read up to {@code maxBytes} from {@code offset}, eagerly.
     *
     * @return the bytes read; shorter than requested when the log ends first
     */
    public byte[] readAll(LogResource resource, long offset, int maxBytes) {
        if (maxBytes < 0) throw new IllegalArgumentException("maxBytes must be >= 0");
        long limit = Math.min(resource.remainingFrom(offset), maxBytes);
        ByteArrayOutputStream out = new ByteArrayOutputStream((int) Math.min(limit, chunkBytes));
        try (ChunkStream chunks = open(resource, offset, limit)) {
            while (chunks.hasNext()) {
                LogChunk chunk = chunks.next();
                out.write(chunk.data(), 0, chunk.length());
            }
        }
        return out.toByteArray();
    }

    private ChunkStream open(LogResource resource, long offset, long limit) {
        if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
        if (limit <= 0) {
            return ChunkStream.empty(offset);
        }
        try {
            InputStream in = resource.compressed()
                    ? openArchive(resource, offset)
                    : openPlain(resource, offset);
            return new ChunkStream(in, resource.path(), offset, limit, chunkBytes);
        } catch (IOException e) {
            log.log(Level.FINE, "could not open " + resource.path() + " at offset " + offset + ", serving empty", e);
            return ChunkStream.empty(offset);
        }
    }

    private static InputStream openPlain(LogResource resource, long offset) throws IOException {
        FileChannel ch = FileChannel.open(resource.path(), READ);
        try {
            ch.position(offset);
            return Channels.newInputStream(ch);
        } catch (IOException e) {
            ch.close();
            throw e;
        }
    }

    private static InputStream openArchive(LogResource resource, long offset) throws IOException {
        InputStream raw = Files.newInputStream(resource.path(), READ);
        GZIPInputStream gz;
        try {
            gz = new GZIPInputStream(new BufferedInputStream(raw));
        } catch (IOException e) {
            raw.close();
            throw e;
        }
        try {
            gz.skipNBytes(offset);
            return gz;
        } catch (IOException e) {
            gz.close();
            throw e;
        }
    }
}
