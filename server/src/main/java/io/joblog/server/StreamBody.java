package io.joblog.server;

import io.joblog.storage.ChunkStream;
import io.joblog.storage.ChunkedReader;
import io.joblog.storage.LogChunk;
import io.joblog.storage.LogResource;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A byte-stream response that has not been read yet.
 * <p>
 * Responsibilities:
 *  - Carry the headers (content type, exact length, optional attachment name).
 *  - Copy the log chunk by chunk into a blocking output stream. Each write
 *    blocks until the client accepts it, so a slow reader throttles the file reads.
 *  - Stop at the first failed write (client disconnected) and release the file.
 */
public final class StreamBody {
    private static final Logger log = Logger.getLogger(StreamBody.class.getName());

    private final ChunkedReader reader;
    private final LogResource resource;
    private final long offset;
    private final String contentType;
    private final String attachmentName; // null for inline delivery

    StreamBody(ChunkedReader reader, LogResource resource, long offset, String contentType, String attachmentName) {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.resource = Objects.requireNonNull(resource, "resource");
        this.offset = offset;
        this.contentType = Objects.requireNonNull(contentType, "contentType");
        this.attachmentName = attachmentName;
    }

    /** Bytes available from the requested offset; 0 if the size probe failed. */
    public long contentLength() {
        return resource.remainingFrom(offset);
    }

    public String contentType() {
        return contentType;
    }

    public boolean attachment() {
        return attachmentName != null;
    }

    public String attachmentName() {
        return attachmentName;
    }

    /**
     * Write the log from the offset to {@code out}.
     *
     * @return number of bytes written; less than {@link #contentLength()} if the
     *         file shrank or vanished, or the client went away
     */
    public long writeTo(OutputStream out) {
        long written = 0;
        try (ChunkStream chunks = reader.stream(resource, offset)) {
            while (chunks.hasNext()) {
                LogChunk chunk = chunks.next();
                try {
                    out.write(chunk.data(), 0, chunk.length());
                } catch (IOException e) {
                    log.log(Level.FINE, "client stopped reading " + resource.path() + " after " + written + " bytes", e);
                    return written;
                }
                written += chunk.length();
            }
        }
        return written;
    }
}
