package io.joblog.storage;

import io.joblog.core.Job;
import io.joblog.core.LogNames;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.zip.GZIPInputStream;

import static java.nio.file.StandardOpenOption.READ;

/**
 * {@link LogStore} over the local filesystem, laid out by {@link JobLayout}.
 * <p>
 * Size probing:
 *  - plain file: {@link Files#size} at resolution time.
 *  - gzip archive: the decompressed length, counted by inflating every member.
 *    Archives are not rewritten in place, so the count is cached per
 *    (path, length, mtime).
 *  - a file that disappears between the existence check and the size probe
 *    reports size 0; the next poll sees whatever replaced it.
 */
public final class FileLogStore implements LogStore {
    private static final Logger log = Logger.getLogger(FileLogStore.class.getName());

    private static final int SIZE_CACHE_ENTRIES = 256;

    private final JobLayout layout;
    private final Map<ArchiveKey, Long> archiveSizes = Collections.synchronizedMap(
            new LinkedHashMap<ArchiveKey, Long>(16, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<ArchiveKey, Long> eldest) {
                    return size() > SIZE_CACHE_ENTRIES;
                }
            });

    public FileLogStore(JobLayout layout) {
        this.layout = Objects.requireNonNull(layout, "layout");
    }

    @Override
    public Resolution resolve(Job job, String logName) {
        Objects.requireNonNull(job, "job");
        Path dir = layout.logDir(job.id());

        Path plain = contained(dir, logName);
        if (Files.isRegularFile(plain)) {
            ensureRealPathInside(dir, plain, logName);
            return Resolution.plain(new LogResource(plain, false, plainSize(plain)));
        }

        if (!LogNames.isCompressed(logName)) {
            Path archive = contained(dir, logName + LogNames.COMPRESSED_SUFFIX);
            if (Files.isRegularFile(archive)) {
                ensureRealPathInside(dir, archive, logName);
                return Resolution.compressed(new LogResource(archive, true, archiveSize(archive)));
            }
        }
        return Resolution.notFound();
    }

    /**
     * Resolve {@code logName} against {@code dir} and verify the normalized result
     * stays strictly inside it.
     */
    static Path contained(Path dir, String logName) {
        if (logName == null || logName.isBlank()) {
            throw new IllegalArgumentException("log name must not be empty");
        }
        if (logName.startsWith("/") || logName.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("invalid log name: " + logName);
        }
        Path candidate = dir.resolve(logName).normalize();
        if (!candidate.startsWith(dir) || candidate.equals(dir)) {
            throw new IllegalArgumentException("log name escapes job log directory: " + logName);
        }
        return candidate;
    }

    /** Symlinks inside the log directory must not lead out of it. */
    private static void ensureRealPathInside(Path dir, Path file, String logName) {
        try {
            Path realDir = dir.toRealPath();
            if (!file.toRealPath().startsWith(realDir)) {
                throw new IllegalArgumentException("log name escapes job log directory: " + logName);
            }
        } catch (IOException e) {
            // Vanished between isRegularFile and here; the reader treats it as empty.
            log.log(Level.FINE, "could not canonicalize " + file, e);
        }
    }

    private static long plainSize(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            log.log(Level.FINE, "size probe failed for " + file, e);
            return 0L;
        }
    }

    private long archiveSize(Path archive) {
        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(archive, BasicFileAttributes.class);
        } catch (IOException e) {
            log.log(Level.FINE, "size probe failed for " + archive, e);
            return 0L;
        }
        ArchiveKey key = new ArchiveKey(archive, attrs.size(), attrs.lastModifiedTime().toMillis());
        Long cached = archiveSizes.get(key);
        if (cached != null) {
            return cached;
        }
        long size = decompressedSize(archive);
        archiveSizes.put(key, size);
        return size;
    }

    /**
     * Number of bytes the archive inflates to, across all gzip members.
     * A damaged archive counts what inflates before the damage, which is
     * also what {@link ChunkedReader} will serve from it.
     */
    static long decompressedSize(Path archive) {
        long total = 0L;
        try (InputStream in = new GZIPInputStream(new BufferedInputStream(Files.newInputStream(archive, READ)))) {
            byte[] buf = new byte[64 * 1024];
            int n;
            while ((n = in.read(buf)) != -1) {
                total += n;
            }
        } catch (IOException e) {
            log.log(Level.FINE, "could not inflate " + archive + " past byte " + total, e);
        }
        return total;
    }

    private record ArchiveKey(Path path, long length, long modifiedMillis) {
    }
}
