package io.joblog.storage;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPOutputStream;

/** File helpers shared by storage tests. */
final class Fixtures {

    private Fixtures() {
    }

    static Path write(Path file, byte[] content) throws IOException {
        Files.createDirectories(file.getParent());
        return Files.write(file, content);
    }

    static Path writeGzip(Path file, byte[] content) throws IOException {
        Files.createDirectories(file.getParent());
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(file))) {
            out.write(content);
        }
        return file;
    }

    /** One gzip member per part, concatenated, as appending compressors write them. */
    static Path writeGzipMembers(Path file, byte[]... parts) throws IOException {
        Files.createDirectories(file.getParent());
        try (OutputStream raw = Files.newOutputStream(file)) {
            for (byte[] part : parts) {
                GZIPOutputStream member = new GZIPOutputStream(raw);
                member.write(part);
                member.finish();
            }
        }
        return file;
    }

    /** Deterministic, non-repeating-ish content of the given length. */
    static byte[] bytes(int n) {
        byte[] b = new byte[n];
        for (int i = 0; i < n; i++) {
            b[i] = (byte) ('a' + (i * 7 + i / 26) % 26);
        }
        return b;
    }
}
