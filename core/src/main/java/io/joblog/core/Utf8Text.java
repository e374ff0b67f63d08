package io.joblog.core;

import java.nio.charset.StandardCharsets;

/**
 * Decoding of raw log bytes for the text shapes (snippet and poll).
 * <p>
 * Logs are written by arbitrary tools, so invalid sequences are replaced
 * with U+FFFD instead of failing the request.
 */
public final class Utf8Text {

    private Utf8Text() {
        // utility
    }

    /** Lossy UTF-8 decode of {@code bytes[0, length)}. */
    public static String decode(byte[] bytes, int length) {
        return new String(bytes, 0, length, StandardCharsets.UTF_8);
    }

    /**
     * Length of the longest prefix of {@code bytes} that does not end inside
     * a multi-byte UTF-8 sequence.
     * <p>
     * A log that is still being written can be read while the writer is in the
     * middle of a character. Holding those trailing bytes back lets the next poll
     * decode the character whole. Only the last (at most three) bytes are
     * inspected; malformed data earlier in the buffer is left to {@link #decode}.
     */
    public static int completePrefixLength(byte[] bytes) {
        int n = bytes.length;
        // Walk back over continuation bytes (10xxxxxx), at most 3.
        int i = n - 1;
        int continuation = 0;
        while (i >= 0 && continuation < 3 && (bytes[i] & 0xC0) == 0x80) {
            i--;
            continuation++;
        }
        if (i < 0) {
            return n;
        }
        int lead = bytes[i] & 0xFF;
        int expected;
        if (lead >= 0xF0 && lead <= 0xF7) {
            expected = 3;
        } else if (lead >= 0xE0) {
            expected = lead <= 0xEF ? 2 : 0;
        } else if (lead >= 0xC0) {
            expected = 1;
        } else {
            expected = 0;
        }
        if (expected > continuation) {
            // Truncated sequence at the tail: cut before its lead byte.
            return i;
        }
        return n;
    }
}
