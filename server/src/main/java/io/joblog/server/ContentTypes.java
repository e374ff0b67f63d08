package io.joblog.server;

import io.joblog.core.LogNames;
import io.undertow.util.MimeMappings;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Content type and disposition headers derived from a log's file name.
 */
final class ContentTypes {

    static final String OCTET_STREAM = "application/octet-stream";

    private ContentTypes() {
        // utility
    }

    static String guess(String logName) {
        String base = LogNames.baseName(logName);
        int dot = base.lastIndexOf('.');
        if (dot < 0 || dot == base.length() - 1) {
            return OCTET_STREAM;
        }
        String mime = MimeMappings.DEFAULT.getMimeType(base.substring(dot + 1).toLowerCase());
        return mime != null ? mime : OCTET_STREAM;
    }

    /**
     * Content-Disposition value for a download: a quoted ASCII filename for
     * old clients plus the exact UTF-8 name as {@code filename*}.
     */
    static String attachment(String filename) {
        StringBuilder ascii = new StringBuilder(filename.length());
        for (int i = 0; i < filename.length(); i++) {
            char c = filename.charAt(i);
            if (c == '"' || c == '\\') {
                ascii.append('\\').append(c);
            } else if (c < 0x20 || c > 0x7e) {
                ascii.append('_');
            } else {
                ascii.append(c);
            }
        }
        String encoded = URLEncoder.encode(filename, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("*", "%2A");
        return "attachment; filename=\"" + ascii + "\"; filename*=UTF-8''" + encoded;
    }
}
