package io.joblog.core;

import java.util.Collection;

/**
 * String helpers for caller-supplied log names ("build.log", "x86_64/traceback.log").
 * Names always use '/' as separator, independent of the platform.
 */
public final class LogNames {

    public static final String COMPRESSED_SUFFIX = ".gz";

    private LogNames() {
        // utility
    }

    /** Last path segment of a log name. */
    public static String baseName(String logName) {
        int slash = logName.lastIndexOf('/');
        return slash < 0 ? logName : logName.substring(slash + 1);
    }

    public static boolean isCompressed(String logName) {
        return logName.endsWith(COMPRESSED_SUFFIX);
    }

    /** Strip the compressed-archive suffix, if any. */
    public static String plainName(String logName) {
        return isCompressed(logName)
                ? logName.substring(0, logName.length() - COMPRESSED_SUFFIX.length())
                : logName;
    }

    public static boolean isHtml(String logName) {
        return logName.endsWith(".html") || logName.endsWith(".htm");
    }

    public static boolean endsWithAny(String logName, Collection<String> extensions) {
        for (String ext : extensions) {
            if (logName.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }
}
