package io.joblog.core;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Configuration for {@link FormatNegotiator}.
 *
 * @param allowedLogExtensions extensions (including the dot) that may be shown as
 *                             text snippets; iteration order is kept for error messages
 */
public record LogFormatConfig(Set<String> allowedLogExtensions) {

    public static final List<String> DEFAULT_EXTENSIONS = List.of(".log");

    public LogFormatConfig {
        if (allowedLogExtensions == null || allowedLogExtensions.isEmpty()) {
            throw new IllegalArgumentException("allowedLogExtensions must not be empty");
        }
        for (String ext : allowedLogExtensions) {
            if (ext == null || ext.isBlank()) {
                throw new IllegalArgumentException("extension must not be blank");
            }
        }
        allowedLogExtensions = Collections.unmodifiableSet(new LinkedHashSet<>(allowedLogExtensions));
    }

    public static LogFormatConfig defaults() {
        return of(DEFAULT_EXTENSIONS);
    }

    public static LogFormatConfig of(List<String> extensions) {
        return new LogFormatConfig(new LinkedHashSet<>(extensions));
    }
}
