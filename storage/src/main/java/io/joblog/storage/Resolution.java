package io.joblog.storage;

import java.util.Objects;

/**
 * Result of {@link LogStore#resolve}: the plain file, its compressed archive, or nothing.
 */
public record Resolution(Kind kind, LogResource resource) {

    public enum Kind { PLAIN, COMPRESSED, NOT_FOUND }

    private static final Resolution NOT_FOUND = new Resolution(Kind.NOT_FOUND, null);

    public Resolution {
        Objects.requireNonNull(kind, "kind");
        if ((kind == Kind.NOT_FOUND) != (resource == null)) {
            throw new IllegalArgumentException("resource must be present unless NOT_FOUND");
        }
    }

    public static Resolution plain(LogResource resource) {
        return new Resolution(Kind.PLAIN, resource);
    }

    public static Resolution compressed(LogResource resource) {
        return new Resolution(Kind.COMPRESSED, resource);
    }

    public static Resolution notFound() {
        return NOT_FOUND;
    }

    public boolean found() {
        return kind != Kind.NOT_FOUND;
    }
}
