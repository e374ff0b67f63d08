package io.joblog.core;

/**
 * Outcome of an {@link AccessPolicy} check. {@code reason} is meant for the caller.
 */
public record AccessVerdict(boolean allowed, String reason) {

    private static final AccessVerdict ALLOWED = new AccessVerdict(true, "");

    public static AccessVerdict allow() {
        return ALLOWED;
    }

    public static AccessVerdict deny(String reason) {
        return new AccessVerdict(false, reason);
    }
}
