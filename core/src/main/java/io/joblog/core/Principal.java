package io.joblog.core;

import java.util.Objects;

/**
 * The caller a request is executed for.
 *
 * @param name     user name as established by the authentication layer ("anonymous" if none)
 * @param elevated true for administrative principals, which may read traceback logs
 */
public record Principal(String name, boolean elevated) {

    private static final Principal ANONYMOUS = new Principal("anonymous", false);

    public Principal {
        Objects.requireNonNull(name, "name");
    }

    public static Principal anonymous() {
        return ANONYMOUS;
    }

    public static Principal user(String name) {
        return new Principal(name, false);
    }

    public static Principal admin(String name) {
        return new Principal(name, true);
    }
}
