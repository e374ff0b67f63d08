package io.joblog.server;

import io.joblog.core.Principal;
import io.undertow.server.HttpServerExchange;

import java.util.Objects;
import java.util.Set;

/**
 * Reads the authenticated user name from a header set by a trusted front proxy
 * (the REMOTE_USER convention). Users listed in {@code admins} are elevated.
 * <p>
 * The proxy must strip this header from client requests; otherwise anyone can
 * claim to be an admin.
 */
public final class RemoteUserPrincipalResolver implements PrincipalResolver {

    public static final String DEFAULT_HEADER = "X-Remote-User";

    private final String headerName;
    private final Set<String> admins;

    public RemoteUserPrincipalResolver(String headerName, Set<String> admins) {
        this.headerName = Objects.requireNonNull(headerName, "headerName");
        this.admins = Set.copyOf(admins);
    }

    @Override
    public Principal resolve(HttpServerExchange exchange) {
        String user = exchange.getRequestHeaders().getFirst(headerName);
        if (user == null || user.isBlank()) {
            return Principal.anonymous();
        }
        user = user.trim();
        return admins.contains(user) ? Principal.admin(user) : Principal.user(user);
    }
}
