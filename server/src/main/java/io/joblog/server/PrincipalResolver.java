package io.joblog.server;

import io.joblog.core.Principal;
import io.undertow.server.HttpServerExchange;

/**
 * Establishes who is calling. Authentication itself happens in front of this
 * server (SSO proxy, Kerberos gateway); implementations only read its result.
 */
public interface PrincipalResolver {

    Principal resolve(HttpServerExchange exchange);
}
