package io.joblog.server;

import io.joblog.server.dto.SnippetContext;

/**
 * Turns a snippet context into a response body. The HTML page layer plugs in
 * here; the server ships with {@link JsonSnippetRenderer}.
 */
public interface SnippetRenderer {

    Rendered render(SnippetContext context);

    record Rendered(String contentType, byte[] body) {
    }
}
