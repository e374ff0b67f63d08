package io.joblog.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.joblog.server.dto.SnippetContext;

/**
 * Emits the snippet context as JSON, for front ends that render pages client-side.
 */
public final class JsonSnippetRenderer implements SnippetRenderer {

    private final ObjectMapper json = new ObjectMapper();

    @Override
    public Rendered render(SnippetContext context) {
        try {
            return new Rendered("application/json", json.writeValueAsBytes(context));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to serialize snippet context", e);
        }
    }
}
