package io.joblog.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Rendering context for the text view of a log (GET /jobs/{id}/log/{logName}).
 * <p>
 * json_url points at the poll endpoint of the same log; a page rendered from
 * this context keeps tailing by polling json_url starting at offset.
 */
public class SnippetContext {
    public String title;

    @JsonProperty("job_id")
    public long jobId;

    public long offset;

    @JsonProperty("task_finished")
    public int taskFinished;

    public String content;

    @JsonProperty("log_name")
    public String logName;

    @JsonProperty("json_url")
    public String jsonUrl;
}
