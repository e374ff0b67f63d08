package io.joblog.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * JSON response for GET /jobs/{id}/logs. Only logs the caller may read are listed.
 */
public class LogListResponse {
    @JsonProperty("job_id")
    public long jobId;

    @JsonProperty("task_finished")
    public int taskFinished;

    public List<String> logs;
}
