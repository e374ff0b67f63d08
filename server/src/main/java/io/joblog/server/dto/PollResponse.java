package io.joblog.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON response for GET /jobs/{id}/log-json/{logName}.
 *   {
 *     "new_offset": 11,
 *     "task_finished": 0,
 *     "content": "hello\nworld"
 *   }
 * Clients send new_offset back as ?offset= on the next poll.
 */
public class PollResponse {
    @JsonProperty("new_offset")
    public long newOffset;

    @JsonProperty("task_finished")
    public int taskFinished;

    public String content;
}
