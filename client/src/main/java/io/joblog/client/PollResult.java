package io.joblog.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Client-side view of the poll payload:
 *   { "new_offset": 11, "task_finished": 0, "content": "..." }
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PollResult {
    @JsonProperty("new_offset")
    public long newOffset;

    @JsonProperty("task_finished")
    public int taskFinished;

    public String content;

    public PollResult() {
    }

    public PollResult(long newOffset, int taskFinished, String content) {
        this.newOffset = newOffset;
        this.taskFinished = taskFinished;
        this.content = content;
    }

    public boolean finished() {
        return taskFinished == 1;
    }
}
