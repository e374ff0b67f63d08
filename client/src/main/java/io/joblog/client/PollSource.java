package io.joblog.client;

import java.io.IOException;

/**
 * One poll of a job log from a given offset.
 */
@FunctionalInterface
public interface PollSource {

    PollResult poll(long jobId, String logName, long offset) throws IOException, InterruptedException;
}
