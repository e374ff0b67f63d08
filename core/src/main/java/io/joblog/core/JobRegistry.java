package io.joblog.core;

import java.util.Optional;

/**
 * Lookup of jobs by id.
 * <p>
 * Implementations must not cache job state across calls: a job may finish
 * between two polls and callers rely on seeing that transition.
 */
public interface JobRegistry {

    /**
     * @return the job, or empty if no job with this id exists
     */
    Optional<Job> find(long jobId);
}
