package io.joblog.core;

import java.util.List;

/**
 * Read-only view of a background job, as far as log retrieval cares.
 * <p>
 * The job lifecycle (creation, state transitions, completion) is owned elsewhere;
 * this module only reads:
 *  - id:        unique job identifier.
 *  - finished:  true once the job will not append to its logs anymore.
 *  - logNames:  relative names of the logs the job has produced so far, in a stable order.
 */
public interface Job {

    long id();

    boolean finished();

    List<String> logNames();
}
