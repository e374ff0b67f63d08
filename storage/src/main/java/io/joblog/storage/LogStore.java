package io.joblog.storage;

import io.joblog.core.Job;

/**
 * Maps (job, log name) to the file that currently holds the log.
 * <p>
 * Contract:
 *  - The plain file wins if it exists.
 *  - Otherwise, unless the name already carries the compressed suffix, the
 *    ".gz" archive of the same name is tried. Finished jobs get their logs
 *    compressed, and callers keep using the plain name.
 *  - Log names are untrusted. A name that does not stay inside the job's log
 *    directory is rejected with IllegalArgumentException.
 *  - Resolution only probes the filesystem; it never creates or modifies files.
 */
public interface LogStore {

    Resolution resolve(Job job, String logName);
}
