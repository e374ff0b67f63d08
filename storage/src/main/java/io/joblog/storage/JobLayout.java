package io.joblog.storage;

import java.nio.file.Path;
import java.util.Objects;

/**
 * On-disk layout of job directories under a common root:
 * <pre>
 *   {root}/{jobId}/job.json      job state, see {@link DirectoryJobRegistry}
 *   {root}/{jobId}/logs/...      log files, plain or with a ".gz" suffix once compressed
 * </pre>
 */
public final class JobLayout {

    static final String STATE_FILE = "job.json";
    static final String LOG_DIR = "logs";

    private final Path root;

    public JobLayout(Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    public Path jobDir(long jobId) {
        if (jobId < 0) throw new IllegalArgumentException("jobId must be >= 0");
        return root.resolve(Long.toString(jobId));
    }

    public Path logDir(long jobId) {
        return jobDir(jobId).resolve(LOG_DIR);
    }

    public Path stateFile(long jobId) {
        return jobDir(jobId).resolve(STATE_FILE);
    }
}
