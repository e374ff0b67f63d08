package io.joblog.storage;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.joblog.core.Job;
import io.joblog.core.JobRegistry;
import io.joblog.core.LogNames;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link JobRegistry} backed by the job directories of a {@link JobLayout}.
 * <p>
 * A job exists if its directory exists. Its state comes from "job.json":
 * <pre>
 *   { "finished": true }
 * </pre>
 * A missing or unreadable state file means the job is still running; the
 * runner may be rewriting it. The log list is the set of files under "logs/",
 * with archives reported under their plain name. It is walked only when asked
 * for, and files that vanish during the walk (a log being replaced by its
 * archive) are skipped.
 * <p>
 * Everything is read on each lookup; the job runner updates these files
 * concurrently.
 */
public final class DirectoryJobRegistry implements JobRegistry {
    private static final Logger log = Logger.getLogger(DirectoryJobRegistry.class.getName());

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final JobLayout layout;

    public DirectoryJobRegistry(JobLayout layout) {
        this.layout = Objects.requireNonNull(layout, "layout");
    }

    @Override
    public Optional<Job> find(long jobId) {
        if (jobId < 0 || !Files.isDirectory(layout.jobDir(jobId))) {
            return Optional.empty();
        }
        boolean finished = readState(layout.stateFile(jobId)).finished;
        return Optional.of(new DirectoryJob(jobId, finished, layout.logDir(jobId)));
    }

    private static JobState readState(Path stateFile) {
        if (!Files.isRegularFile(stateFile)) {
            return new JobState();
        }
        try {
            return MAPPER.readValue(stateFile.toFile(), JobState.class);
        } catch (IOException e) {
            log.log(Level.FINE, "unreadable job state " + stateFile + ", treating job as running", e);
            return new JobState();
        }
    }

    static List<String> listLogs(Path logDir) {
        if (!Files.isDirectory(logDir)) {
            return List.of();
        }
        TreeSet<String> names = new TreeSet<>();
        try {
            Files.walkFileTree(logDir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile()) {
                        names.add(LogNames.plainName(logDir.relativize(file).toString().replace('\\', '/')));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    log.log(Level.FINE, "skipping " + file + " while listing logs", e);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException e) {
                    if (e != null) {
                        log.log(Level.FINE, "listing of " + dir + " cut short", e);
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.log(Level.FINE, "could not list " + logDir, e);
        }
        return List.copyOf(names);
    }

    /** Contents of job.json. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class JobState {
        public boolean finished;
    }

    /** Job view whose log list is walked on first use. */
    static final class DirectoryJob implements Job {
        private final long id;
        private final boolean finished;
        private final Path logDir;
        private volatile List<String> logNames;

        DirectoryJob(long id, boolean finished, Path logDir) {
            this.id = id;
            this.finished = finished;
            this.logDir = logDir;
        }

        @Override
        public long id() {
            return id;
        }

        @Override
        public boolean finished() {
            return finished;
        }

        @Override
        public List<String> logNames() {
            List<String> names = logNames;
            if (names == null) {
                names = listLogs(logDir);
                logNames = names;
            }
            return names;
        }
    }
}
