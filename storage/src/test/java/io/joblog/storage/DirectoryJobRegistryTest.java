package io.joblog.storage;

import io.joblog.core.Job;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class DirectoryJobRegistryTest {

    @TempDir Path root;

    @Test
    void unknown_job_is_empty() {
        var registry = new DirectoryJobRegistry(new JobLayout(root));

        assertTrue(registry.find(99).isEmpty());
        assertTrue(registry.find(-1).isEmpty());
    }

    @Test
    void job_without_state_file_is_running_and_lists_plain_names() throws Exception {
        var layout = new JobLayout(root);
        Fixtures.write(layout.logDir(42).resolve("stdout.log"), new byte[]{1});
        Fixtures.writeGzip(layout.logDir(42).resolve("build.log.gz"), new byte[]{2});
        Fixtures.write(layout.logDir(42).resolve("x86_64/traceback.log"), new byte[]{3});

        Optional<Job> job = new DirectoryJobRegistry(layout).find(42);

        assertTrue(job.isPresent());
        assertEquals(42L, job.get().id());
        assertFalse(job.get().finished());
        assertEquals(List.of("build.log", "stdout.log", "x86_64/traceback.log"), job.get().logNames());
    }

    @Test
    void state_file_marks_job_finished_and_each_lookup_rereads_it() throws Exception {
        var layout = new JobLayout(root);
        Files.createDirectories(layout.jobDir(7));
        var registry = new DirectoryJobRegistry(layout);

        assertFalse(registry.find(7).orElseThrow().finished());

        Files.writeString(layout.stateFile(7), "{\"finished\": true, \"owner\": \"bob\"}");

        assertTrue(registry.find(7).orElseThrow().finished());
        assertEquals(List.of(), registry.find(7).orElseThrow().logNames());
    }

    @Test
    void half_written_state_file_reads_as_running() throws Exception {
        var layout = new JobLayout(root);
        Files.createDirectories(layout.jobDir(7));
        Files.writeString(layout.stateFile(7), "{ \"finish");

        Job job = new DirectoryJobRegistry(layout).find(7).orElseThrow();

        assertFalse(job.finished());
    }

    @Test
    void listing_survives_logs_being_replaced_concurrently() throws Exception {
        var layout = new JobLayout(root);
        Path logs = layout.logDir(7);
        Files.createDirectories(logs.resolve("arch"));
        Fixtures.write(logs.resolve("build.log"), new byte[]{1});
        var registry = new DirectoryJobRegistry(layout);

        AtomicBoolean stop = new AtomicBoolean();
        Thread rotator = new Thread(() -> {
            int i = 0;
            while (!stop.get()) {
                Path f = logs.resolve("arch/f" + (i++ % 50) + ".log");
                try {
                    Files.write(f, new byte[]{2});
                    Files.deleteIfExists(f);
                } catch (IOException ignored) {
                    // the directory walk may hold the entry; try the next name
                }
            }
        });
        rotator.start();
        try {
            for (int n = 0; n < 2000; n++) {
                List<String> names = registry.find(7).orElseThrow().logNames();
                assertTrue(names.contains("build.log"));
            }
        } finally {
            stop.set(true);
            rotator.join();
        }
    }

    @Test
    void log_list_is_walked_on_first_use() throws Exception {
        var layout = new JobLayout(root);
        Files.createDirectories(layout.logDir(7));
        Job job = new DirectoryJobRegistry(layout).find(7).orElseThrow();

        Fixtures.write(layout.logDir(7).resolve("late.log"), new byte[]{1});

        assertEquals(List.of("late.log"), job.logNames());
    }
}
