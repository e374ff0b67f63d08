package io.joblog.server;

import io.joblog.core.AccessPolicy;
import io.joblog.core.FormatNegotiator;
import io.joblog.core.LogFormatConfig;
import io.joblog.core.OffsetCursor;
import io.joblog.core.Principal;
import io.joblog.server.dto.LogListResponse;
import io.joblog.server.dto.PollResponse;
import io.joblog.server.dto.SnippetContext;
import io.joblog.storage.ChunkedReader;
import io.joblog.storage.FileLogStore;
import io.joblog.storage.JobLayout;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Specs for LogEndpoint over real files.
 *
 * Focus:
 *  - Poll payload and offsets ("hello\nworld" -> new_offset 11).
 *  - Traceback gating is identical for raw, snippet and poll.
 *  - Transparent fallback to the ".gz" archive of a finished job.
 *  - Extension gate for the snippet view.
 *  - Repeated polls are side-effect free and progress without gaps.
 */
class LogEndpointTest {

    @TempDir Path root;

    private JobLayout layout;
    private InMemoryJobs jobs;

    private final Principal bob = Principal.user("bob");
    private final Principal admin = Principal.admin("root");

    @BeforeEach
    void setUp() {
        layout = new JobLayout(root);
        jobs = new InMemoryJobs();
    }

    private LogEndpoint endpoint(EndpointConfig config) {
        return new LogEndpoint(
                jobs,
                new AccessPolicy(),
                new FileLogStore(layout),
                new ChunkedReader(4),
                new FormatNegotiator(LogFormatConfig.defaults()),
                config);
    }

    private LogEndpoint endpoint() {
        return endpoint(EndpointConfig.defaults());
    }

    private Path writeLog(long jobId, String name, String content) throws IOException {
        Path file = layout.logDir(jobId).resolve(name);
        Files.createDirectories(file.getParent());
        return Files.write(file, content.getBytes(StandardCharsets.UTF_8));
    }

    private void writeGzipLog(long jobId, String name, String content) throws IOException {
        Path file = layout.logDir(jobId).resolve(name + ".gz");
        Files.createDirectories(file.getParent());
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(file))) {
            out.write(content.getBytes(StandardCharsets.UTF_8));
        }
    }

    private static PollResponse pollBody(LogReply reply) {
        assertEquals(LogReply.Kind.JSON, reply.kind(), () -> "unexpected reply " + reply);
        return (PollResponse) reply.json();
    }

    private static String streamed(LogReply reply) {
        assertEquals(LogReply.Kind.STREAM, reply.kind(), () -> "unexpected reply " + reply);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        long written = reply.stream().writeTo(out);
        assertEquals(reply.stream().contentLength(), written);
        return out.toString(StandardCharsets.UTF_8);
    }

    // ---------- poll ----------

    @Test
    void poll_returns_content_and_byte_offset() throws Exception {
        jobs.put(42, false, "build.log");
        writeLog(42, "build.log", "hello\nworld");

        PollResponse r = pollBody(endpoint().poll(42, "build.log", OffsetCursor.START, bob));

        assertEquals(11L, r.newOffset);
        assertEquals(0, r.taskFinished);
        assertEquals("hello\nworld", r.content);
    }

    @Test
    void repeated_polls_are_idempotent_and_progressive() throws Exception {
        jobs.put(42, false, "build.log");
        Path file = writeLog(42, "build.log", "line one\n");
        LogEndpoint ep = endpoint();

        PollResponse first = pollBody(ep.poll(42, "build.log", OffsetCursor.START, bob));
        PollResponse again = pollBody(ep.poll(42, "build.log", OffsetCursor.START, bob));
        assertEquals(first.content, again.content);
        assertEquals(first.newOffset, again.newOffset);

        Files.write(file, "line two\n".getBytes(StandardCharsets.UTF_8), StandardOpenOption.APPEND);

        PollResponse next = pollBody(ep.poll(42, "build.log", new OffsetCursor(first.newOffset), bob));
        assertEquals("line two\n", next.content);
        assertEquals(18L, next.newOffset);

        PollResponse idle = pollBody(ep.poll(42, "build.log", new OffsetCursor(next.newOffset), bob));
        assertEquals("", idle.content);
        assertEquals(18L, idle.newOffset);
    }

    @Test
    void poll_past_end_returns_nothing_and_keeps_offset() throws Exception {
        jobs.put(42, true, "build.log");
        writeLog(42, "build.log", "abc");

        PollResponse r = pollBody(endpoint().poll(42, "build.log", new OffsetCursor(100), bob));

        assertEquals("", r.content);
        assertEquals(100L, r.newOffset);
        assertEquals(1, r.taskFinished);
    }

    @Test
    void poll_has_no_extension_gate() throws Exception {
        jobs.put(42, false, "core.bin");
        writeLog(42, "core.bin", "bytes");

        assertEquals("bytes", pollBody(endpoint().poll(42, "core.bin", OffsetCursor.START, bob)).content);
    }

    @Test
    void poll_is_bounded_and_resumes_where_it_stopped() throws Exception {
        jobs.put(42, false, "build.log");
        writeLog(42, "build.log", "0123456789");
        LogEndpoint ep = endpoint(new EndpointConfig(4, 0));

        PollResponse a = pollBody(ep.poll(42, "build.log", OffsetCursor.START, bob));
        PollResponse b = pollBody(ep.poll(42, "build.log", new OffsetCursor(a.newOffset), bob));

        assertEquals("0123", a.content);
        assertEquals("4567", b.content);
        assertEquals(8L, b.newOffset);
    }

    @Test
    void running_job_holds_back_half_written_character() throws Exception {
        jobs.put(42, false, "build.log");
        byte[] euro = "ok €".getBytes(StandardCharsets.UTF_8); // 3 + 3 bytes
        Path file = layout.logDir(42).resolve("build.log");
        Files.createDirectories(file.getParent());
        Files.write(file, Arrays.copyOf(euro, 5));

        PollResponse partial = pollBody(endpoint().poll(42, "build.log", OffsetCursor.START, bob));
        assertEquals("ok ", partial.content);
        assertEquals(3L, partial.newOffset);

        Files.write(file, Arrays.copyOfRange(euro, 5, 6), StandardOpenOption.APPEND);

        PollResponse rest = pollBody(endpoint().poll(42, "build.log", new OffsetCursor(partial.newOffset), bob));
        assertEquals("€", rest.content);
        assertEquals(6L, rest.newOffset);
    }

    @Test
    void finished_job_consumes_trailing_garbage_with_replacement() throws Exception {
        jobs.put(42, true, "build.log");
        Path file = layout.logDir(42).resolve("build.log");
        Files.createDirectories(file.getParent());
        Files.write(file, new byte[]{'o', 'k', (byte) 0xE2, (byte) 0x82});

        PollResponse r = pollBody(endpoint().poll(42, "build.log", OffsetCursor.START, bob));

        assertEquals(4L, r.newOffset);
        assertTrue(r.content.startsWith("ok"));
        assertTrue(r.content.contains("�"));
    }

    // ---------- access parity ----------

    @Test
    void traceback_is_forbidden_for_regular_users_in_every_mode() throws Exception {
        jobs.put(42, false, "traceback.log");
        writeLog(42, "traceback.log", "secret");
        LogEndpoint ep = endpoint();

        List<LogReply> replies = List.of(
                ep.view(42, "traceback.log", OffsetCursor.START, "raw", bob),
                ep.view(42, "traceback.log", OffsetCursor.START, null, bob),
                ep.poll(42, "traceback.log", OffsetCursor.START, bob),
                ep.view(42, "arch/traceback.html", OffsetCursor.START, null, bob));

        for (LogReply r : replies) {
            assertEquals(LogReply.Kind.FORBIDDEN, r.kind());
            assertEquals(403, r.status());
            assertEquals("Traceback is available only for superusers.", r.reason());
        }
    }

    @Test
    void traceback_check_runs_before_job_lookup() {
        LogReply r = endpoint().poll(999, "traceback.log", OffsetCursor.START, Principal.anonymous());

        assertEquals(LogReply.Kind.FORBIDDEN, r.kind());
    }

    @Test
    void traceback_is_readable_by_admins_in_every_mode() throws Exception {
        jobs.put(42, false, "traceback.log");
        writeLog(42, "traceback.log", "secret");
        LogEndpoint ep = endpoint();

        assertEquals("secret", streamed(ep.view(42, "traceback.log", OffsetCursor.START, "raw", admin)));
        assertEquals("secret", ep.view(42, "traceback.log", OffsetCursor.START, null, admin).snippet().content);
        assertEquals("secret", pollBody(ep.poll(42, "traceback.log", OffsetCursor.START, admin)).content);
    }

    // ---------- compressed fallback ----------

    @Test
    void finished_job_serves_compressed_log_transparently() throws Exception {
        String content = "step 1\nstep 2\nstep 3\n";
        jobs.put(42, true, "build.log");
        writeGzipLog(42, "build.log", content);
        LogEndpoint ep = endpoint();

        PollResponse fromStart = pollBody(ep.poll(42, "build.log", OffsetCursor.START, bob));
        assertEquals(content, fromStart.content);
        assertEquals(content.length(), fromStart.newOffset);
        assertEquals(1, fromStart.taskFinished);

        PollResponse fromMiddle = pollBody(ep.poll(42, "build.log", new OffsetCursor(7), bob));
        assertEquals("step 2\nstep 3\n", fromMiddle.content);

        LogReply raw = ep.view(42, "build.log", new OffsetCursor(7), "raw", bob);
        assertEquals(content.length() - 7, raw.stream().contentLength());
        assertEquals("step 2\nstep 3\n", streamed(raw));
        assertEquals("build.log", raw.stream().attachmentName());

        assertEquals(content, ep.view(42, "build.log", OffsetCursor.START, null, bob).snippet().content);
    }

    // ---------- view shapes ----------

    @Test
    void raw_download_is_an_attachment_with_exact_length() throws Exception {
        jobs.put(42, false, "build.log");
        writeLog(42, "build.log", "hello\nworld");

        LogReply r = endpoint().view(42, "build.log", new OffsetCursor(6), "raw", bob);

        assertTrue(r.stream().attachment());
        assertEquals("build.log", r.stream().attachmentName());
        assertEquals(5L, r.stream().contentLength());
        assertNotNull(r.stream().contentType());
        assertEquals("world", streamed(r));
    }

    @Test
    void raw_download_past_end_has_zero_length() throws Exception {
        jobs.put(42, false, "build.log");
        writeLog(42, "build.log", "abc");

        LogReply r = endpoint().view(42, "build.log", new OffsetCursor(10), "raw", bob);

        assertEquals(0L, r.stream().contentLength());
        assertEquals("", streamed(r));
    }

    @Test
    void html_log_is_streamed_inline() throws Exception {
        jobs.put(42, true, "report.html");
        writeLog(42, "report.html", "<h1>ok</h1>");

        LogReply r = endpoint().view(42, "report.html", OffsetCursor.START, null, bob);

        assertFalse(r.stream().attachment());
        assertEquals("text/html", r.stream().contentType());
        assertEquals("<h1>ok</h1>", streamed(r));
    }

    @Test
    void snippet_carries_next_offset_and_poll_url() throws Exception {
        jobs.put(42, false, "x86_64/build.log");
        writeLog(42, "x86_64/build.log", "hello\nworld");

        SnippetContext ctx = endpoint().view(42, "x86_64/build.log", new OffsetCursor(6), null, bob).snippet();

        assertEquals("Task log", ctx.title);
        assertEquals("world", ctx.content);
        assertEquals(11L, ctx.offset);
        assertEquals(0, ctx.taskFinished);
        assertEquals("x86_64/build.log", ctx.logName);
        assertEquals("/jobs/42/log-json/x86_64/build.log", ctx.jsonUrl);
        assertEquals(42L, ctx.jobId);
    }

    @Test
    void legacy_snippet_padding_adds_one() throws Exception {
        jobs.put(42, true, "build.log");
        writeLog(42, "build.log", "hello\nworld");

        SnippetContext ctx = endpoint(new EndpointConfig(EndpointConfig.DEFAULT_MAX_INLINE_BYTES, 1))
                .view(42, "build.log", OffsetCursor.START, null, bob).snippet();

        assertEquals(12L, ctx.offset);
        assertEquals(1, ctx.taskFinished);
    }

    @Test
    void padded_snippet_at_the_largest_offset_does_not_overflow() throws Exception {
        jobs.put(42, false, "build.log");
        writeLog(42, "build.log", "hello");

        LogReply r = endpoint(new EndpointConfig(EndpointConfig.DEFAULT_MAX_INLINE_BYTES, 1))
                .view(42, "build.log", new OffsetCursor(Long.MAX_VALUE), null, bob);

        assertEquals(LogReply.Kind.SNIPPET, r.kind());
        assertEquals("", r.snippet().content);
        assertEquals(Long.MAX_VALUE, r.snippet().offset);
    }

    @Test
    void extension_outside_allow_list_is_forbidden_for_snippet_only() throws Exception {
        jobs.put(42, false, "core.bin");
        writeLog(42, "core.bin", "\u0000\u0001");
        LogEndpoint ep = endpoint();

        LogReply snippet = ep.view(42, "core.bin", OffsetCursor.START, null, bob);
        assertEquals(LogReply.Kind.FORBIDDEN, snippet.kind());
        assertEquals("Can display only specific file types: .log", snippet.reason());

        assertEquals(LogReply.Kind.STREAM, ep.view(42, "core.bin", OffsetCursor.START, "raw", bob).kind());
    }

    // ---------- not found ----------

    @Test
    void unknown_job_and_missing_log_are_not_found() throws Exception {
        jobs.put(42, false);
        LogEndpoint ep = endpoint();

        assertEquals(LogReply.Kind.NOT_FOUND, ep.poll(7, "build.log", OffsetCursor.START, bob).kind());
        assertEquals(LogReply.Kind.NOT_FOUND, ep.view(7, "build.log", OffsetCursor.START, "raw", bob).kind());
        assertEquals(LogReply.Kind.NOT_FOUND, ep.listLogs(7, bob).kind());

        LogReply missing = ep.poll(42, "build.log", OffsetCursor.START, bob);
        assertEquals(LogReply.Kind.NOT_FOUND, missing.kind());
        assertEquals(404, missing.status());
    }

    @Test
    void traversal_attempt_is_rejected() {
        jobs.put(42, false);

        assertThrows(IllegalArgumentException.class,
                () -> endpoint().poll(42, "../../7/logs/build.log", OffsetCursor.START, bob));
    }

    // ---------- listing ----------

    @Test
    void listing_hides_tracebacks_from_regular_users() {
        jobs.put(42, true, "traceback.log", "stdout.log", "build.log");
        LogEndpoint ep = endpoint();

        LogListResponse forBob = (LogListResponse) ep.listLogs(42, bob).json();
        LogListResponse forAdmin = (LogListResponse) ep.listLogs(42, admin).json();

        assertEquals(List.of("build.log", "stdout.log"), forBob.logs);
        assertEquals(List.of("build.log", "stdout.log", "traceback.log"), forAdmin.logs);
        assertEquals(1, forBob.taskFinished);
        assertEquals(42L, forBob.jobId);
    }
}
