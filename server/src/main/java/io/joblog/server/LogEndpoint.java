package io.joblog.server;

import io.joblog.core.AccessPolicy;
import io.joblog.core.AccessVerdict;
import io.joblog.core.FormatNegotiator;
import io.joblog.core.Job;
import io.joblog.core.JobRegistry;
import io.joblog.core.LogNames;
import io.joblog.core.OffsetCursor;
import io.joblog.core.Principal;
import io.joblog.core.ResponseShape;
import io.joblog.core.Utf8Text;
import io.joblog.server.dto.LogListResponse;
import io.joblog.server.dto.PollResponse;
import io.joblog.server.dto.SnippetContext;
import io.joblog.storage.ChunkedReader;
import io.joblog.storage.LogResource;
import io.joblog.storage.LogStore;
import io.joblog.storage.Resolution;

import java.util.Objects;
import java.util.Optional;

/**
 * Application service for reading job logs.
 * <p>
 * Every request goes through the same steps:
 *  1) access check on the log name (traceback logs are for elevated principals only),
 *  2) job lookup,
 *  3) shape negotiation (view endpoint only; the extension gate applies here),
 *  4) resolution of the plain file or its compressed archive,
 *  5) read from the caller's offset and shape the reply.
 * Any step may end the request with FORBIDDEN or NOT_FOUND. Nothing is retried;
 * pollers come back with the offset they were given.
 * <p>
 * The job's finished flag is taken before the log is read. A poll that reports
 * task_finished=1 has therefore seen the complete log.
 */
public final class LogEndpoint {

    static final String SNIPPET_TITLE = "Task log";
    static final String JOB_NOT_FOUND = "job not found";
    static final String LOG_NOT_FOUND = "log not found";

    private final JobRegistry jobs;
    private final AccessPolicy access;
    private final LogStore store;
    private final ChunkedReader reader;
    private final FormatNegotiator formats;
    private final EndpointConfig config;

    public LogEndpoint(JobRegistry jobs,
                       AccessPolicy access,
                       LogStore store,
                       ChunkedReader reader,
                       FormatNegotiator formats,
                       EndpointConfig config) {
        this.jobs = Objects.requireNonNull(jobs, "jobs");
        this.access = Objects.requireNonNull(access, "access");
        this.store = Objects.requireNonNull(store, "store");
        this.reader = Objects.requireNonNull(reader, "reader");
        this.formats = Objects.requireNonNull(formats, "formats");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * GET /jobs/{id}/log/{logName}: raw download, inline HTML or text snippet.
     *
     * @param format "raw" for a download, anything else (usually null) for the default view
     */
    public LogReply view(long jobId, String logName, OffsetCursor offset, String format, Principal principal) {
        AccessVerdict verdict = access.check(principal, logName);
        if (!verdict.allowed()) {
            return LogReply.forbidden(verdict.reason());
        }
        Optional<Job> found = jobs.find(jobId);
        if (found.isEmpty()) {
            return LogReply.notFound(JOB_NOT_FOUND);
        }
        Job job = found.get();

        ResponseShape shape = formats.choose(format, logName);
        if (shape == ResponseShape.FORBIDDEN) {
            return LogReply.forbidden(formats.forbiddenReason());
        }

        Resolution resolution = store.resolve(job, logName);
        if (!resolution.found()) {
            return LogReply.notFound(LOG_NOT_FOUND);
        }
        LogResource resource = resolution.resource();

        return switch (shape) {
            case RAW_ATTACHMENT -> LogReply.stream(new StreamBody(
                    reader, resource, offset.value(), ContentTypes.guess(logName), LogNames.baseName(logName)));
            case RAW_INLINE -> LogReply.stream(new StreamBody(
                    reader, resource, offset.value(), ContentTypes.guess(logName), null));
            case RENDERED_SNIPPET -> LogReply.snippet(snippet(job, logName, resource, offset));
            default -> throw new IllegalStateException("unexpected shape for view: " + shape);
        };
    }

    /**
     * GET /jobs/{id}/log-json/{logName}: incremental poll. No extension gate, same access check.
     */
    public LogReply poll(long jobId, String logName, OffsetCursor offset, Principal principal) {
        AccessVerdict verdict = access.check(principal, logName);
        if (!verdict.allowed()) {
            return LogReply.forbidden(verdict.reason());
        }
        Optional<Job> found = jobs.find(jobId);
        if (found.isEmpty()) {
            return LogReply.notFound(JOB_NOT_FOUND);
        }
        Job job = found.get();

        Resolution resolution = store.resolve(job, logName);
        if (!resolution.found()) {
            return LogReply.notFound(LOG_NOT_FOUND);
        }

        TextRead read = readText(job, resolution.resource(), offset);
        PollResponse dto = new PollResponse();
        dto.newOffset = offset.advance(read.consumed()).value();
        dto.taskFinished = job.finished() ? 1 : 0;
        dto.content = read.text();
        return LogReply.json(dto);
    }

    /** GET /jobs/{id}/logs */
    public LogReply listLogs(long jobId, Principal principal) {
        Optional<Job> found = jobs.find(jobId);
        if (found.isEmpty()) {
            return LogReply.notFound(JOB_NOT_FOUND);
        }
        Job job = found.get();
        LogListResponse dto = new LogListResponse();
        dto.jobId = job.id();
        dto.taskFinished = job.finished() ? 1 : 0;
        dto.logs = access.visibleLogs(principal, job.logNames());
        return LogReply.json(dto);
    }

    private SnippetContext snippet(Job job, String logName, LogResource resource, OffsetCursor offset) {
        TextRead read = readText(job, resource, offset);
        SnippetContext ctx = new SnippetContext();
        ctx.title = SNIPPET_TITLE;
        ctx.jobId = job.id();
        ctx.offset = offset.advance(read.consumed() + config.snippetOffsetPadding()).value();
        ctx.taskFinished = job.finished() ? 1 : 0;
        ctx.content = read.text();
        ctx.logName = logName;
        ctx.jsonUrl = LogRoutes.pollPath(job.id(), logName);
        return ctx;
    }

    /**
     * Read from the offset up to the current end (bounded) and decode.
     * While more bytes may follow, a character cut in half at the end is left
     * for the next read.
     */
    private TextRead readText(Job job, LogResource resource, OffsetCursor offset) {
        byte[] bytes = reader.readAll(resource, offset.value(), config.maxInlineBytes());
        boolean complete = job.finished() && offset.value() + bytes.length >= resource.size();
        int consumed = complete ? bytes.length : Utf8Text.completePrefixLength(bytes);
        return new TextRead(Utf8Text.decode(bytes, consumed), consumed);
    }

    private record TextRead(String text, int consumed) {
    }
}
