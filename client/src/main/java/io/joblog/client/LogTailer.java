package io.joblog.client;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * "tail -f" over the poll endpoint.
 * <p>
 * Loop:
 *  - poll from the current offset and hand any new text to the sink,
 *  - continue from new_offset (never moving backwards),
 *  - sleep for the interval when a poll brought nothing new,
 *  - stop once the job is finished and a poll brings nothing new.
 * A finished job with more bytes pending is polled again right away, since
 * the server bounds each poll response.
 */
public final class LogTailer {

    private final PollSource source;
    private final Duration interval;

    public LogTailer(PollSource source, Duration interval) {
        this.source = Objects.requireNonNull(source, "source");
        this.interval = Objects.requireNonNull(interval, "interval");
        if (interval.isNegative()) throw new IllegalArgumentException("interval must be >= 0");
    }

    /**
     * Follow a log until its job finishes.
     *
     * @return the final offset
     */
    public long follow(long jobId, String logName, long offset, Consumer<String> sink)
            throws IOException, InterruptedException {
        long cursor = offset;
        while (true) {
            PollResult r = source.poll(jobId, logName, cursor);
            if (r.content != null && !r.content.isEmpty()) {
                sink.accept(r.content);
            }
            boolean progressed = r.newOffset > cursor;
            cursor = Math.max(cursor, r.newOffset);

            if (!progressed) {
                if (r.finished()) {
                    return cursor;
                }
                Thread.sleep(interval.toMillis());
            }
        }
    }
}
