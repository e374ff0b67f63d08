package io.joblog.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Gate for sensitive log categories.
 * <p>
 * Rules:
 *  - A log whose base name starts with {@link #TRACEBACK_PREFIX} may contain
 *    credentials or environment dumps; only elevated principals may read it.
 *  - Every other log is readable by anyone who may see the job. Job-level
 *    authorization happens before this check and is not repeated here.
 * <p>
 * The same check runs for raw downloads, inline views, snippets and JSON polls.
 */
public final class AccessPolicy {

    public static final String TRACEBACK_PREFIX = "traceback";

    static final String TRACEBACK_DENIED = "Traceback is available only for superusers.";

    public AccessVerdict check(Principal principal, String logName) {
        Objects.requireNonNull(principal, "principal");
        Objects.requireNonNull(logName, "logName");

        if (isTraceback(logName) && !principal.elevated()) {
            return AccessVerdict.deny(TRACEBACK_DENIED);
        }
        return AccessVerdict.allow();
    }

    /**
     * Log names the principal is allowed to see, sorted by name.
     * Used for job log listings so that restricted logs are not even advertised.
     */
    public List<String> visibleLogs(Principal principal, Collection<String> logNames) {
        List<String> visible = new ArrayList<>(logNames.size());
        for (String name : logNames) {
            if (check(principal, name).allowed()) {
                visible.add(name);
            }
        }
        Collections.sort(visible);
        return visible;
    }

    static boolean isTraceback(String logName) {
        return LogNames.baseName(logName).startsWith(TRACEBACK_PREFIX);
    }
}
