package io.joblog.client;

import java.io.OutputStream;
import java.io.PrintStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Simple CLI for reading job logs from a running joblog server.
 *
 * Usage:
 *   joblog-cli [--base-url http://host:port] [--user name] ls <jobId>
 *   joblog-cli [--base-url http://host:port] [--user name] cat <jobId> <logName> [offset]
 *   joblog-cli [--base-url http://host:port] [--user name] tail <jobId> <logName> [--interval-ms N]
 *
 * Examples:
 *   joblog-cli ls 42
 *   joblog-cli cat 42 build.log > build.log
 *   joblog-cli tail 42 build.log
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8080";
    private static final String DEFAULT_USER_HEADER = "X-Remote-User";
    private static final long DEFAULT_INTERVAL_MS = 1000L;

    private Cli() {
    }

    public static void main(String[] args) {
        try {
            run(args, System.out);
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (LogClientException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(e.status() == 404 ? 3 : 1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    static void run(String[] args, PrintStream out) throws Exception {
        String baseUrl = DEFAULT_BASE_URL;
        String user = null;
        List<String> rest = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--base-url" -> baseUrl = value(args, ++i, "--base-url");
                case "--user" -> user = value(args, ++i, "--user");
                default -> rest.add(args[i]);
            }
        }
        if (rest.isEmpty()) {
            throw usage("missing command");
        }

        HttpLogClient client = new HttpLogClient(baseUrl, DEFAULT_USER_HEADER, user);
        String cmd = rest.get(0);
        switch (cmd) {
            case "ls" -> {
                if (rest.size() != 2) throw usage("ls requires <jobId>");
                for (String name : client.listLogs(jobId(rest.get(1)))) {
                    out.println(name);
                }
            }
            case "cat" -> {
                if (rest.size() < 3 || rest.size() > 4) throw usage("cat requires <jobId> <logName> [offset]");
                long offset = rest.size() == 4 ? number(rest.get(3), "offset") : 0L;
                client.download(jobId(rest.get(1)), rest.get(2), offset, nonClosing(out));
                out.flush();
            }
            case "tail" -> {
                long intervalMs = DEFAULT_INTERVAL_MS;
                if (rest.size() == 5 && "--interval-ms".equals(rest.get(3))) {
                    intervalMs = number(rest.get(4), "interval-ms");
                } else if (rest.size() != 3) {
                    throw usage("tail requires <jobId> <logName> [--interval-ms N]");
                }
                LogTailer tailer = new LogTailer(client, Duration.ofMillis(intervalMs));
                tailer.follow(jobId(rest.get(1)), rest.get(2), 0L, text -> {
                    out.print(text);
                    out.flush();
                });
            }
            default -> throw usage("unknown command: " + cmd);
        }
    }

    private static String value(String[] args, int i, String flag) {
        if (i >= args.length) {
            throw usage(flag + " requires a value");
        }
        return args[i];
    }

    private static long jobId(String raw) {
        return number(raw, "jobId");
    }

    private static long number(String raw, String what) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new CliException(what + " must be an integer: " + raw);
        }
    }

    private static OutputStream nonClosing(PrintStream out) {
        return new OutputStream() {
            @Override
            public void write(int b) {
                out.write(b);
            }

            @Override
            public void write(byte[] b, int off, int len) {
                out.write(b, off, len);
            }
        };
    }

    private static CliException usage(String msg) {
        return new CliException(msg + System.lineSeparator() + """
                Usage:
                  joblog-cli [--base-url http://host:port] [--user name] ls <jobId>
                  joblog-cli [--base-url http://host:port] [--user name] cat <jobId> <logName> [offset]
                  joblog-cli [--base-url http://host:port] [--user name] tail <jobId> <logName> [--interval-ms N]
                """);
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
