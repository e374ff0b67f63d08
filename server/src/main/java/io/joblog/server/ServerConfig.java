package io.joblog.server;

import io.joblog.core.LogFormatConfig;
import io.joblog.storage.ChunkedReader;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Server configuration parsed from CLI args.
 *
 * Supports:
 *  - httpPort:             HTTP API port
 *  - logRoot:              root directory of the job directories
 *  - allowedExtensions:    log extensions shown as text snippets
 *  - admins:               user names treated as elevated principals
 *  - userHeader:           header carrying the authenticated user name
 *  - chunkBytes:           chunk size for streamed downloads
 *  - maxInlineBytes:       read bound for snippet and poll requests
 *  - snippetOffsetPadding: extra offset added after a rendered snippet (0 or legacy 1)
 */
public record ServerConfig(
        int httpPort,
        String logRoot,
        List<String> allowedExtensions,
        Set<String> admins,
        String userHeader,
        int chunkBytes,
        int maxInlineBytes,
        int snippetOffsetPadding
) {

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --http-port,   -p   <port>
     *   --log-root,    -r   <path>
     *   --allowed-ext, -e   <.log,.txt>
     *   --admins,      -a   <alice,bob>
     *   --user-header       <header>
     *   --chunk-bytes       <bytes>
     *   --max-inline-bytes  <bytes>
     *   --snippet-offset-padding <0|1>
     *   --help,        -h
     *
     * All flags are optional; defaults are reasonable for local dev.
     */
    public static ServerConfig fromArgs(String[] args) {
        // Defaults
        int httpPort = 8080;
        String logRoot = "./data/jobs";
        List<String> allowedExtensions = LogFormatConfig.DEFAULT_EXTENSIONS;
        Set<String> admins = Set.of();
        String userHeader = RemoteUserPrincipalResolver.DEFAULT_HEADER;
        int chunkBytes = ChunkedReader.DEFAULT_CHUNK_BYTES;
        int maxInlineBytes = EndpointConfig.DEFAULT_MAX_INLINE_BYTES;
        int snippetOffsetPadding = 0;

        // CLIArg Parser
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    httpPort = parseInt(args, ++i, "http-port");
                }

                case "--log-root", "-r" -> {
                    ensureValue(args, i);
                    logRoot = args[++i];
                }

                case "--allowed-ext", "-e" -> {
                    ensureValue(args, i);
                    allowedExtensions = splitList(args[++i]);
                }

                case "--admins", "-a" -> {
                    ensureValue(args, i);
                    admins = new LinkedHashSet<>(splitList(args[++i]));
                }

                case "--user-header" -> {
                    ensureValue(args, i);
                    userHeader = args[++i];
                }

                case "--chunk-bytes" -> {
                    ensureValue(args, i);
                    chunkBytes = parseInt(args, ++i, "chunk-bytes");
                }

                case "--max-inline-bytes" -> {
                    ensureValue(args, i);
                    maxInlineBytes = parseInt(args, ++i, "max-inline-bytes");
                }

                case "--snippet-offset-padding" -> {
                    ensureValue(args, i);
                    snippetOffsetPadding = parseInt(args, ++i, "snippet-offset-padding");
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new ServerConfig(
                httpPort,
                logRoot,
                List.copyOf(allowedExtensions),
                Set.copyOf(admins),
                userHeader,
                chunkBytes,
                maxInlineBytes,
                snippetOffsetPadding
        );
    }

    public LogFormatConfig formatConfig() {
        return LogFormatConfig.of(allowedExtensions);
    }

    public EndpointConfig endpointConfig() {
        return new EndpointConfig(maxInlineBytes, snippetOffsetPadding);
    }

    static List<String> splitList(String raw) {
        List<String> out = new ArrayList<>();
        for (String part : raw.split(",")) {
            String p = part.trim();
            if (!p.isEmpty()) {
                out.add(p);
            }
        }
        return out;
    }

    private static int parseInt(String[] args, int i, String name) {
        try {
            return Integer.parseInt(args[i]);
        } catch (NumberFormatException e) {
            System.err.println("Invalid " + name + ": " + args[i]);
            System.exit(1);
            return -1; // unreachable
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: joblog-server [options]

            Options:
              --http-port,    -p   HTTP port (default: 8080)
              --log-root,     -r   Root directory of job directories (default: ./data/jobs)
              --allowed-ext,  -e   Comma-separated extensions shown as text (default: .log)
              --admins,       -a   Comma-separated users allowed to read traceback logs
              --user-header        Header carrying the authenticated user (default: X-Remote-User)
              --chunk-bytes        Chunk size for downloads in bytes (default: 1048576)
              --max-inline-bytes   Max bytes per snippet or poll response (default: 4194304)
              --snippet-offset-padding  Extra offset after a snippet, 1 for legacy pollers (default: 0)
              --help,         -h   Show this help message
            """);
        System.exit(0);
    }
}
