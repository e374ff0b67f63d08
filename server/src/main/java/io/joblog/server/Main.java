package io.joblog.server;

import io.joblog.core.AccessPolicy;
import io.joblog.core.FormatNegotiator;
import io.joblog.storage.ChunkedReader;
import io.joblog.storage.DirectoryJobRegistry;
import io.joblog.storage.FileLogStore;
import io.joblog.storage.JobLayout;

import java.nio.file.Path;

/**
 * Entry point for the job log server.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Wire storage (job layout, registry, log store, chunked reader).
 *  - Wire policy (access policy, format negotiation) into the LogEndpoint.
 *  - Start the HTTP server and stop it on shutdown.
 */
public final class Main {

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        var cfg = ServerConfig.fromArgs(args);

        // ------ Storage Layer -------
        var layout = new JobLayout(Path.of(cfg.logRoot()));
        var jobs = new DirectoryJobRegistry(layout);
        var store = new FileLogStore(layout);
        var reader = new ChunkedReader(cfg.chunkBytes());

        // ------ Policy ------
        var access = new AccessPolicy();
        var formats = new FormatNegotiator(cfg.formatConfig());

        var endpoint = new LogEndpoint(jobs, access, store, reader, formats, cfg.endpointConfig());

        // ------ HTTP layer ------
        var web = new WebServer(
                cfg.httpPort(),
                endpoint,
                new RemoteUserPrincipalResolver(cfg.userHeader(), cfg.admins()),
                new JsonSnippetRenderer()
        );

        System.out.printf(
                "joblog serving %s on http://%s:%d%n",
                layout.root(),
                "localhost", cfg.httpPort()
        );

        web.start();

        // Shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(web::stop));
    }
}
