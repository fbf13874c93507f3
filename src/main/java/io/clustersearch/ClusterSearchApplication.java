package io.clustersearch;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.clustersearch.command.CommandArguments;
import io.clustersearch.command.JsonLinesRecordEmitter;
import io.clustersearch.command.SearchCommand;
import io.clustersearch.command.TransportFactory;
import io.clustersearch.config.SearchCommandConfig;
import io.clustersearch.exceptions.SearchCommandException;
import io.clustersearch.metrics.MetricsProvider;
import io.clustersearch.models.SearchOptions;
import io.clustersearch.transport.HttpClusterTransport;
import io.clustersearch.util.EnvironmentUtils;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.time.Clock;

/**
 * Command line entry point.
 *
 * Usage: {@code cluster-search eaddr=host1:9200,host2:9200 index=logs-* query="status:500" earliest=now-1h}
 * or {@code cluster-search eaddr=prod action=cluster-health}. Records are written to stdout as JSON
 * lines, logs and errors go to stderr.
 */
@Slf4j
public class ClusterSearchApplication {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_PARTIAL = 2;

    private final SearchCommandConfig config;
    private final TransportFactory transportFactory;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    ClusterSearchApplication(SearchCommandConfig config, TransportFactory transportFactory, Clock clock) {
        this.config = config;
        this.transportFactory = transportFactory;
        this.clock = clock;
        this.objectMapper = new ObjectMapper();
    }

    public static void main(String[] args) {
        int exitCode;
        try {
            SearchCommandConfig config = new SearchCommandConfig();
            MetricsProvider metrics = metricsProvider();
            TransportFactory transports = settings -> new HttpClusterTransport(settings,
                config.getConnectTimeout(), config.getRequestTimeout(), metrics);
            exitCode = new ClusterSearchApplication(config, transports, Clock.systemUTC())
                .run(args, metrics, new FileOutputStream(FileDescriptor.out), System.err);
        } catch (Exception e) {
            log.error("Failed to start search command: {}", e.getMessage(), e);
            exitCode = EXIT_FAILED;
        }
        System.exit(exitCode);
    }

    /**
     * Records go to {@code out} as UTF-8 JSON lines whatever the platform charset is.
     */
    int run(String[] args, MetricsProvider metrics, OutputStream out, PrintStream err) {
        JsonLinesRecordEmitter emitter = new JsonLinesRecordEmitter(out, objectMapper);
        try {
            SearchOptions options = CommandArguments.parse(args);
            SearchCommand command = new SearchCommand(config, clock, metrics, transportFactory, objectMapper);
            long emitted = command.run(options, null, emitter);
            log.info("Command completed, {} record(s) emitted", emitted);
            return EXIT_OK;
        } catch (SearchCommandException e) {
            if (e.isPartialResult()) {
                log.warn("Command finished with partial results: {}", e.getMessage());
                err.println("Search incomplete, results may be partial: " + e.getMessage());
                return EXIT_PARTIAL;
            }
            log.error("Command failed: {}", e.getMessage());
            err.println("Search failed: " + e.getMessage());
            return EXIT_FAILED;
        } catch (RuntimeException e) {
            log.error("Command failed with unexpected error", e);
            err.println("Search failed: unexpected error: " + e.getMessage());
            return EXIT_FAILED;
        } finally {
            emitter.flush();
        }
    }

    private static MetricsProvider metricsProvider() {
        String hostname = EnvironmentUtils.getEnv("HOSTNAME", "localhost");
        return new MetricsProvider(new SimpleMeterRegistry(), hostname);
    }
}
