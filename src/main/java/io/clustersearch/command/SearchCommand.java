package io.clustersearch.command;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.clustersearch.config.ClusterSettings;
import io.clustersearch.config.SearchCommandConfig;
import io.clustersearch.enums.CommandAction;
import io.clustersearch.exceptions.InvalidQueryConfigurationException;
import io.clustersearch.health.ClusterHealthManager;
import io.clustersearch.indices.IndexManager;
import io.clustersearch.metrics.MetricsProvider;
import io.clustersearch.models.IndexDescriptor;
import io.clustersearch.models.QueryDescriptor;
import io.clustersearch.models.ResultDocument;
import io.clustersearch.models.SearchOptions;
import io.clustersearch.models.TimeRange;
import io.clustersearch.query.QueryPlanner;
import io.clustersearch.scroll.RecordFlattener;
import io.clustersearch.scroll.RecordFormatter;
import io.clustersearch.scroll.RecordStream;
import io.clustersearch.scroll.ScrollSearcher;
import io.clustersearch.time.TimeResolver;
import io.clustersearch.transport.ClusterClient;
import io.clustersearch.transport.NodePool;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import static io.clustersearch.config.Constants.DEFAULT_SEARCH_SIZE;
import static io.clustersearch.config.Constants.MAX_FLATTEN_DEPTH;

/**
 * Runs one command invocation: validates the options, builds the connection layer for the target
 * cluster and streams the records of the requested action to the emitter.
 *
 * Every invocation builds its own node pool, transport and cursor, so concurrent invocations
 * share nothing but the immutable configuration.
 */
@Slf4j
public class SearchCommand {

    private final SearchCommandConfig config;
    private final Clock clock;
    private final MetricsProvider metricsProvider;
    private final TransportFactory transportFactory;
    private final ObjectMapper objectMapper;

    public SearchCommand(SearchCommandConfig config, Clock clock, MetricsProvider metricsProvider,
                         TransportFactory transportFactory, ObjectMapper objectMapper) {
        this.config = config;
        this.clock = clock;
        this.metricsProvider = metricsProvider;
        this.transportFactory = transportFactory;
        this.objectMapper = objectMapper;
    }

    /**
     * Run the command.
     *
     * @param options parsed command options
     * @param platformDefaultRange range supplied by the invoking platform, null to use the configured
     *        default earliest/latest
     * @param emitter receives the records as they are produced
     * @return number of records emitted
     * @throws io.clustersearch.exceptions.SearchCommandException for any failure; records emitted
     *         before a {@link io.clustersearch.exceptions.CursorExpiredException} remain valid
     */
    public long run(SearchOptions options, TimeRange platformDefaultRange, RecordEmitter emitter) {
        CommandAction action = options.getAction();
        ClusterSettings cluster = resolveCluster(options);
        log.info("Running {} against {}", action, cluster.getHosts());

        try {
            switch (action) {
                case INDICES_LIST:
                    return listIndices(cluster, emitter);
                case CLUSTER_HEALTH:
                    return clusterHealth(cluster, emitter);
                case SEARCH:
                default:
                    return search(options, cluster, platformDefaultRange, emitter);
            }
        } finally {
            emitter.flush();
            metricsProvider.logSummary();
        }
    }

    private long search(SearchOptions options, ClusterSettings cluster, TimeRange platformDefaultRange,
                        RecordEmitter emitter) {
        // Validation happens before any connection is made
        TimeResolver timeResolver = new TimeResolver(clock, config.getTimeZone());
        TimeRange defaultRange = platformDefaultRange;
        if (defaultRange == null && (isBlank(options.getEarliest()) || isBlank(options.getLatest()))) {
            defaultRange = configuredDefaultRange(timeResolver);
        }
        TimeRange range = timeResolver.resolve(options.getEarliest(), options.getLatest(), defaultRange);

        String defaultTimestampField = cluster.getTimestampField() != null
            ? cluster.getTimestampField()
            : config.getTimestampField();
        QueryDescriptor descriptor = new QueryPlanner(defaultTimestampField).plan(options, range);

        RecordFormatter formatter = new RecordFormatter(descriptor.getTimestampField(), options.isIncludeEs(),
            options.isIncludeRaw(), new RecordFlattener(objectMapper, MAX_FLATTEN_DEPTH), objectMapper);
        ScrollSearcher searcher = new ScrollSearcher(connect(cluster), metricsProvider, config.getScrollTtl());

        if (!options.isScan()) {
            int size = options.getLimit() > 0 ? options.getLimit() : DEFAULT_SEARCH_SIZE;
            List<ResultDocument> documents = searcher.searchOnce(descriptor, size);
            documents.forEach(document -> emitter.emit(formatter.format(document)));
            log.info("Search emitted {} record(s)", documents.size());
            return documents.size();
        }

        int pageSize = options.getPageSize() != null ? options.getPageSize() : config.getPageSize();
        try (RecordStream records = searcher.stream(descriptor, pageSize, formatter, options.getLimit())) {
            while (records.hasNext()) {
                emitter.emit(records.next());
            }
            log.info("Search emitted {} record(s)", records.getEmitted());
            return records.getEmitted();
        }
    }

    private long listIndices(ClusterSettings cluster, RecordEmitter emitter) {
        List<IndexDescriptor> indices = new IndexManager(connect(cluster)).listIndices();
        indices.forEach(index -> emitter.emit(index.toRecord()));
        return indices.size();
    }

    private long clusterHealth(ClusterSettings cluster, RecordEmitter emitter) {
        emitter.emit(new ClusterHealthManager(connect(cluster)).getClusterHealth().toRecord());
        return 1;
    }

    private ClusterClient connect(ClusterSettings cluster) {
        NodePool nodePool = NodePool.fromSettings(cluster, metricsProvider);
        return new ClusterClient(nodePool, transportFactory.create(cluster), objectMapper);
    }

    private TimeRange configuredDefaultRange(TimeResolver timeResolver) {
        Instant now = clock.instant();
        return TimeRange.of(timeResolver.parse(config.getDefaultEarliest(), now),
            timeResolver.parse(config.getDefaultLatest(), now));
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    /**
     * Apply the command's TLS overrides to the configured cluster. Certificates are never verified
     * on plain HTTP connections.
     */
    private ClusterSettings resolveCluster(SearchOptions options) {
        ClusterSettings cluster = config.resolveCluster(options.getEaddr());
        if (cluster.getHosts().isEmpty()) {
            throw new InvalidQueryConfigurationException("Required option 'eaddr' is missing or empty");
        }
        boolean useSsl = options.getUseSsl() != null ? options.getUseSsl() : cluster.isUseSsl();
        boolean verifyCerts = useSsl
            && (options.getVerifyCerts() != null ? options.getVerifyCerts() : cluster.isVerifyCerts());
        return cluster.toBuilder()
            .useSsl(useSsl)
            .verifyCerts(verifyCerts)
            .build();
    }
}
