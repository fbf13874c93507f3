package io.clustersearch.config;

import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static io.clustersearch.config.Constants.*;

/**
 * Configuration for the search command.
 * Loads cluster-search.yml from an external path or the classpath with fallbacks to constants.
 */
@Slf4j
@Getter
public class SearchCommandConfig {

    private final String timestampField;
    private final int pageSize;
    private final String scrollTtl;
    private final Duration connectTimeout;
    private final Duration requestTimeout;
    private final String defaultEarliest;
    private final String defaultLatest;
    private final ZoneId timeZone;
    private final Map<String, ClusterSettings> clusters;

    // Default classpath location
    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "cluster-search.yml";
    // Environment variable to check for external config file path
    private static final String EXTERNAL_CONFIG_ENV_VAR = "CLUSTER_SEARCH_CONFIG_FILE";

    public SearchCommandConfig() {
        this(loadYamlConfig(System.getenv(EXTERNAL_CONFIG_ENV_VAR)));
    }

    SearchCommandConfig(ConfigModel config) {
        Defaults defaults = config.getDefaults() != null ? config.getDefaults() : new Defaults();

        this.timestampField = nonBlankOr(defaults.getTsfield(), DEFAULT_TIMESTAMP_FIELD);
        this.pageSize = parsePageSize(defaults);
        this.scrollTtl = nonBlankOr(defaults.getScroll_ttl(), DEFAULT_SCROLL_TTL);
        this.connectTimeout = Duration.ofSeconds(positiveOr(defaults.getConnect_timeout_seconds(),
                DEFAULT_CONNECT_TIMEOUT_SECONDS));
        this.requestTimeout = Duration.ofSeconds(positiveOr(defaults.getRequest_timeout_seconds(),
                DEFAULT_REQUEST_TIMEOUT_SECONDS));
        this.defaultEarliest = nonBlankOr(defaults.getEarliest(), DEFAULT_EARLIEST);
        this.defaultLatest = nonBlankOr(defaults.getLatest(), DEFAULT_LATEST);
        this.timeZone = parseTimeZone(defaults);
        this.clusters = parseClusters(config);

        log.info("Loaded search command config - tsfield: {}, page size: {}, scroll ttl: {}, named clusters: {}",
                timestampField, pageSize, scrollTtl, clusters.keySet());
    }

    /**
     * Load configuration from a YAML stream. Used for explicit configuration sources.
     */
    public static SearchCommandConfig fromYaml(InputStream inputStream) {
        return new SearchCommandConfig(parse(inputStream, "stream"));
    }

    /**
     * Resolve the {@code eaddr} option: either the name of a configured cluster or a comma-separated
     * endpoint list.
     */
    public ClusterSettings resolveCluster(String eaddr) {
        if (eaddr == null || eaddr.isBlank()) {
            return ClusterSettings.builder().build();
        }
        ClusterSettings named = clusters.get(eaddr.trim());
        if (named != null) {
            log.debug("eaddr '{}' resolved to configured cluster with hosts {}", eaddr, named.getHosts());
            return named;
        }
        List<String> hosts = Arrays.stream(eaddr.split(","))
                .map(String::trim)
                .filter(host -> !host.isEmpty())
                .collect(Collectors.toList());
        return ClusterSettings.builder().hosts(hosts).build();
    }

    private static ConfigModel loadYamlConfig(String externalConfigPath) {
        InputStream inputStream = null;
        String loadedFrom = "";

        // 1. Check environment variable for external config file path
        if (externalConfigPath != null && !externalConfigPath.trim().isEmpty()) {
            log.info("External config file path specified via {}: {}", EXTERNAL_CONFIG_ENV_VAR, externalConfigPath);
            try {
                if (Files.exists(Paths.get(externalConfigPath))) {
                    inputStream = new FileInputStream(externalConfigPath);
                    loadedFrom = "external file (" + externalConfigPath + ")";
                } else {
                    log.warn("External config file specified but not found at path: {}. Falling back.", externalConfigPath);
                }
            } catch (IOException e) {
                log.warn("Error opening external config file {}: {}. Falling back.", externalConfigPath, e.getMessage());
            } catch (SecurityException se) {
                log.warn("Permission denied accessing external config file {}: {}. Falling back.", externalConfigPath, se.getMessage());
            }
        } else {
            log.debug("{} environment variable not set, looking for config on classpath.", EXTERNAL_CONFIG_ENV_VAR);
        }

        // 2. If external file wasn't loaded, try classpath
        if (inputStream == null) {
            inputStream = SearchCommandConfig.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE_CLASSPATH);
            loadedFrom = "classpath (" + DEFAULT_CONFIG_FILE_CLASSPATH + ")";
            if (inputStream == null) {
                log.warn("Config file not found on classpath: {}. Using defaults.", DEFAULT_CONFIG_FILE_CLASSPATH);
                return new ConfigModel();
            }
        }

        // 3. Load from the determined InputStream
        try {
            return parse(inputStream, loadedFrom);
        } finally {
            try {
                inputStream.close();
            } catch (IOException e) {
                log.error("Error closing config file input stream: {}", e.getMessage());
            }
        }
    }

    private static ConfigModel parse(InputStream inputStream, String loadedFrom) {
        Yaml yaml = new Yaml(new Constructor(ConfigModel.class, new LoaderOptions()));
        try {
            ConfigModel config = yaml.load(inputStream);
            log.info("Successfully loaded configuration from {}", loadedFrom);
            return config != null ? config : new ConfigModel();
        } catch (Exception e) {
            log.warn("Failed to parse configuration from {}: {}. Using defaults.", loadedFrom, e.getMessage());
            return new ConfigModel();
        }
    }

    private int parsePageSize(Defaults defaults) {
        Integer configured = defaults.getPage_size();
        if (configured != null && configured > 0) {
            return configured;
        }
        if (configured != null) {
            log.warn("Ignoring non-positive page size {}, using default {}", configured, DEFAULT_PAGE_SIZE);
        }
        return DEFAULT_PAGE_SIZE;
    }

    private ZoneId parseTimeZone(Defaults defaults) {
        String zone = nonBlankOr(defaults.getTime_zone(), DEFAULT_TIME_ZONE);
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            log.warn("Failed to parse time zone '{}', using default {}: {}", zone, DEFAULT_TIME_ZONE, e.getMessage());
            return ZoneId.of(DEFAULT_TIME_ZONE);
        }
    }

    private Map<String, ClusterSettings> parseClusters(ConfigModel config) {
        if (config.getClusters() == null || config.getClusters().isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, ClusterSettings> parsed = new HashMap<>();
        config.getClusters().forEach((name, cluster) -> {
            if (cluster == null || cluster.getHosts() == null || cluster.getHosts().isEmpty()) {
                log.warn("Cluster '{}' has no hosts configured, skipping", name);
                return;
            }
            boolean useSsl = Boolean.TRUE.equals(cluster.getUse_ssl());
            parsed.put(name, ClusterSettings.builder()
                    .hosts(cluster.getHosts())
                    .useSsl(useSsl)
                    .verifyCerts(useSsl && Boolean.TRUE.equals(cluster.getVerify_certs()))
                    .user(cluster.getUser())
                    .password(cluster.getPassword())
                    .timestampField(cluster.getTsfield())
                    .build());
        });
        return Collections.unmodifiableMap(parsed);
    }

    private static String nonBlankOr(String value, String fallback) {
        return value != null && !value.isBlank() ? value.trim() : fallback;
    }

    private static long positiveOr(Long value, long fallback) {
        return value != null && value > 0 ? value : fallback;
    }

    /**
     * Configuration model for the cluster-search.yml file.
     */
    @Data
    public static class ConfigModel {
        private Defaults defaults;
        private Map<String, Cluster> clusters;
    }

    @Data
    public static class Defaults {
        private String tsfield;
        private Integer page_size;
        private String scroll_ttl;
        private Long connect_timeout_seconds;
        private Long request_timeout_seconds;
        private String earliest;
        private String latest;
        private String time_zone;
    }

    @Data
    public static class Cluster {
        private List<String> hosts;
        private Boolean use_ssl;
        private Boolean verify_certs;
        private String user;
        private String password;
        private String tsfield;
    }
}
