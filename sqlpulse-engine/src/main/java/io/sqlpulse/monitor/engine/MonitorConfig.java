package io.sqlpulse.monitor.engine;

import io.sqlpulse.monitor.common.analysis.DefaultThresholds;
import io.sqlpulse.monitor.common.analysis.Threshold;
import io.sqlpulse.monitor.common.check.CheckType;
import io.sqlpulse.monitor.common.check.InspectionLevel;
import io.sqlpulse.monitor.common.report.ConnectionIdentity;
import io.sqlpulse.monitor.engine.report.ReportFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Settings of one monitoring run
 */
public class MonitorConfig {
    private static final Logger logger = LoggerFactory.getLogger(MonitorConfig.class);

    // Default configuration values
    static final String DEFAULT_HOST = "localhost";
    static final int DEFAULT_PORT = 3306;
    static final String DEFAULT_USER = "root";
    static final int DEFAULT_CONNECTION_TIMEOUT_SECONDS = 10;
    static final int DEFAULT_RETRY_ATTEMPTS = 3;
    static final long DEFAULT_RETRY_BACKOFF_MS = 1000;
    static final int DEFAULT_QUERY_TIMEOUT_SECONDS = 30;
    static final InspectionLevel DEFAULT_LEVEL = InspectionLevel.ADVANCED;
    static final int DEFAULT_TABLE_LIMIT = 500;
    static final String DEFAULT_DISK_PATH = "/";
    static final String DEFAULT_REASONING_MODEL = "claude-3-sonnet-20240229";
    static final int DEFAULT_REASONING_MAX_TOKENS = 4096;
    static final double DEFAULT_REASONING_TEMPERATURE = 0.7;
    static final String DEFAULT_REASONING_ENDPOINT = "https://api.anthropic.com/v1/messages";
    static final Duration DEFAULT_REASONING_TIMEOUT = Duration.ofSeconds(30);
    static final int DEFAULT_REASONING_MAX_REQUEST_BYTES = 32768;
    static final String DEFAULT_OUTPUT_DIRECTORY = "reports";
    static final List<ReportFormat> DEFAULT_OUTPUT_FORMATS =
            List.of(ReportFormat.TEXT, ReportFormat.JSON, ReportFormat.CSV);

    private final String host;
    private final int port;
    private final String user;
    private final String password;
    private final String jdbcUrl;
    private final int connectionTimeoutSeconds;
    private final int retryAttempts;
    private final long retryBackoffMs;
    private final int queryTimeoutSeconds;
    private final InspectionLevel level;
    private final Set<CheckType> enabledChecks;
    private final boolean tablesEnabled;
    private final int tableLimit;
    private final String diskPath;
    private final List<Threshold> thresholds;
    private final String reasoningApiKey;
    private final String reasoningModel;
    private final int reasoningMaxTokens;
    private final double reasoningTemperature;
    private final String reasoningEndpoint;
    private final Duration reasoningTimeout;
    private final int reasoningMaxRequestBytes;
    private final String outputDirectory;
    private final List<ReportFormat> outputFormats;

    private MonitorConfig(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.user = builder.user;
        this.password = builder.password;
        this.jdbcUrl = builder.jdbcUrl;
        this.connectionTimeoutSeconds = builder.connectionTimeoutSeconds;
        this.retryAttempts = builder.retryAttempts;
        this.retryBackoffMs = builder.retryBackoffMs;
        this.queryTimeoutSeconds = builder.queryTimeoutSeconds;
        this.level = builder.level;
        this.enabledChecks = builder.enabledChecks == null ? null
                : Collections.unmodifiableSet(builder.enabledChecks.isEmpty()
                ? EnumSet.noneOf(CheckType.class) : EnumSet.copyOf(builder.enabledChecks));
        this.tablesEnabled = builder.tablesEnabled;
        this.tableLimit = builder.tableLimit;
        this.diskPath = builder.diskPath;
        this.thresholds = List.copyOf(builder.thresholds.values());
        this.reasoningApiKey = builder.reasoningApiKey;
        this.reasoningModel = builder.reasoningModel;
        this.reasoningMaxTokens = builder.reasoningMaxTokens;
        this.reasoningTemperature = builder.reasoningTemperature;
        this.reasoningEndpoint = builder.reasoningEndpoint;
        this.reasoningTimeout = builder.reasoningTimeout;
        this.reasoningMaxRequestBytes = builder.reasoningMaxRequestBytes;
        this.outputDirectory = builder.outputDirectory;
        this.outputFormats = List.copyOf(builder.outputFormats);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static MonitorConfig defaults() {
        return builder().build();
    }

    /**
     * Apply {@code key=value} arguments on top of the given builder. Invalid numbers are logged and
     * the current value is kept; an unknown level is a configuration error.
     */
    public static MonitorConfig fromArgs(Builder builder, Map<String, String> args) {
        if (args == null || args.isEmpty()) {
            logger.debug("No arguments provided, using settings as loaded");
            return builder.build();
        }

        if (args.containsKey("host")) {
            builder.host(args.get("host"));
        }
        if (args.containsKey("port")) {
            parseInt(args, "port", 1, 65535).ifPresent(builder::port);
        }
        if (args.containsKey("user")) {
            builder.user(args.get("user"));
        }
        if (args.containsKey("password")) {
            builder.password(args.get("password"));
        }
        if (args.containsKey("jdbc-url")) {
            builder.jdbcUrl(args.get("jdbc-url"));
        }
        if (args.containsKey("connection-timeout")) {
            parseInt(args, "connection-timeout", 1, Integer.MAX_VALUE).ifPresent(builder::connectionTimeoutSeconds);
        }
        if (args.containsKey("retry-attempts")) {
            parseInt(args, "retry-attempts", 1, Integer.MAX_VALUE).ifPresent(builder::retryAttempts);
        }
        if (args.containsKey("retry-backoff-ms")) {
            parseInt(args, "retry-backoff-ms", 0, Integer.MAX_VALUE).ifPresent(builder::retryBackoffMs);
        }
        if (args.containsKey("query-timeout")) {
            parseInt(args, "query-timeout", 0, Integer.MAX_VALUE).ifPresent(builder::queryTimeoutSeconds);
        }
        if (args.containsKey("level")) {
            builder.level(parseLevel(args.get("level")));
        }
        if (args.containsKey("enabled-checks")) {
            builder.enabledChecks(CheckType.fromNames(splitList(args.get("enabled-checks"))));
        }
        if (args.containsKey("enable-tables")) {
            builder.tablesEnabled(Boolean.parseBoolean(args.get("enable-tables")));
        }
        if (args.containsKey("table-limit")) {
            parseInt(args, "table-limit", 1, Integer.MAX_VALUE).ifPresent(builder::tableLimit);
        }
        if (args.containsKey("disk-path")) {
            builder.diskPath(args.get("disk-path"));
        }
        if (args.containsKey("api-key")) {
            builder.reasoningApiKey(args.get("api-key"));
        }
        if (args.containsKey("model")) {
            builder.reasoningModel(args.get("model"));
        }
        if (args.containsKey("output")) {
            builder.outputDirectory(args.get("output"));
        }
        if (args.containsKey("formats")) {
            builder.outputFormats(parseFormats(splitList(args.get("formats"))));
        }

        for (Map.Entry<String, String> entry : args.entrySet()) {
            if (entry.getKey().startsWith("threshold.")) {
                String name = entry.getKey().substring("threshold.".length());
                try {
                    builder.thresholdLimit(name, Double.parseDouble(entry.getValue()));
                } catch (NumberFormatException e) {
                    logger.warn("Invalid limit for threshold {}: {}, keeping current", name, entry.getValue());
                }
            }
        }

        return builder.build();
    }

    static InspectionLevel parseLevel(String value) {
        try {
            return InspectionLevel.parse(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    static List<ReportFormat> parseFormats(List<String> names) {
        List<ReportFormat> formats = new ArrayList<>();
        for (String name : names) {
            try {
                ReportFormat format = ReportFormat.parse(name);
                if (!formats.contains(format)) {
                    formats.add(format);
                }
            } catch (IllegalArgumentException e) {
                logger.warn("Ignoring report format: {}", e.getMessage());
            }
        }
        return formats;
    }

    static List<String> splitList(String value) {
        if (value == null) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static Optional<Integer> parseInt(Map<String, String> args, String key, int min, int max) {
        String raw = args.get(key);
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < min || value > max) {
                logger.warn("Invalid {}: {}, keeping current value", key, value);
                return Optional.empty();
            }
            return Optional.of(value);
        } catch (NumberFormatException | NullPointerException e) {
            logger.warn("Invalid {} format: {}, keeping current value", key, raw);
            return Optional.empty();
        }
    }

    /**
     * The configured JDBC URL, or one derived from host and port
     */
    public String getJdbcUrl() {
        if (jdbcUrl != null && !jdbcUrl.isBlank()) {
            return jdbcUrl;
        }
        return "jdbc:mysql://" + host + ":" + port + "/";
    }

    public ConnectionIdentity connectionIdentity() {
        return new ConnectionIdentity(host, port, user);
    }

    public boolean isReasoningEnabled() {
        return reasoningApiKey != null && !reasoningApiKey.isBlank();
    }

    // Getters
    public String getHost() { return host; }
    public int getPort() { return port; }
    public String getUser() { return user; }
    public String getPassword() { return password; }
    public int getConnectionTimeoutSeconds() { return connectionTimeoutSeconds; }
    public int getRetryAttempts() { return retryAttempts; }
    public long getRetryBackoffMs() { return retryBackoffMs; }
    public int getQueryTimeoutSeconds() { return queryTimeoutSeconds; }
    public InspectionLevel getLevel() { return level; }
    public Optional<Set<CheckType>> getEnabledChecks() { return Optional.ofNullable(enabledChecks); }
    public boolean isTablesEnabled() { return tablesEnabled; }
    public int getTableLimit() { return tableLimit; }
    public String getDiskPath() { return diskPath; }
    public List<Threshold> getThresholds() { return thresholds; }
    public String getReasoningApiKey() { return reasoningApiKey; }
    public String getReasoningModel() { return reasoningModel; }
    public int getReasoningMaxTokens() { return reasoningMaxTokens; }
    public double getReasoningTemperature() { return reasoningTemperature; }
    public String getReasoningEndpoint() { return reasoningEndpoint; }
    public Duration getReasoningTimeout() { return reasoningTimeout; }
    public int getReasoningMaxRequestBytes() { return reasoningMaxRequestBytes; }
    public String getOutputDirectory() { return outputDirectory; }
    public List<ReportFormat> getOutputFormats() { return outputFormats; }

    public static class Builder {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private String user = DEFAULT_USER;
        private String password = "";
        private String jdbcUrl;
        private int connectionTimeoutSeconds = DEFAULT_CONNECTION_TIMEOUT_SECONDS;
        private int retryAttempts = DEFAULT_RETRY_ATTEMPTS;
        private long retryBackoffMs = DEFAULT_RETRY_BACKOFF_MS;
        private int queryTimeoutSeconds = DEFAULT_QUERY_TIMEOUT_SECONDS;
        private InspectionLevel level = DEFAULT_LEVEL;
        private Set<CheckType> enabledChecks;
        private boolean tablesEnabled = false;
        private int tableLimit = DEFAULT_TABLE_LIMIT;
        private String diskPath = DEFAULT_DISK_PATH;
        private final Map<String, Threshold> thresholds = new LinkedHashMap<>();
        private String reasoningApiKey = "";
        private String reasoningModel = DEFAULT_REASONING_MODEL;
        private int reasoningMaxTokens = DEFAULT_REASONING_MAX_TOKENS;
        private double reasoningTemperature = DEFAULT_REASONING_TEMPERATURE;
        private String reasoningEndpoint = DEFAULT_REASONING_ENDPOINT;
        private Duration reasoningTimeout = DEFAULT_REASONING_TIMEOUT;
        private int reasoningMaxRequestBytes = DEFAULT_REASONING_MAX_REQUEST_BYTES;
        private String outputDirectory = DEFAULT_OUTPUT_DIRECTORY;
        private List<ReportFormat> outputFormats = DEFAULT_OUTPUT_FORMATS;

        public Builder() {
            for (Threshold threshold : DefaultThresholds.all()) {
                thresholds.put(threshold.getName(), threshold);
            }
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder user(String user) {
            this.user = user;
            return this;
        }

        public Builder password(String password) {
            this.password = password == null ? "" : password;
            return this;
        }

        public Builder jdbcUrl(String jdbcUrl) {
            this.jdbcUrl = jdbcUrl;
            return this;
        }

        public Builder connectionTimeoutSeconds(int connectionTimeoutSeconds) {
            this.connectionTimeoutSeconds = connectionTimeoutSeconds;
            return this;
        }

        public Builder retryAttempts(int retryAttempts) {
            this.retryAttempts = Math.max(1, retryAttempts);
            return this;
        }

        public Builder retryBackoffMs(long retryBackoffMs) {
            this.retryBackoffMs = retryBackoffMs;
            return this;
        }

        public Builder queryTimeoutSeconds(int queryTimeoutSeconds) {
            this.queryTimeoutSeconds = queryTimeoutSeconds;
            return this;
        }

        public Builder level(InspectionLevel level) {
            this.level = level;
            return this;
        }

        public Builder enabledChecks(Set<CheckType> enabledChecks) {
            this.enabledChecks = enabledChecks;
            return this;
        }

        public Builder tablesEnabled(boolean tablesEnabled) {
            this.tablesEnabled = tablesEnabled;
            return this;
        }

        public Builder tableLimit(int tableLimit) {
            this.tableLimit = tableLimit;
            return this;
        }

        public Builder diskPath(String diskPath) {
            this.diskPath = diskPath;
            return this;
        }

        /**
         * Adds a rule, replacing a rule of the same name in place
         */
        public Builder threshold(Threshold threshold) {
            thresholds.put(threshold.getName(), threshold);
            return this;
        }

        /**
         * Overrides the limit of an existing rule. Unknown names are logged and ignored.
         */
        public Builder thresholdLimit(String name, double limit) {
            Threshold existing = thresholds.get(name);
            if (existing == null) {
                logger.warn("Unknown threshold {}, ignoring limit {}", name, limit);
            } else if (!Double.isFinite(limit)) {
                logger.warn("Invalid limit for threshold {}: {}, keeping {}", name, limit, existing.getLimit());
            } else {
                thresholds.put(name, existing.withLimit(limit));
            }
            return this;
        }

        public Builder reasoningApiKey(String reasoningApiKey) {
            this.reasoningApiKey = reasoningApiKey == null ? "" : reasoningApiKey;
            return this;
        }

        public Builder reasoningModel(String reasoningModel) {
            this.reasoningModel = reasoningModel;
            return this;
        }

        public Builder reasoningMaxTokens(int reasoningMaxTokens) {
            this.reasoningMaxTokens = reasoningMaxTokens;
            return this;
        }

        public Builder reasoningTemperature(double reasoningTemperature) {
            this.reasoningTemperature = reasoningTemperature;
            return this;
        }

        public Builder reasoningEndpoint(String reasoningEndpoint) {
            this.reasoningEndpoint = reasoningEndpoint;
            return this;
        }

        public Builder reasoningTimeout(Duration reasoningTimeout) {
            this.reasoningTimeout = reasoningTimeout;
            return this;
        }

        public Builder reasoningMaxRequestBytes(int reasoningMaxRequestBytes) {
            this.reasoningMaxRequestBytes = reasoningMaxRequestBytes;
            return this;
        }

        public Builder outputDirectory(String outputDirectory) {
            this.outputDirectory = outputDirectory;
            return this;
        }

        public Builder outputFormats(List<ReportFormat> outputFormats) {
            if (outputFormats == null || outputFormats.isEmpty()) {
                logger.warn("No valid report format given, using default: {}", DEFAULT_OUTPUT_FORMATS);
                this.outputFormats = DEFAULT_OUTPUT_FORMATS;
            } else {
                this.outputFormats = outputFormats;
            }
            return this;
        }

        public MonitorConfig build() {
            return new MonitorConfig(this);
        }
    }

    @Override
    public String toString() {
        return "MonitorConfig{" +
                "host='" + host + '\'' +
                ", port=" + port +
                ", user='" + user + '\'' +
                ", password=" + mask(password) +
                ", jdbcUrl='" + getJdbcUrl() + '\'' +
                ", connectionTimeoutSeconds=" + connectionTimeoutSeconds +
                ", retryAttempts=" + retryAttempts +
                ", retryBackoffMs=" + retryBackoffMs +
                ", queryTimeoutSeconds=" + queryTimeoutSeconds +
                ", level=" + level +
                ", enabledChecks=" + enabledChecks +
                ", tablesEnabled=" + tablesEnabled +
                ", tableLimit=" + tableLimit +
                ", thresholds=" + thresholds.size() +
                ", reasoningApiKey=" + mask(reasoningApiKey) +
                ", reasoningModel='" + reasoningModel + '\'' +
                ", outputDirectory='" + outputDirectory + '\'' +
                ", outputFormats=" + outputFormats +
                '}';
    }

    private static String mask(String secret) {
        return secret == null || secret.isEmpty() ? "<none>" : "******";
    }
}
