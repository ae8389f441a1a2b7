package io.graphlint;

import io.graphlint.model.IssueType;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Settings for one scan. Immutable; read once when the scan starts.
 * Can be built in code or loaded from a YAML file.
 */
public class ScanConfiguration {

    private static final Set<IssueType> DEFAULT_CHECKS = EnumSet.of(
            IssueType.DEAD_NODE, IssueType.ORPHAN_NODE, IssueType.CAST_ABUSE, IssueType.TICK_ABUSE);

    private final List<String> includePaths;
    private final List<String> excludePaths;
    private final Set<IssueType> enabledChecks;
    private final boolean useMultiThreading;
    private final int maxConcurrentTasks;
    private final long handoffTimeoutMillis;
    private final long shutdownTimeoutMillis;
    private final String projectRoot;

    private ScanConfiguration(Builder builder) {
        if (builder.maxConcurrentTasks < 1) {
            throw new IllegalArgumentException("maxConcurrentTasks must be >= 1, got " + builder.maxConcurrentTasks);
        }
        if (builder.handoffTimeoutMillis < 1) {
            throw new IllegalArgumentException("handoffTimeoutMillis must be >= 1");
        }
        if (builder.shutdownTimeoutMillis < 0) {
            throw new IllegalArgumentException("shutdownTimeoutMillis must be >= 0");
        }
        if (builder.projectRoot == null || builder.projectRoot.isBlank()) {
            throw new IllegalArgumentException("projectRoot cannot be null or blank");
        }
        this.includePaths = List.copyOf(builder.includePaths);
        this.excludePaths = List.copyOf(builder.excludePaths);
        this.enabledChecks = Collections.unmodifiableSet(EnumSet.copyOf(builder.enabledChecks));
        this.useMultiThreading = builder.useMultiThreading;
        this.maxConcurrentTasks = builder.maxConcurrentTasks;
        this.handoffTimeoutMillis = builder.handoffTimeoutMillis;
        this.shutdownTimeoutMillis = builder.shutdownTimeoutMillis;
        this.projectRoot = builder.projectRoot;
    }

    /**
     * Returns the default configuration: every path, all checks except unused functions,
     * multi-threaded.
     */
    public static ScanConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Load configuration from a YAML file.
     * Missing keys keep their defaults.
     */
    public static ScanConfiguration load(Path configPath) throws IOException {
        Yaml yaml = new Yaml();

        try (InputStream in = Files.newInputStream(configPath)) {
            Map<String, Object> data = yaml.load(in);
            if (data == null) {
                throw new IOException("Empty or invalid config file: " + configPath);
            }

            Builder builder = builder();
            builder.includePaths(toList(data.get("includePaths")));
            builder.excludePaths(toList(data.get("excludePaths")));

            if (data.containsKey("enabledChecks")) {
                Set<IssueType> checks = EnumSet.noneOf(IssueType.class);
                for (String id : toList(data.get("enabledChecks"))) {
                    IssueType type = IssueType.fromId(id)
                            .orElseThrow(() -> new IOException("Unknown check '" + id + "' in " + configPath));
                    checks.add(type);
                }
                builder.enabledChecks(checks);
            }

            if (data.get("useMultiThreading") instanceof Boolean b) {
                builder.useMultiThreading(b);
            }
            if (data.containsKey("maxConcurrentTasks")) {
                builder.maxConcurrentTasks(toInt(data.get("maxConcurrentTasks"), "maxConcurrentTasks"));
            }
            if (data.containsKey("handoffTimeoutMillis")) {
                builder.handoffTimeoutMillis(toInt(data.get("handoffTimeoutMillis"), "handoffTimeoutMillis"));
            }
            if (data.containsKey("shutdownTimeoutMillis")) {
                builder.shutdownTimeoutMillis(toInt(data.get("shutdownTimeoutMillis"), "shutdownTimeoutMillis"));
            }
            if (data.get("projectRoot") instanceof String root && !root.isBlank()) {
                builder.projectRoot(root.trim());
            }

            try {
                return builder.build();
            } catch (IllegalArgumentException e) {
                throw new IOException("Invalid config file " + configPath + ": " + e.getMessage(), e);
            }
        }
    }

    private static List<String> toList(Object value) {
        if (!(value instanceof List<?> list) || list.isEmpty()) {
            return List.of();
        }
        return list.stream()
            .filter(s -> s != null && !s.toString().trim().isEmpty())
            .map(s -> s.toString().trim())
            .toList();
    }

    private static int toInt(Object value, String key) throws IOException {
        if (value instanceof Number n) {
            return n.intValue();
        }
        throw new IOException("'" + key + "' must be an integer, got: " + value);
    }

    public List<String> getIncludePaths() {
        return includePaths;
    }

    public List<String> getExcludePaths() {
        return excludePaths;
    }

    public Set<IssueType> getEnabledChecks() {
        return enabledChecks;
    }

    public boolean isCheckEnabled(IssueType type) {
        return enabledChecks.contains(type);
    }

    public boolean isUseMultiThreading() {
        return useMultiThreading;
    }

    /**
     * Upper bound on concurrent analysis tasks. Analysis always runs on the single
     * coordinator thread, so values above one do not add parallelism.
     */
    public int getMaxConcurrentTasks() {
        return maxConcurrentTasks;
    }

    public Duration getHandoffTimeout() {
        return Duration.ofMillis(handoffTimeoutMillis);
    }

    public Duration getShutdownTimeout() {
        return Duration.ofMillis(shutdownTimeoutMillis);
    }

    public String getProjectRoot() {
        return projectRoot;
    }

    /**
     * Check if an asset path passes the include and exclude filters.
     * Both match by substring; an empty include list accepts every path.
     */
    public boolean matchesPathFilters(String assetPath) {
        for (String exclude : excludePaths) {
            if (assetPath.contains(exclude)) {
                return false;
            }
        }
        if (includePaths.isEmpty()) {
            return true;
        }
        for (String include : includePaths) {
            if (assetPath.contains(include)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "ScanConfiguration[include=" + includePaths + ", exclude=" + excludePaths
                + ", checks=" + enabledChecks + ", multiThreading=" + useMultiThreading
                + ", maxConcurrentTasks=" + maxConcurrentTasks + ", projectRoot=" + projectRoot + "]";
    }

    public static class Builder {
        private final List<String> includePaths = new ArrayList<>();
        private final List<String> excludePaths = new ArrayList<>();
        private final Set<IssueType> enabledChecks = EnumSet.copyOf(DEFAULT_CHECKS);
        private boolean useMultiThreading = true;
        private int maxConcurrentTasks = 4;
        private long handoffTimeoutMillis = 10;
        private long shutdownTimeoutMillis = 5000;
        private String projectRoot = "/Game";

        public Builder includePaths(Collection<String> paths) {
            this.includePaths.clear();
            this.includePaths.addAll(paths);
            return this;
        }

        public Builder excludePaths(Collection<String> paths) {
            this.excludePaths.clear();
            this.excludePaths.addAll(paths);
            return this;
        }

        public Builder enabledChecks(Collection<IssueType> checks) {
            this.enabledChecks.clear();
            this.enabledChecks.addAll(checks);
            return this;
        }

        public Builder enableCheck(IssueType check) {
            this.enabledChecks.add(check);
            return this;
        }

        public Builder useMultiThreading(boolean useMultiThreading) {
            this.useMultiThreading = useMultiThreading;
            return this;
        }

        public Builder maxConcurrentTasks(int maxConcurrentTasks) {
            this.maxConcurrentTasks = maxConcurrentTasks;
            return this;
        }

        public Builder handoffTimeoutMillis(long handoffTimeoutMillis) {
            this.handoffTimeoutMillis = handoffTimeoutMillis;
            return this;
        }

        public Builder shutdownTimeoutMillis(long shutdownTimeoutMillis) {
            this.shutdownTimeoutMillis = shutdownTimeoutMillis;
            return this;
        }

        public Builder projectRoot(String projectRoot) {
            this.projectRoot = projectRoot;
            return this;
        }

        public ScanConfiguration build() {
            return new ScanConfiguration(this);
        }
    }
}
