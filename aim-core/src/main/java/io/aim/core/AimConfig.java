package io.aim.core;

import io.aim.core.execution.SchedulingPolicy;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

/// Configuration options for the AIM evaluation environment.
///
/// Controls worker pool sizing, per-metric timeouts, artifact limits and
/// scheduling order. Use the {@link Builder} for fluent configuration,
/// {@link #fromProperties(Properties)} to read a properties file, or the
/// setters for mutable configuration.
///
/// ### Default Values
/// - `workerPoolSize`: number of available processors
/// - `taskTimeout`: 60 seconds
/// - `maxArtifactBytes`: 10 MiB
/// - `schedulingPolicy`: {@link SchedulingPolicy#SPEED_FIRST}
/// - `acceptedMimeTypes`: `image/png`, `image/jpeg`
/// - `requireEvaluators`: `true`
/// - `artifactRoot`: none, file artifact locators are rejected
///
/// @implNote **Not thread-safe**. Configure before passing to {@link AimFactory}
/// and do not modify after environment creation.
///
/// @see AimFactory#createEnvironment(AimConfig, io.aim.core.metric.MetricRegistry)
public class AimConfig {

    public static final String WORKER_POOL_SIZE = "aim.worker-pool-size";
    public static final String TASK_TIMEOUT_MS = "aim.task-timeout-ms";
    public static final String MAX_ARTIFACT_BYTES = "aim.max-artifact-bytes";
    public static final String SCHEDULING_POLICY = "aim.scheduling-policy";
    public static final String REQUIRE_EVALUATORS = "aim.require-evaluators";
    public static final String ARTIFACT_ROOT = "aim.artifact-root";

    static final Duration DEFAULT_TASK_TIMEOUT = Duration.ofSeconds(60);
    static final long DEFAULT_MAX_ARTIFACT_BYTES = 10L * 1024 * 1024;

    private int workerPoolSize = Runtime.getRuntime().availableProcessors();
    private Duration taskTimeout = DEFAULT_TASK_TIMEOUT;
    private long maxArtifactBytes = DEFAULT_MAX_ARTIFACT_BYTES;
    private SchedulingPolicy schedulingPolicy = SchedulingPolicy.SPEED_FIRST;
    private Set<String> acceptedMimeTypes = Set.of("image/png", "image/jpeg");
    private boolean requireEvaluators = true;
    private Path artifactRoot;

    /// Creates a configuration with default values.
    public AimConfig() {}

    /// Reads a configuration from properties, keeping defaults for absent keys.
    ///
    /// ### Keys
    /// - `aim.worker-pool-size` - positive integer
    /// - `aim.task-timeout-ms` - positive integer
    /// - `aim.max-artifact-bytes` - positive integer
    /// - `aim.scheduling-policy` - `speed-first` or `registration-order`
    /// - `aim.require-evaluators` - `true` or `false`
    /// - `aim.artifact-root` - directory file locators are confined to
    ///
    /// @param properties source properties, not null
    /// @return a new configuration, never null
    /// @throws IllegalArgumentException if a present value cannot be parsed
    public static AimConfig fromProperties(Properties properties) {
        AimConfig config = new AimConfig();
        String poolSize = properties.getProperty(WORKER_POOL_SIZE);
        if (poolSize != null) {
            config.setWorkerPoolSize(parsePositive(WORKER_POOL_SIZE, poolSize));
        }
        String timeout = properties.getProperty(TASK_TIMEOUT_MS);
        if (timeout != null) {
            config.setTaskTimeout(Duration.ofMillis(parsePositive(TASK_TIMEOUT_MS, timeout)));
        }
        String maxBytes = properties.getProperty(MAX_ARTIFACT_BYTES);
        if (maxBytes != null) {
            config.setMaxArtifactBytes(parsePositive(MAX_ARTIFACT_BYTES, maxBytes));
        }
        String policy = properties.getProperty(SCHEDULING_POLICY);
        if (policy != null) {
            config.setSchedulingPolicy(parsePolicy(policy));
        }
        String require = properties.getProperty(REQUIRE_EVALUATORS);
        if (require != null) {
            config.setRequireEvaluators(Boolean.parseBoolean(require.trim()));
        }
        String root = properties.getProperty(ARTIFACT_ROOT);
        if (root != null && !root.isBlank()) {
            config.setArtifactRoot(Path.of(root.trim()));
        }
        return config;
    }

    private static int parsePositive(String key, String value) {
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed <= 0) {
                throw new IllegalArgumentException(key + " must be positive, got " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got " + value, e);
        }
    }

    private static SchedulingPolicy parsePolicy(String value) {
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return SchedulingPolicy.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    SCHEDULING_POLICY + " must be speed-first or registration-order, got " + value, e);
        }
    }

    /// @return number of worker threads running metrics concurrently
    public int getWorkerPoolSize() {
        return workerPoolSize;
    }

    /// Sets the number of worker threads.
    ///
    /// @param workerPoolSize thread count, must be positive
    public void setWorkerPoolSize(int workerPoolSize) {
        if (workerPoolSize <= 0) {
            throw new IllegalArgumentException("workerPoolSize must be positive");
        }
        this.workerPoolSize = workerPoolSize;
    }

    /// @return longest time a worker waits for one metric
    public Duration getTaskTimeout() {
        return taskTimeout;
    }

    public void setTaskTimeout(Duration taskTimeout) {
        if (taskTimeout == null || taskTimeout.isNegative() || taskTimeout.isZero()) {
            throw new IllegalArgumentException("taskTimeout must be positive");
        }
        this.taskTimeout = taskTimeout;
    }

    public long getMaxArtifactBytes() {
        return maxArtifactBytes;
    }

    public void setMaxArtifactBytes(long maxArtifactBytes) {
        this.maxArtifactBytes = maxArtifactBytes;
    }

    public SchedulingPolicy getSchedulingPolicy() {
        return schedulingPolicy;
    }

    public void setSchedulingPolicy(SchedulingPolicy schedulingPolicy) {
        this.schedulingPolicy = schedulingPolicy;
    }

    /// @return lower-case mime types the evaluators accept, never null
    public Set<String> getAcceptedMimeTypes() {
        return acceptedMimeTypes;
    }

    public void setAcceptedMimeTypes(Set<String> acceptedMimeTypes) {
        this.acceptedMimeTypes = Set.copyOf(acceptedMimeTypes);
    }

    /// Returns whether every registered metric must have an evaluator.
    ///
    /// When `false`, metrics without an evaluator are logged at startup and
    /// requests naming them are rejected.
    ///
    /// @return `true` if startup fails on missing evaluators
    public boolean isRequireEvaluators() {
        return requireEvaluators;
    }

    public void setRequireEvaluators(boolean requireEvaluators) {
        this.requireEvaluators = requireEvaluators;
    }

    /// @return directory file artifact locators are confined to, or null when they are rejected
    public Path getArtifactRoot() {
        return artifactRoot;
    }

    public void setArtifactRoot(Path artifactRoot) {
        this.artifactRoot = artifactRoot;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link AimConfig}.
    ///
    /// @implNote The builder mutates a single config instance and returns it
    /// on {@link #build()}.
    public static class Builder {
        private final AimConfig config = new AimConfig();

        public Builder workerPoolSize(int workerPoolSize) {
            config.setWorkerPoolSize(workerPoolSize);
            return this;
        }

        public Builder taskTimeout(Duration taskTimeout) {
            config.setTaskTimeout(taskTimeout);
            return this;
        }

        public Builder maxArtifactBytes(long maxArtifactBytes) {
            config.setMaxArtifactBytes(maxArtifactBytes);
            return this;
        }

        public Builder schedulingPolicy(SchedulingPolicy schedulingPolicy) {
            config.setSchedulingPolicy(schedulingPolicy);
            return this;
        }

        public Builder acceptedMimeTypes(Set<String> acceptedMimeTypes) {
            config.setAcceptedMimeTypes(acceptedMimeTypes);
            return this;
        }

        public Builder requireEvaluators(boolean requireEvaluators) {
            config.setRequireEvaluators(requireEvaluators);
            return this;
        }

        public Builder artifactRoot(Path artifactRoot) {
            config.setArtifactRoot(artifactRoot);
            return this;
        }

        /// Builds and returns the configured instance.
        ///
        /// @return the configuration, never null
        public AimConfig build() {
            return config;
        }
    }
}
