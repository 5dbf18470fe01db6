package io.aim.server.config;

import io.aim.core.AimConfig;
import io.aim.core.AimEnvironment;
import io.aim.core.AimFactory;
import io.aim.core.execution.EvaluationListener;
import io.aim.core.metric.MetricRegistry;
import io.aim.serialization.MetricRegistryLoader;
import io.aim.server.execution.CompositeEvaluationListener;
import io.aim.server.execution.LoggingEvaluationListener;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import org.eclipse.microprofile.config.Config;
import org.jboss.logging.Logger;

/// CDI producer for the evaluation environment.
///
/// Wires the metric registry, evaluators and dispatcher via {@link AimFactory}.
///
/// ### Configuration Properties
/// Read from MicroProfile Config, so `META-INF/microprofile-config.properties`,
/// system properties and environment variables all apply in the usual order.
///
/// | Property | Type | Default | Description |
/// |----------|------|---------|-------------|
/// | `aim.worker-pool-size` | int | available processors | Concurrent metric computations |
/// | `aim.task-timeout-ms` | long | `60000` | Per-metric time limit |
/// | `aim.max-artifact-bytes` | long | `10485760` | Largest accepted artifact |
/// | `aim.scheduling-policy` | String | `speed-first` | `speed-first` or `registration-order` |
/// | `aim.require-evaluators` | boolean | `true` | Refuse to start with unimplemented metrics |
/// | `aim.artifact-root` | path | - | Directory file artifact locators are confined to |
/// | `aim.registry-path` | path | - | Registry document replacing the built-in one |
///
/// Evaluators are discovered from the classpath. Every CDI-provided
/// {@link EvaluationListener} is notified after the logging listener.
///
/// @implNote Application-scoped. The environment's worker pools are shut
/// down when the container disposes of it.
@ApplicationScoped
public class AimEnvironmentProducer {

    private static final Logger LOG = Logger.getLogger(AimEnvironmentProducer.class);

    static final String AIM_PREFIX = "aim.";
    static final String REGISTRY_PATH = "aim.registry-path";

    @Inject Config config;

    @Inject Instance<EvaluationListener> listeners;

    /// Produces the evaluation environment for CDI injection.
    ///
    /// @return configured environment singleton, never null
    /// @throws io.aim.core.exception.RegistryValidationException if the registry document is invalid
    @Produces
    @ApplicationScoped
    public AimEnvironment aimEnvironment() {
        Properties properties = extractAimProperties();
        List<EvaluationListener> delegates = new ArrayList<>();
        delegates.add(new LoggingEvaluationListener());
        if (listeners != null) {
            listeners.forEach(delegates::add);
        }

        AimEnvironment environment =
                AimFactory.builder()
                        .config(AimConfig.fromProperties(properties))
                        .metricRegistry(loadRegistry(properties))
                        .listener(new CompositeEvaluationListener(delegates))
                        .build();
        LOG.infov(
                "Configured AimEnvironment with {0} metrics and {1} evaluators",
                environment.getMetricRegistry().size(),
                environment.getEvaluatorRegistry().getMetricIds().size());
        return environment;
    }

    /// Shuts down the environment's worker pools.
    ///
    /// @param environment the produced environment, not null
    public void close(@Disposes AimEnvironment environment) {
        environment.close();
        LOG.info("AimEnvironment closed");
    }

    static MetricRegistry loadRegistry(Properties properties) {
        String path = properties.getProperty(REGISTRY_PATH);
        if (path == null || path.isBlank()) {
            return MetricRegistryLoader.loadDefault();
        }
        try {
            LOG.infov("Loading metric registry from {0}", path);
            return MetricRegistryLoader.load(Path.of(path.trim()));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read metric registry " + path, e);
        }
    }

    /// Extracts every `aim.*` property from MicroProfile Config.
    Properties extractAimProperties() {
        Properties properties = new Properties();
        for (String name : config.getPropertyNames()) {
            if (name.startsWith(AIM_PREFIX)) {
                config.getOptionalValue(name, String.class)
                        .ifPresent(value -> properties.setProperty(name, value));
            }
        }
        return properties;
    }
}
