package io.aim.core;

import io.aim.core.artifact.ArtifactResolver;
import io.aim.core.artifact.DefaultArtifactResolver;
import io.aim.core.classify.ResultClassifier;
import io.aim.core.classify.ScoreBandClassifier;
import io.aim.core.evaluator.DefaultEvaluatorRegistry;
import io.aim.core.evaluator.EvaluatorRegistry;
import io.aim.core.evaluator.spi.EvaluatorProvider;
import io.aim.core.execution.EvaluationDispatcher;
import io.aim.core.execution.EvaluationListener;
import io.aim.core.metric.MetricRegistry;
import io.aim.core.metric.model.MetricDescriptor;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Factory for creating and wiring AIM evaluation environments.
///
/// ### Usage Patterns
///
/// **Builder with explicit providers**:
/// {@snippet :
/// var env = AimFactory.builder()
///     .config(AimConfig.builder().workerPoolSize(4).build())
///     .metricRegistry(registry)
///     .evaluatorProviders(List.of(new BuiltinEvaluatorProvider()))
///     .build();
/// }
///
/// **Providers discovered from the classpath**:
/// {@snippet :
/// var env = AimFactory.createEnvironment(new AimConfig(), registry);
/// }
///
/// At startup every metric in the registry is checked for an evaluator.
/// With `requireEvaluators` enabled (the default) a missing evaluator fails
/// environment creation; otherwise it is logged and requests naming that
/// metric are rejected.
///
/// @see AimEnvironment
/// @see AimConfig
public final class AimFactory {

    private static final Logger logger = Logger.getLogger(AimFactory.class.getName());

    private AimFactory() {
        // Utility class - prevent instantiation
    }

    /// Creates an environment whose evaluators are discovered via `ServiceLoader`.
    ///
    /// @param config configuration options, not null
    /// @param metricRegistry validated metric registry, not null
    /// @return a fully-configured environment, never null
    /// @throws IllegalStateException if evaluators are required and some are missing
    public static AimEnvironment createEnvironment(AimConfig config, MetricRegistry metricRegistry) {
        return builder()
                .config(config)
                .metricRegistry(metricRegistry)
                .evaluatorProviders(DefaultEvaluatorRegistry.discoverProviders())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Checks that every registered metric has an evaluator.
    ///
    /// @param config configuration deciding whether gaps are fatal, not null
    /// @param metricRegistry the metrics, not null
    /// @param evaluatorRegistry the evaluators, not null
    /// @return ids of metrics without an evaluator, never null
    /// @throws IllegalStateException if gaps exist and evaluators are required
    static List<String> checkEvaluators(
            AimConfig config, MetricRegistry metricRegistry, EvaluatorRegistry evaluatorRegistry) {
        List<String> missing = new ArrayList<>();
        for (MetricDescriptor metric : metricRegistry.all()) {
            if (!evaluatorRegistry.hasEvaluator(metric.getId())) {
                missing.add(metric.getId());
            }
        }
        if (!missing.isEmpty()) {
            if (config.isRequireEvaluators()) {
                throw new IllegalStateException("No evaluator registered for metrics " + missing);
            }
            logger.warning("No evaluator registered for metrics " + missing + "; requests for them will be rejected");
        }
        for (String metricId : evaluatorRegistry.getMetricIds()) {
            if (!metricRegistry.contains(metricId)) {
                logger.info("Evaluator for metric '" + metricId + "' has no registry entry and will not be used");
            }
        }
        return missing;
    }

    /// Fluent builder for {@link AimEnvironment} instances.
    ///
    /// Required: {@link #metricRegistry(MetricRegistry)}. When no providers
    /// are given, providers are discovered from the classpath.
    ///
    /// @implNote **Not thread-safe**. Configure on one thread, then call {@link #build()}.
    public static class Builder {
        private AimConfig config = new AimConfig();
        private MetricRegistry metricRegistry;
        private List<EvaluatorProvider> evaluatorProviders;
        private EvaluatorRegistry evaluatorRegistry;
        private ResultClassifier classifier = new ScoreBandClassifier();
        private ArtifactResolver artifactResolver;
        private EvaluationListener listener = EvaluationListener.NOOP;

        public Builder config(AimConfig config) {
            this.config = config;
            return this;
        }

        public Builder metricRegistry(MetricRegistry metricRegistry) {
            this.metricRegistry = metricRegistry;
            return this;
        }

        /// Sets the evaluator providers, replacing classpath discovery.
        ///
        /// @param evaluatorProviders providers, not null
        /// @return this builder for chaining
        public Builder evaluatorProviders(List<EvaluatorProvider> evaluatorProviders) {
            this.evaluatorProviders = List.copyOf(evaluatorProviders);
            return this;
        }

        /// Sets a pre-built evaluator registry, overriding any providers.
        ///
        /// @param evaluatorRegistry the registry, not null
        /// @return this builder for chaining
        public Builder evaluatorRegistry(EvaluatorRegistry evaluatorRegistry) {
            this.evaluatorRegistry = evaluatorRegistry;
            return this;
        }

        public Builder classifier(ResultClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        public Builder artifactResolver(ArtifactResolver artifactResolver) {
            this.artifactResolver = artifactResolver;
            return this;
        }

        public Builder listener(EvaluationListener listener) {
            this.listener = listener;
            return this;
        }

        /// Wires and returns the environment.
        ///
        /// @return the environment, never null
        /// @throws NullPointerException if no metric registry was set
        /// @throws IllegalStateException if evaluators are required and some are missing
        public AimEnvironment build() {
            Objects.requireNonNull(metricRegistry, "metricRegistry must be set");
            EvaluatorRegistry evaluators = evaluatorRegistry;
            if (evaluators == null) {
                List<EvaluatorProvider> providers =
                        evaluatorProviders != null
                                ? evaluatorProviders
                                : DefaultEvaluatorRegistry.discoverProviders();
                evaluators = new DefaultEvaluatorRegistry(providers);
            }
            checkEvaluators(config, metricRegistry, evaluators);
            ArtifactResolver resolver =
                    artifactResolver != null
                            ? artifactResolver
                            : new DefaultArtifactResolver(config.getArtifactRoot(), config.getMaxArtifactBytes());

            EvaluationDispatcher dispatcher =
                    new EvaluationDispatcher(metricRegistry, evaluators, classifier, resolver, config, listener);
            return new AimEnvironment(config, metricRegistry, evaluators, classifier, dispatcher);
        }
    }
}
