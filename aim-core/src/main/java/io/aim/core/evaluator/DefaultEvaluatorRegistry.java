package io.aim.core.evaluator;

import io.aim.core.evaluator.spi.EvaluatorProvider;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.logging.Logger;

/// Immutable {@link EvaluatorRegistry} assembled from {@link EvaluatorProvider}s.
///
/// Providers are consulted in ascending priority order so that, for any
/// metric id supplied by more than one provider, the evaluator of the
/// highest-priority provider is the one kept.
///
/// @implNote Thread-safe after construction.
public class DefaultEvaluatorRegistry implements EvaluatorRegistry {

    private static final Logger logger =
            Logger.getLogger(DefaultEvaluatorRegistry.class.getName());

    private final Map<String, MetricEvaluator> evaluators;

    /// Creates a registry from explicit providers.
    ///
    /// @param providers evaluator providers, not null (may be empty)
    public DefaultEvaluatorRegistry(List<EvaluatorProvider> providers) {
        Objects.requireNonNull(providers, "providers must not be null");
        List<EvaluatorProvider> ordered = new ArrayList<>(providers);
        ordered.sort(Comparator.comparingInt(EvaluatorProvider::getPriority));

        Map<String, MetricEvaluator> collected = new HashMap<>();
        Map<String, String> owners = new HashMap<>();
        for (EvaluatorProvider provider : ordered) {
            for (MetricEvaluator evaluator : provider.createEvaluators()) {
                String metricId = evaluator.getMetricId();
                String previous = owners.put(metricId, provider.getName());
                if (previous != null) {
                    logger.info(
                            "Evaluator for metric '"
                                    + metricId
                                    + "' from provider '"
                                    + previous
                                    + "' overridden by '"
                                    + provider.getName()
                                    + "'");
                }
                collected.put(metricId, evaluator);
            }
        }
        this.evaluators = Collections.unmodifiableMap(collected);

        logger.info(
                "Registered "
                        + evaluators.size()
                        + " metric evaluators from providers "
                        + ordered.stream().map(EvaluatorProvider::getName).toList());
    }

    /// Creates a registry from the given evaluators, as if supplied by one provider.
    ///
    /// @param evaluators the evaluators, not null
    /// @return the registry, never null
    public static DefaultEvaluatorRegistry of(MetricEvaluator... evaluators) {
        List<MetricEvaluator> list = List.of(evaluators);
        return new DefaultEvaluatorRegistry(
                List.of(
                        new EvaluatorProvider() {
                            @Override
                            public String getName() {
                                return "explicit";
                            }

                            @Override
                            public List<MetricEvaluator> createEvaluators() {
                                return list;
                            }
                        }));
    }

    /// Discovers all providers on the classpath via {@link ServiceLoader}.
    ///
    /// @return discovered providers, never null (may be empty)
    public static List<EvaluatorProvider> discoverProviders() {
        List<EvaluatorProvider> discovered = new ArrayList<>();
        for (EvaluatorProvider provider : ServiceLoader.load(EvaluatorProvider.class)) {
            discovered.add(provider);
            logger.fine("Discovered evaluator provider: " + provider.getName());
        }
        return discovered;
    }

    @Override
    public Optional<MetricEvaluator> getEvaluator(String metricId) {
        Objects.requireNonNull(metricId, "metricId must not be null");
        return Optional.ofNullable(evaluators.get(metricId));
    }

    @Override
    public boolean hasEvaluator(String metricId) {
        return metricId != null && evaluators.containsKey(metricId);
    }

    @Override
    public Set<String> getMetricIds() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(evaluators.keySet()));
    }
}
