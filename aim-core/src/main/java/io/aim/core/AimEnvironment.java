package io.aim.core;

import io.aim.core.classify.ResultClassifier;
import io.aim.core.evaluator.EvaluatorRegistry;
import io.aim.core.execution.EvaluationDispatcher;
import io.aim.core.metric.MetricRegistry;

/// Container holding the wired components of an evaluation environment.
///
/// Implements {@link AutoCloseable} so that the dispatcher's thread pools
/// are shut down with the environment.
///
/// ### Contracts
/// - **Invariant**: component references are immutable after construction
///
/// @apiNote Create instances via {@link AimFactory} rather than directly.
public final class AimEnvironment implements AutoCloseable {

    private final AimConfig config;
    private final MetricRegistry metricRegistry;
    private final EvaluatorRegistry evaluatorRegistry;
    private final ResultClassifier classifier;
    private final EvaluationDispatcher dispatcher;

    public AimEnvironment(
            AimConfig config,
            MetricRegistry metricRegistry,
            EvaluatorRegistry evaluatorRegistry,
            ResultClassifier classifier,
            EvaluationDispatcher dispatcher) {
        this.config = config;
        this.metricRegistry = metricRegistry;
        this.evaluatorRegistry = evaluatorRegistry;
        this.classifier = classifier;
        this.dispatcher = dispatcher;
    }

    public AimConfig getConfig() {
        return config;
    }

    public MetricRegistry getMetricRegistry() {
        return metricRegistry;
    }

    public EvaluatorRegistry getEvaluatorRegistry() {
        return evaluatorRegistry;
    }

    public ResultClassifier getClassifier() {
        return classifier;
    }

    /// Returns the dispatcher that accepts evaluation requests.
    ///
    /// @return the dispatcher, never null
    public EvaluationDispatcher getDispatcher() {
        return dispatcher;
    }

    /// Shuts down the dispatcher. Queued tasks still run to completion.
    @Override
    public void close() {
        dispatcher.shutdown();
    }
}
