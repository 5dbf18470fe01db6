package io.aim.metrics;

import io.aim.core.evaluator.MetricEvaluator;
import io.aim.core.evaluator.spi.EvaluatorProvider;
import java.util.List;

/// Supplies the built-in evaluators for the metrics of the default registry.
///
/// Registered in `META-INF/services/io.aim.core.evaluator.spi.EvaluatorProvider`.
/// Runs at the default priority, so any other provider declaring a positive
/// priority can replace individual metrics.
///
/// @implNote Stateless and thread-safe. Evaluators hold no mutable state and
/// are shared by all sessions.
public class BuiltinEvaluatorProvider implements EvaluatorProvider {

    @Override
    public String getName() {
        return "builtin";
    }

    @Override
    public List<MetricEvaluator> createEvaluators() {
        return List.of(
                new PngFileSizeEvaluator(),
                new JpegFileSizeEvaluator(),
                new DistinctRgbValuesEvaluator(),
                new LuminanceDeviationEvaluator(),
                new ColorfulnessEvaluator(),
                new HsvStatisticsEvaluator(),
                new ColorBlindnessEvaluator());
    }
}
