package io.aim.metrics;

import io.aim.core.artifact.ResolvedArtifact;
import io.aim.core.evaluator.MetricEvaluator;
import io.aim.core.evaluator.ResultValue;
import java.util.List;

/// `m1`: size of the PNG artifact in bytes.
///
/// A larger file suggests more effectively used colours, confounded by
/// overall image complexity.
public class PngFileSizeEvaluator implements MetricEvaluator {

    public static final String METRIC_ID = "m1";

    @Override
    public String getMetricId() {
        return METRIC_ID;
    }

    @Override
    public List<ResultValue> evaluate(ResolvedArtifact artifact) {
        return List.of(ResultValue.of((long) artifact.size()));
    }
}
