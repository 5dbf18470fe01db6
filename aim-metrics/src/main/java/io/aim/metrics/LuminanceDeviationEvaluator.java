package io.aim.metrics;

import io.aim.core.artifact.ResolvedArtifact;
import io.aim.core.evaluator.EvaluationException;
import io.aim.core.evaluator.MetricEvaluator;
import io.aim.core.evaluator.ResultValue;
import java.util.List;

/// `m13`: standard deviation of luminance across all pixels.
///
/// Luminance uses the Rec. 709 coefficients on gamma-encoded values, without
/// display-dependent correction.
public class LuminanceDeviationEvaluator implements MetricEvaluator {

    public static final String METRIC_ID = "m13";

    private static final double RED = 0.2126;
    private static final double GREEN = 0.7152;
    private static final double BLUE = 0.0722;

    @Override
    public String getMetricId() {
        return METRIC_ID;
    }

    @Override
    public List<ResultValue> evaluate(ResolvedArtifact artifact) throws EvaluationException {
        int[] pixels = ImageSupport.rgbPixels(ImageSupport.decode(artifact));
        RunningStatistics luminance = new RunningStatistics();
        for (int i = 0; i < pixels.length; i++) {
            ImageSupport.checkInterrupted(i);
            int rgb = pixels[i];
            luminance.add(
                    RED * ImageSupport.red(rgb)
                            + GREEN * ImageSupport.green(rgb)
                            + BLUE * ImageSupport.blue(rgb));
        }
        return List.of(ResultValue.of(luminance.standardDeviation()));
    }
}
