package io.aim.metrics;

import io.aim.core.artifact.ResolvedArtifact;
import io.aim.core.evaluator.EvaluationException;
import io.aim.core.evaluator.MetricEvaluator;
import io.aim.core.evaluator.ResultValue;
import java.util.List;

/// `m15`: Hasler and Süsstrunk colourfulness.
///
/// Computed on the opponent channels `rg = R - G` and `yb = (R + G) / 2 - B`:
/// `sqrt(std(rg)² + std(yb)²) + 0.3 * sqrt(mean(rg)² + mean(yb)²)`.
public class ColorfulnessEvaluator implements MetricEvaluator {

    public static final String METRIC_ID = "m15";

    static final double MEAN_WEIGHT = 0.3;

    @Override
    public String getMetricId() {
        return METRIC_ID;
    }

    @Override
    public List<ResultValue> evaluate(ResolvedArtifact artifact) throws EvaluationException {
        int[] pixels = ImageSupport.rgbPixels(ImageSupport.decode(artifact));
        RunningStatistics rg = new RunningStatistics();
        RunningStatistics yb = new RunningStatistics();
        for (int i = 0; i < pixels.length; i++) {
            ImageSupport.checkInterrupted(i);
            double red = ImageSupport.red(pixels[i]);
            double green = ImageSupport.green(pixels[i]);
            double blue = ImageSupport.blue(pixels[i]);
            rg.add(red - green);
            yb.add(0.5 * (red + green) - blue);
        }
        double meanNorm = Math.hypot(rg.mean(), yb.mean());
        double deviationNorm = Math.hypot(rg.standardDeviation(), yb.standardDeviation());
        return List.of(ResultValue.of(deviationNorm + MEAN_WEIGHT * meanNorm));
    }
}
