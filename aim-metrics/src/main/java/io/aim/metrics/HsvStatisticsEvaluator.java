package io.aim.metrics;

import io.aim.core.artifact.ResolvedArtifact;
import io.aim.core.evaluator.EvaluationException;
import io.aim.core.evaluator.MetricEvaluator;
import io.aim.core.evaluator.ResultValue;
import java.awt.Color;
import java.util.List;

/// `m16`: averages and deviations in HSV space.
///
/// Results, in index order:
/// 0. average hue in degrees `[0, 360)`, a circular mean
/// 1. average saturation `[0, 1]`
/// 2. standard deviation of saturation
/// 3. average value `[0, 1]`
/// 4. standard deviation of value
public class HsvStatisticsEvaluator implements MetricEvaluator {

    public static final String METRIC_ID = "m16";

    @Override
    public String getMetricId() {
        return METRIC_ID;
    }

    @Override
    public List<ResultValue> evaluate(ResolvedArtifact artifact) throws EvaluationException {
        int[] pixels = ImageSupport.rgbPixels(ImageSupport.decode(artifact));
        RunningStatistics hueSine = new RunningStatistics();
        RunningStatistics hueCosine = new RunningStatistics();
        RunningStatistics saturation = new RunningStatistics();
        RunningStatistics value = new RunningStatistics();
        float[] hsb = new float[3];
        for (int i = 0; i < pixels.length; i++) {
            ImageSupport.checkInterrupted(i);
            int rgb = pixels[i];
            Color.RGBtoHSB(ImageSupport.red(rgb), ImageSupport.green(rgb), ImageSupport.blue(rgb), hsb);
            double hue = Math.toRadians(hsb[0] * 360.0);
            hueSine.add(Math.sin(hue));
            hueCosine.add(Math.cos(hue));
            saturation.add(hsb[1]);
            value.add(hsb[2]);
        }
        return List.of(
                ResultValue.of(averageHue(hueSine.mean(), hueCosine.mean())),
                ResultValue.of(saturation.mean()),
                ResultValue.of(saturation.standardDeviation()),
                ResultValue.of(value.mean()),
                ResultValue.of(value.standardDeviation()));
    }

    static double averageHue(double meanSine, double meanCosine) {
        double degrees = Math.toDegrees(Math.atan2(meanSine, meanCosine));
        return degrees < 0 ? degrees + 360.0 : degrees;
    }
}
