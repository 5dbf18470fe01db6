package io.aim.metrics;

import io.aim.core.artifact.ResolvedArtifact;
import io.aim.core.evaluator.EvaluationException;
import io.aim.core.evaluator.MetricEvaluator;
import io.aim.core.evaluator.ResultValue;
import java.util.Arrays;
import java.util.List;

/// `m3`: number of distinct RGB colours used by more than
/// {@value #COLOR_REDUCTION_THRESHOLD} pixels.
///
/// The threshold drops anti-aliasing and compression noise.
public class DistinctRgbValuesEvaluator implements MetricEvaluator {

    public static final String METRIC_ID = "m3";

    static final int COLOR_REDUCTION_THRESHOLD = 5;

    @Override
    public String getMetricId() {
        return METRIC_ID;
    }

    @Override
    public List<ResultValue> evaluate(ResolvedArtifact artifact) throws EvaluationException {
        int[] pixels = ImageSupport.rgbPixels(ImageSupport.decode(artifact));
        Arrays.sort(pixels);

        long distinct = 0;
        int run = 1;
        for (int i = 1; i <= pixels.length; i++) {
            ImageSupport.checkInterrupted(i);
            if (i < pixels.length && pixels[i] == pixels[i - 1]) {
                run++;
                continue;
            }
            if (run > COLOR_REDUCTION_THRESHOLD) {
                distinct++;
            }
            run = 1;
        }
        return List.of(ResultValue.of(distinct));
    }
}
