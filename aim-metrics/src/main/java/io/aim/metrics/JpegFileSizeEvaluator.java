package io.aim.metrics;

import io.aim.core.artifact.ResolvedArtifact;
import io.aim.core.evaluator.EvaluationException;
import io.aim.core.evaluator.MetricEvaluator;
import io.aim.core.evaluator.ResultValue;
import java.awt.image.BufferedImage;
import java.util.List;

/// `m2`: size in bytes of the artifact re-encoded as JPEG at quality 70.
///
/// Loosely associated with perceived clutter.
public class JpegFileSizeEvaluator implements MetricEvaluator {

    public static final String METRIC_ID = "m2";

    static final float JPEG_QUALITY = 0.7f;

    @Override
    public String getMetricId() {
        return METRIC_ID;
    }

    @Override
    public List<ResultValue> evaluate(ResolvedArtifact artifact) throws EvaluationException {
        BufferedImage image = ImageSupport.decode(artifact);
        BufferedImage rgb =
                ImageSupport.toRgbImage(
                        ImageSupport.rgbPixels(image), image.getWidth(), image.getHeight());
        byte[] jpeg = ImageSupport.encodeJpeg(rgb, JPEG_QUALITY);
        return List.of(ResultValue.of((long) jpeg.length));
    }
}
