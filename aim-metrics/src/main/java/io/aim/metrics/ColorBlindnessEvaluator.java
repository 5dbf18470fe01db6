package io.aim.metrics;

import io.aim.core.artifact.ResolvedArtifact;
import io.aim.core.evaluator.EvaluationException;
import io.aim.core.evaluator.MetricEvaluator;
import io.aim.core.evaluator.ResultValue;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

/// `m23`: the artifact as seen with complete protanopia, deuteranopia and tritanopia.
///
/// Each simulation linearizes sRGB, applies the Machado, Oliveira and
/// Fernandes (2009) matrix for severity 1.0 and re-encodes to sRGB. Results
/// are PNG images in base64, in the order of {@link Deficiency}.
public class ColorBlindnessEvaluator implements MetricEvaluator {

    public static final String METRIC_ID = "m23";

    /// Simulated deficiencies, in result-index order.
    enum Deficiency {
        PROTANOPIA(
                new double[][] {
                    {0.152286, 1.052583, -0.204868},
                    {0.114503, 0.786281, 0.099216},
                    {-0.003882, -0.048116, 1.051998}
                }),
        DEUTERANOPIA(
                new double[][] {
                    {0.367322, 0.860646, -0.227968},
                    {0.280085, 0.672501, 0.047413},
                    {-0.011820, 0.042940, 0.968881}
                }),
        TRITANOPIA(
                new double[][] {
                    {1.255528, -0.076749, -0.178779},
                    {-0.078411, 0.930809, 0.147602},
                    {0.004733, 0.691367, 0.303900}
                });

        private final double[][] matrix;

        Deficiency(double[][] matrix) {
            this.matrix = matrix;
        }
    }

    private static final double[] LINEAR = new double[256];

    static {
        for (int i = 0; i < LINEAR.length; i++) {
            LINEAR[i] = toLinear(i / 255.0);
        }
    }

    @Override
    public String getMetricId() {
        return METRIC_ID;
    }

    @Override
    public List<ResultValue> evaluate(ResolvedArtifact artifact) throws EvaluationException {
        BufferedImage image = ImageSupport.decode(artifact);
        int[] pixels = ImageSupport.rgbPixels(image);
        List<ResultValue> results = new ArrayList<>(Deficiency.values().length);
        for (Deficiency deficiency : Deficiency.values()) {
            int[] simulated = simulate(pixels, deficiency);
            results.add(
                    ResultValue.image(
                            ImageSupport.encodePngBase64(
                                    ImageSupport.toRgbImage(simulated, image.getWidth(), image.getHeight()))));
        }
        return results;
    }

    static int[] simulate(int[] pixels, Deficiency deficiency) throws EvaluationException {
        double[][] m = deficiency.matrix;
        int[] out = new int[pixels.length];
        for (int i = 0; i < pixels.length; i++) {
            ImageSupport.checkInterrupted(i);
            int rgb = pixels[i];
            double r = LINEAR[ImageSupport.red(rgb)];
            double g = LINEAR[ImageSupport.green(rgb)];
            double b = LINEAR[ImageSupport.blue(rgb)];
            int red = toByte(m[0][0] * r + m[0][1] * g + m[0][2] * b);
            int green = toByte(m[1][0] * r + m[1][1] * g + m[1][2] * b);
            int blue = toByte(m[2][0] * r + m[2][1] * g + m[2][2] * b);
            out[i] = (red << 16) | (green << 8) | blue;
        }
        return out;
    }

    static double toLinear(double srgb) {
        return srgb < 0.04045 ? srgb / 12.92 : Math.pow((srgb + 0.055) / 1.055, 2.4);
    }

    static double toSrgb(double linear) {
        double clipped = Math.min(1.0, Math.max(0.0, linear));
        return clipped < 0.0031308 ? clipped * 12.92 : Math.pow(clipped, 1.0 / 2.4) * 1.055 - 0.055;
    }

    // Truncates like a float-to-uint8 cast after clipping
    private static int toByte(double linear) {
        double srgb = Math.min(1.0, Math.max(0.0, toSrgb(linear)));
        return (int) (srgb * 255.0);
    }
}
