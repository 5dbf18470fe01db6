package io.aim.metrics;

import io.aim.core.artifact.ResolvedArtifact;
import io.aim.core.evaluator.EvaluationException;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Base64;
import java.util.Iterator;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;

/// Decoding, pixel access and encoding shared by the image metrics.
///
/// Pixels are handled as packed `0xRRGGBB` ints; alpha is dropped without
/// compositing.
final class ImageSupport {

    /// Pixels processed between two interruption checks.
    private static final int CHECK_INTERVAL = 1 << 16;

    private ImageSupport() {}

    /// Decodes the artifact into an image.
    ///
    /// @param artifact PNG or JPEG bytes, not null
    /// @return the decoded image, never null
    /// @throws EvaluationException with `INVALID_INPUT` if the bytes are not a readable image
    static BufferedImage decode(ResolvedArtifact artifact) throws EvaluationException {
        BufferedImage image;
        try (InputStream in = artifact.openStream()) {
            image = ImageIO.read(in);
        } catch (IOException | RuntimeException e) {
            throw EvaluationException.invalidInput("Artifact could not be decoded as an image", e);
        }
        if (image == null) {
            throw EvaluationException.invalidInput(
                    "No image reader accepts artifact of type " + artifact.mimeType(), null);
        }
        if (image.getWidth() == 0 || image.getHeight() == 0) {
            throw EvaluationException.invalidInput("Artifact image has no pixels", null);
        }
        return image;
    }

    /// Returns the image's pixels in row-major order as `0xRRGGBB`.
    static int[] rgbPixels(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] pixels = image.getRGB(0, 0, width, height, null, 0, width);
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] &= 0xFFFFFF;
        }
        return pixels;
    }

    /// Builds an opaque RGB image from packed pixels.
    static BufferedImage toRgbImage(int[] pixels, int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, width, height, pixels, 0, width);
        return image;
    }

    static int red(int rgb) {
        return (rgb >> 16) & 0xFF;
    }

    static int green(int rgb) {
        return (rgb >> 8) & 0xFF;
    }

    static int blue(int rgb) {
        return rgb & 0xFF;
    }

    /// Aborts a long pixel loop once the evaluation has been abandoned.
    ///
    /// @param index current pixel index; the check runs every {@value #CHECK_INTERVAL} pixels
    /// @throws EvaluationException if the current thread was interrupted
    static void checkInterrupted(int index) throws EvaluationException {
        if ((index & (CHECK_INTERVAL - 1)) == 0 && Thread.currentThread().isInterrupted()) {
            throw EvaluationException.computationFailure("Evaluation interrupted");
        }
    }

    /// Encodes an image as PNG.
    ///
    /// @return base64 PNG bytes, never null
    static String encodePngBase64(BufferedImage image) throws EvaluationException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            if (!ImageIO.write(image, "png", out)) {
                throw EvaluationException.computationFailure("No PNG writer available");
            }
        } catch (IOException e) {
            throw new EvaluationException(
                    EvaluationException.Kind.COMPUTATION_FAILURE, "Failed to encode PNG", e);
        }
        return Base64.getEncoder().encodeToString(out.toByteArray());
    }

    /// Encodes an image as baseline JPEG.
    ///
    /// @param image opaque RGB image, not null
    /// @param quality compression quality in `[0, 1]`
    /// @return the JPEG bytes, never null
    static byte[] encodeJpeg(BufferedImage image, float quality) throws EvaluationException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw EvaluationException.computationFailure("No JPEG writer available");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ImageOutputStream stream = ImageIO.createImageOutputStream(out)) {
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(quality);
            writer.setOutput(stream);
            writer.write(null, new IIOImage(image, null, null), param);
        } catch (IOException e) {
            throw new EvaluationException(
                    EvaluationException.Kind.COMPUTATION_FAILURE, "Failed to encode JPEG", e);
        } finally {
            writer.dispose();
        }
        return out.toByteArray();
    }
}
