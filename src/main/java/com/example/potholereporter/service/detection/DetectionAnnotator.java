package com.example.potholereporter.service.detection;

import com.example.potholereporter.model.Detection;

import javax.imageio.ImageIO;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.Locale;

/**
 * Draws detection boxes and confidences on a copy of the uploaded image so
 * reviewers can see what the model found.
 */
public final class DetectionAnnotator {

    private static final Color BOX_COLOR = new Color(0, 255, 0);

    private DetectionAnnotator() {
    }

    public static BufferedImage annotate(BufferedImage source, List<Detection> detections) {
        BufferedImage copy = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
        Graphics2D graphics = copy.createGraphics();
        try {
            graphics.drawImage(source, 0, 0, null);
            graphics.setColor(BOX_COLOR);
            graphics.setStroke(new BasicStroke(2f));
            graphics.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 12));
            for (Detection detection : detections) {
                int x = (int) Math.round(detection.box().x());
                int y = (int) Math.round(detection.box().y());
                int width = (int) Math.round(detection.box().width());
                int height = (int) Math.round(detection.box().height());
                graphics.drawRect(x, y, width, height);
                graphics.drawString(String.format(Locale.ROOT, "%.2f", detection.confidence()), x, Math.max(12, y - 5));
            }
        } finally {
            graphics.dispose();
        }
        return copy;
    }

    /**
     * Encodes as PNG when the upload was a PNG and as JPEG otherwise. The
     * result carries the extension and content type of the bytes written.
     */
    public static EncodedImage encode(BufferedImage image, String contentType) {
        boolean png = contentType != null && contentType.toLowerCase(Locale.ROOT).contains("png");
        String format = png ? "png" : "jpg";
        try (ByteArrayOutputStream output = new ByteArrayOutputStream()) {
            if (!ImageIO.write(image, format, output)) {
                throw new IllegalStateException("No ImageIO writer available for " + format);
            }
            return new EncodedImage(output.toByteArray(), "." + format, png ? "image/png" : "image/jpeg");
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to encode annotated image", ex);
        }
    }
}
