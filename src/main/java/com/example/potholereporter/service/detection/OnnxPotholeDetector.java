package com.example.potholereporter.service.detection;

import com.example.potholereporter.model.BoundingBox;
import com.example.potholereporter.model.Detection;
import nu.pattern.OpenCV;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.dnn.Dnn;
import org.opencv.dnn.Net;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs a locally stored YOLOv8 ONNX pothole model through the OpenCV DNN
 * module. The model is loaded lazily on the first request.
 */
public class OnnxPotholeDetector implements PotholeDetector {

    private static final Logger log = LoggerFactory.getLogger(OnnxPotholeDetector.class);

    static {
        OpenCV.loadLocally();
        log.info("Loaded OpenCV native libraries");
    }

    private final String modelPath;
    private final int inputSize;
    private final double confThreshold;
    private final double nmsThreshold;
    private volatile Net network;
    private final Object networkLock = new Object();

    public OnnxPotholeDetector(String modelPath, int inputSize, double confThreshold, double nmsThreshold) {
        this.modelPath = modelPath;
        this.inputSize = inputSize;
        this.confThreshold = confThreshold;
        this.nmsThreshold = nmsThreshold;
    }

    @Override
    public List<Detection> detect(UploadedImage image) {
        Objects.requireNonNull(image, "UploadedImage must not be null");
        Net net = ensureNetwork();
        BufferedImage pixels = image.pixels();
        Mat source = bufferedImageToMat(pixels);
        Mat blob = Dnn.blobFromImage(source, 1.0 / 255.0, new Size(inputSize, inputSize), new Scalar(0, 0, 0), true, false);
        Mat rawResult = null;
        Mat rows = null;
        Mat transposed = new Mat();
        try {
            net.setInput(blob);
            rawResult = net.forward();
            // YOLOv8 output is [1, 4 + classes, anchors]; flip it so each row is one anchor
            int channels = rawResult.size(1);
            rows = rawResult.reshape(1, channels);
            Core.transpose(rows, transposed);
            return decode(transposed, pixels.getWidth(), pixels.getHeight());
        } catch (RuntimeException ex) {
            log.error("Local pothole model inference failed", ex);
            throw new DetectionGatewayException("Local model inference failed: " + ex.getMessage(), ex);
        } finally {
            transposed.release();
            if (rows != null) {
                rows.release();
            }
            if (rawResult != null) {
                rawResult.release();
            }
            blob.release();
            source.release();
        }
    }

    private List<Detection> decode(Mat predictions, int imageWidth, int imageHeight) {
        int channels = predictions.cols();
        float[] data = new float[(int) (predictions.total() * predictions.channels())];
        predictions.get(0, 0, data);

        double xFactor = imageWidth / (double) inputSize;
        double yFactor = imageHeight / (double) inputSize;

        List<Detection> detections = new ArrayList<>();
        for (int i = 0; i < predictions.rows(); i++) {
            int offset = i * channels;
            float maxClassScore = 0f;
            for (int c = 4; c < channels; c++) {
                maxClassScore = Math.max(maxClassScore, data[offset + c]);
            }
            if (maxClassScore < confThreshold) {
                continue;
            }

            double width = data[offset + 2] * xFactor;
            double height = data[offset + 3] * yFactor;
            double left = clamp(data[offset] * xFactor - width / 2d, 0, imageWidth - 1);
            double top = clamp(data[offset + 1] * yFactor - height / 2d, 0, imageHeight - 1);
            width = clamp(width, 1, imageWidth - left);
            height = clamp(height, 1, imageHeight - top);

            detections.add(new Detection(new BoundingBox(left, top, width, height), Math.min(1d, maxClassScore)));
        }
        List<Detection> kept = BoxSuppression.apply(detections, nmsThreshold);
        log.debug("Local model kept {} of {} candidate boxes", kept.size(), detections.size());
        return kept;
    }

    private Net ensureNetwork() {
        Net current = network;
        if (current != null) {
            return current;
        }
        synchronized (networkLock) {
            if (network == null) {
                if (modelPath == null || modelPath.isBlank()) {
                    throw new DetectionGatewayException("Model path must be configured");
                }
                Path path = Path.of(modelPath);
                if (!Files.exists(path)) {
                    throw new DetectionGatewayException("Pothole model file " + modelPath + " not found");
                }
                log.info("Loading pothole model from {}", path.toAbsolutePath());
                network = Dnn.readNetFromONNX(modelPath);
            }
            return network;
        }
    }

    private Mat bufferedImageToMat(BufferedImage image) {
        BufferedImage converted = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
        Graphics2D graphics = converted.createGraphics();
        try {
            graphics.drawImage(image, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        byte[] data = ((DataBufferByte) converted.getRaster().getDataBuffer()).getData();
        Mat mat = new Mat(image.getHeight(), image.getWidth(), CvType.CV_8UC3);
        mat.put(0, 0, data);
        return mat;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
