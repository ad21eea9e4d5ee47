package com.example.potholereporter.service.estimation;

import com.example.potholereporter.model.AggregateResult;
import com.example.potholereporter.model.BoundingBox;
import com.example.potholereporter.model.Detection;
import com.example.potholereporter.model.MeasuredDetection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns raw pixel detections into physical area measurements for one image.
 */
public class GeometricEstimator {

    private static final Logger log = LoggerFactory.getLogger(GeometricEstimator.class);

    public static final double DEFAULT_DISTANCE_FACTOR = 1.0;

    private final ScaleModel scaleModel;

    public GeometricEstimator(ScaleModel scaleModel) {
        this.scaleModel = Objects.requireNonNull(scaleModel, "scaleModel");
    }

    public AggregateResult aggregate(List<Detection> detections, int imageWidthPixels, double distanceFactor) {
        if (detections == null || detections.isEmpty()) {
            return AggregateResult.empty();
        }

        double metersPerPixel = scaleModel.metersPerPixel(imageWidthPixels, distanceFactor);
        List<MeasuredDetection> measured = new ArrayList<>(detections.size());
        double totalArea = 0d;
        double confidenceSum = 0d;
        for (Detection detection : detections) {
            double area = areaOf(detection.box(), metersPerPixel);
            measured.add(new MeasuredDetection(detection.box(), detection.confidence(), area));
            totalArea += area;
            confidenceSum += detection.confidence();
        }

        double meanConfidence = confidenceSum / detections.size();
        log.debug("Aggregated {} detections into {} m2 at {} m/px", detections.size(), totalArea, metersPerPixel);
        return new AggregateResult(detections.size(), totalArea, meanConfidence, measured);
    }

    static double areaOf(BoundingBox box, double metersPerPixel) {
        return (box.width() * metersPerPixel) * (box.height() * metersPerPixel);
    }
}
