package com.example.potholereporter.service.detection;

import com.example.potholereporter.model.BoundingBox;
import com.example.potholereporter.model.Detection;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Greedy non-maximum suppression over scored boxes.
 */
final class BoxSuppression {

    private BoxSuppression() {
    }

    static List<Detection> apply(List<Detection> detections, double threshold) {
        if (detections.isEmpty()) {
            return List.of();
        }
        List<Detection> ordered = new ArrayList<>(detections);
        ordered.sort(Comparator.comparingDouble(Detection::confidence).reversed());
        List<Detection> kept = new ArrayList<>();
        boolean[] suppressed = new boolean[ordered.size()];
        for (int i = 0; i < ordered.size(); i++) {
            if (suppressed[i]) {
                continue;
            }
            Detection current = ordered.get(i);
            kept.add(current);
            for (int j = i + 1; j < ordered.size(); j++) {
                if (!suppressed[j] && intersectionOverUnion(current.box(), ordered.get(j).box()) > threshold) {
                    suppressed[j] = true;
                }
            }
        }
        return kept;
    }

    static double intersectionOverUnion(BoundingBox a, BoundingBox b) {
        double x1 = Math.max(a.x(), b.x());
        double y1 = Math.max(a.y(), b.y());
        double x2 = Math.min(a.x() + a.width(), b.x() + b.width());
        double y2 = Math.min(a.y() + a.height(), b.y() + b.height());
        double intersection = Math.max(0d, x2 - x1) * Math.max(0d, y2 - y1);
        double union = a.width() * a.height() + b.width() * b.height() - intersection;
        if (union <= 0d) {
            return 0d;
        }
        return intersection / union;
    }
}
