package com.example.potholereporter.service.estimation;

/**
 * Assumes the photo spans exactly one traffic lane horizontally and that the
 * camera looks straight down at a flat road. No perspective correction is
 * applied, so potholes far from the camera are under-estimated.
 */
public class LaneWidthScaleModel implements ScaleModel {

    private final double laneWidthMeters;

    public LaneWidthScaleModel(double laneWidthMeters) {
        if (!(laneWidthMeters > 0d)) {
            throw new IllegalArgumentException("Lane width must be positive");
        }
        this.laneWidthMeters = laneWidthMeters;
    }

    @Override
    public double metersPerPixel(int imageWidthPixels, double distanceFactor) {
        if (imageWidthPixels <= 0) {
            throw new IllegalArgumentException("Image width must be positive");
        }
        return (laneWidthMeters / imageWidthPixels) * distanceFactor;
    }
}
