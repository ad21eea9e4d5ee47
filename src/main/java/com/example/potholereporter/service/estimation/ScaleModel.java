package com.example.potholereporter.service.estimation;

/**
 * Converts image pixels into real-world meters. Implementations can model
 * anything from a fixed reference width to a calibrated camera; the estimator
 * only needs the resulting linear scale.
 */
@FunctionalInterface
public interface ScaleModel {

    /**
     * @param imageWidthPixels width of the analysed image, must be positive
     * @param distanceFactor   caller-supplied correction for camera distance or tilt
     * @return meters represented by one pixel edge
     */
    double metersPerPixel(int imageWidthPixels, double distanceFactor);
}
