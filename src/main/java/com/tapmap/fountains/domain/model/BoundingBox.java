package com.tapmap.fountains.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Value object representing a viewport bounding box in degrees.
 * Inverted or zero-width boxes are accepted and reported as degenerate.
 */
@Getter
@EqualsAndHashCode
@ToString
public class BoundingBox {
    private final double minLat;
    private final double maxLat;
    private final double minLng;
    private final double maxLng;

    public BoundingBox(double minLat, double maxLat, double minLng, double maxLng) {
        requireInRange("minLat", minLat, 90);
        requireInRange("maxLat", maxLat, 90);
        requireInRange("minLng", minLng, 180);
        requireInRange("maxLng", maxLng, 180);
        this.minLat = minLat;
        this.maxLat = maxLat;
        this.minLng = minLng;
        this.maxLng = maxLng;
    }

    /**
     * True when the box encloses no area (min == max or inverted on either axis).
     */
    public boolean isDegenerate() {
        return minLat >= maxLat || minLng >= maxLng;
    }

    /**
     * Inclusive on all four edges, like the store's BETWEEN clause.
     */
    public boolean contains(double lat, double lng) {
        return lat >= minLat && lat <= maxLat && lng >= minLng && lng <= maxLng;
    }

    private static void requireInRange(String name, double value, double bound) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(name + " must be a finite number");
        }
        if (value < -bound || value > bound) {
            throw new IllegalArgumentException(name + " must be between " + (int) -bound + " and " + (int) bound);
        }
    }
}
