package com.tapmap.fountains.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of classifying a viewport. Precision is only set in aggregate mode.
 */
@Getter
@EqualsAndHashCode
@ToString
public class ViewportClassification {
    private final ViewMode mode;
    private final Integer precision;
    private final double areaKm2;

    private ViewportClassification(ViewMode mode, Integer precision, double areaKm2) {
        this.mode = mode;
        this.precision = precision;
        this.areaKm2 = areaKm2;
    }

    public static ViewportClassification aggregate(int precision, double areaKm2) {
        return new ViewportClassification(ViewMode.AGGREGATE, precision, areaKm2);
    }

    public static ViewportClassification points(double areaKm2) {
        return new ViewportClassification(ViewMode.POINTS, null, areaKm2);
    }

    public boolean isAggregate() {
        return mode == ViewMode.AGGREGATE;
    }
}
