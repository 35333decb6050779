package com.tapmap.fountains.domain.model;

import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Bounded, (latitude, longitude)-ordered slice of fountains in a viewport.
 * {@code truncated} is set when more fountains matched than the limit allowed.
 */
@Getter
@ToString
public class PointPage {
    private final List<Fountain> points;
    private final boolean truncated;

    public PointPage(List<Fountain> points, boolean truncated) {
        this.points = List.copyOf(points);
        this.truncated = truncated;
    }

    public static PointPage empty() {
        return new PointPage(List.of(), false);
    }
}
