package com.tapmap.fountains.domain.model;

import lombok.Getter;
import lombok.ToString;

/**
 * A fountain found by a radius search, with its great-circle distance from the
 * search center.
 */
@Getter
@ToString
public class NearbyFountain {
    private final Fountain fountain;
    private final double distanceKm;

    public NearbyFountain(Fountain fountain, double distanceKm) {
        this.fountain = fountain;
        this.distanceKm = distanceKm;
    }
}
