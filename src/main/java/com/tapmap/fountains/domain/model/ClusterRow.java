package com.tapmap.fountains.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One geohash-prefix cell of an aggregated viewport. The center is the arithmetic
 * mean of the member coordinates, not the center of the geohash cell.
 */
@Getter
@EqualsAndHashCode
@ToString
public class ClusterRow {
    private final String geohashPrefix;
    private final long count;
    private final double centerLat;
    private final double centerLng;

    public ClusterRow(String geohashPrefix, long count, double centerLat, double centerLng) {
        this.geohashPrefix = geohashPrefix;
        this.count = count;
        this.centerLat = centerLat;
        this.centerLng = centerLng;
    }
}
