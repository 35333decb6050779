package com.tapmap.fountains.domain.policy;

import com.tapmap.fountains.domain.model.BoundingBox;

/**
 * Area and geohash-precision helpers for viewport classification.
 *
 * The area is a planar approximation (111 km per degree, longitude scaled by the
 * cosine of the mid latitude). It is cheap and good enough away from the poles.
 */
public final class GeoMath {

    public static final double KM_PER_DEGREE = 111.0;

    public static final double EARTH_RADIUS_KM = 6371.0;

    /**
     * Views at or below this area are never aggregated.
     */
    public static final double POINTS_ONLY_MAX_AREA_KM2 = 10.0;

    /**
     * Views above this area are aggregated unless the caller asks otherwise.
     */
    public static final double AUTO_AGGREGATE_MIN_AREA_KM2 = 1_000.0;

    public static final int MIN_PRECISION = 2;
    public static final int MAX_PRECISION = 8;

    // Descending area thresholds; index i maps to precision MIN_PRECISION + i.
    private static final double[] PRECISION_THRESHOLDS_KM2 = {
        1_000_000.0, 100_000.0, 10_000.0, 1_000.0, 100.0, 10.0
    };

    private GeoMath() {
    }

    /**
     * Approximate area in km². Inverted boxes produce a non-positive value.
     */
    public static double area(double minLat, double maxLat, double minLng, double maxLng) {
        double midLatRadians = Math.toRadians((minLat + maxLat) / 2);
        return (maxLat - minLat) * KM_PER_DEGREE
                * (maxLng - minLng) * KM_PER_DEGREE
                * Math.cos(midLatRadians);
    }

    public static double area(BoundingBox box) {
        return area(box.getMinLat(), box.getMaxLat(), box.getMinLng(), box.getMaxLng());
    }

    /**
     * Geohash length to group on for a view of the given area: 2 for continents,
     * one more character per tenfold shrink, 8 for anything at or below 10 km².
     */
    public static int precisionForArea(double areaKm2) {
        for (int i = 0; i < PRECISION_THRESHOLDS_KM2.length; i++) {
            if (areaKm2 > PRECISION_THRESHOLDS_KM2[i]) {
                return MIN_PRECISION + i;
            }
        }
        return MAX_PRECISION;
    }

    /**
     * Great-circle (haversine) distance in km between two points.
     */
    public static double distanceKm(double lat1, double lng1, double lat2, double lng2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLng = Math.toRadians(lng2 - lng1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        return EARTH_RADIUS_KM * 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
    }

    /**
     * Box enclosing every point within {@code radiusKm} of the center, for narrowing
     * a radius search before exact distances are computed. When the circle reaches
     * a pole or crosses the antimeridian the box spans all longitudes.
     */
    public static BoundingBox searchBox(double lat, double lng, double radiusKm) {
        double latDelta = radiusKm / KM_PER_DEGREE;
        double minLat = lat - latDelta;
        double maxLat = lat + latDelta;
        if (minLat <= -90 || maxLat >= 90) {
            return new BoundingBox(Math.max(minLat, -90), Math.min(maxLat, 90), -180, 180);
        }

        // The widest longitude span of the circle is at the latitude edge nearest a pole
        double edgeLat = Math.max(Math.abs(minLat), Math.abs(maxLat));
        double lngDelta = radiusKm / (KM_PER_DEGREE * Math.cos(Math.toRadians(edgeLat)));
        if (lng - lngDelta < -180 || lng + lngDelta > 180) {
            return new BoundingBox(minLat, maxLat, -180, 180);
        }
        return new BoundingBox(minLat, maxLat, lng - lngDelta, lng + lngDelta);
    }
}
