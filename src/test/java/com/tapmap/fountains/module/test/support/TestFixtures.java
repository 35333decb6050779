package com.tapmap.fountains.module.test.support;

import com.tapmap.fountains.api.dto.BoundsDto;
import com.tapmap.fountains.api.dto.BoundsRequestDto;
import com.tapmap.fountains.api.dto.CountsRequestDto;
import com.tapmap.fountains.api.dto.MapViewRequestDto;
import com.tapmap.fountains.domain.model.BoundingBox;
import com.tapmap.fountains.domain.model.Fountain;
import com.tapmap.fountains.domain.model.FountainStatus;

import java.math.BigDecimal;

/**
 * Test fixtures for creating test data.
 * Factory methods for fountains, boxes and request bodies used across tests.
 */
public class TestFixtures {

    private TestFixtures() {
        // Utility class
    }

    /**
     * Create an unsaved active fountain.
     */
    public static Fountain fountain(String id, String lat, String lng) {
        return new Fountain(id, "Fountain " + id, new BigDecimal(lat), new BigDecimal(lng));
    }

    /**
     * Create an unsaved fountain with the filterable attributes set.
     */
    public static Fountain fountain(
            String id,
            String lat,
            String lng,
            FountainStatus status,
            String waterQuality,
            String accessibility) {
        Fountain fountain = fountain(id, lat, lng);
        fountain.setStatus(status);
        fountain.setWaterQuality(waterQuality);
        fountain.setAccessibility(accessibility);
        return fountain;
    }

    public static MapViewRequestDto mapViewRequest(BoundingBox box) {
        MapViewRequestDto request = new MapViewRequestDto();
        applyBounds(request, box);
        return request;
    }

    public static CountsRequestDto countsRequest(BoundingBox box, Integer precision) {
        CountsRequestDto request = new CountsRequestDto();
        applyBounds(request, box);
        request.setGeohashPrecision(precision);
        return request;
    }

    public static BoundsRequestDto boundsRequest(BoundingBox box, Integer maxResults) {
        BoundsRequestDto request = new BoundsRequestDto();
        applyBounds(request, box);
        request.setMaxResults(maxResults);
        return request;
    }

    private static void applyBounds(BoundsDto dto, BoundingBox box) {
        dto.setMinLat(BigDecimal.valueOf(box.getMinLat()));
        dto.setMaxLat(BigDecimal.valueOf(box.getMaxLat()));
        dto.setMinLng(BigDecimal.valueOf(box.getMinLng()));
        dto.setMaxLng(BigDecimal.valueOf(box.getMaxLng()));
    }

    /**
     * Common test viewports.
     */
    public static class Boxes {
        public static final BoundingBox WORLD = new BoundingBox(-90, 90, -180, 180);
        // Roughly 4,900 km², precision 5
        public static final BoundingBox SAN_FRANCISCO_BAY = new BoundingBox(37.5, 38.0, -122.75, -121.75);
        // About 0.6 km²
        public static final BoundingBox SOMA_BLOCKS = new BoundingBox(37.774, 37.780, -122.420, -122.410);
        // About 9 km², around the Civic Center
        public static final BoundingBox CIVIC_CENTER = new BoundingBox(37.76, 37.79, -122.43, -122.40);
    }

    /**
     * Common test coordinates with their precomputed geohashes.
     */
    public static class Coordinates {
        public static final String CIVIC_CENTER_LAT = "37.7749";
        public static final String CIVIC_CENTER_LNG = "-122.4194";
        public static final String CIVIC_CENTER_GEOHASH = "9q8yyk8ytp";
        public static final String SOMA_LAT = "37.78";
        public static final String SOMA_LNG = "-122.41";
        public static final String TWIN_PEAKS_LAT = "37.76";
        public static final String TWIN_PEAKS_LNG = "-122.45";
        // Falls in cell 9q8z, north of the other three
        public static final String PRESIDIO_NORTH_LAT = "37.85";
        public static final String PRESIDIO_NORTH_LNG = "-122.50";
        public static final String EIFFEL_TOWER_LAT = "48.8584";
        public static final String EIFFEL_TOWER_LNG = "2.2945";
        public static final String EIFFEL_TOWER_GEOHASH = "u09tunquc9";
    }
}
