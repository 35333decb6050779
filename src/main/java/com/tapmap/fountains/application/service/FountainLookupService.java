package com.tapmap.fountains.application.service;

import com.tapmap.fountains.api.dto.FountainDetailsDto;
import com.tapmap.fountains.api.dto.FountainResponseDto;
import com.tapmap.fountains.api.dto.NearbyFountainDto;
import com.tapmap.fountains.application.mapper.FountainMapper;
import com.tapmap.fountains.application.port.in.LookupFountainUseCase;
import com.tapmap.fountains.application.port.out.FountainStore;
import com.tapmap.fountains.domain.model.BoundingBox;
import com.tapmap.fountains.domain.model.Fountain;
import com.tapmap.fountains.domain.model.FountainFilter;
import com.tapmap.fountains.domain.model.NearbyFountain;
import com.tapmap.fountains.domain.policy.GeoMath;
import com.tapmap.fountains.domain.policy.GeohashEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Application service for single-fountain lookup, name and tag search,
 * radius search and geohash prefix lookup.
 */
@Service
public class FountainLookupService implements LookupFountainUseCase {

    private static final Logger logger = LoggerFactory.getLogger(FountainLookupService.class);

    private final FountainStore fountainStore;
    private final FountainMapper fountainMapper;
    private final int searchLimit;
    private final int maxLimit;
    private final double defaultRadiusKm;
    private final double maxRadiusKm;

    public FountainLookupService(
            FountainStore fountainStore,
            FountainMapper fountainMapper,
            @Value("${app.query.search-limit:50}") int searchLimit,
            @Value("${app.query.max-limit:5000}") int maxLimit,
            @Value("${app.query.nearby-radius-km:5}") double defaultRadiusKm,
            @Value("${app.query.max-radius-km:50}") double maxRadiusKm) {
        this.fountainStore = fountainStore;
        this.fountainMapper = fountainMapper;
        this.searchLimit = searchLimit;
        this.maxLimit = maxLimit;
        this.defaultRadiusKm = defaultRadiusKm;
        this.maxRadiusKm = maxRadiusKm;
    }

    /**
     * @throws FountainNotFoundException if no fountain has the identifier
     */
    @Override
    @Transactional(readOnly = true)
    public FountainDetailsDto findById(String id) {
        return fountainStore.findById(id)
                .map(fountainMapper::toDetailsDto)
                .orElseThrow(() -> {
                    logger.debug("Fountain not found: {}", id);
                    return new FountainNotFoundException(id);
                });
    }

    @Override
    @Transactional(readOnly = true)
    public List<FountainResponseDto> searchByName(String name, Integer limit) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Search term must not be blank");
        }
        return fountainStore.searchActiveByName(name.trim(), effectiveLimit(limit)).stream()
                .map(fountainMapper::toDto)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<FountainDetailsDto> searchByTag(String tag, Integer limit) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("Tag must not be blank");
        }
        return fountainStore.searchActiveByTag(tag.trim(), effectiveLimit(limit)).stream()
                .map(fountainMapper::toDetailsDto)
                .toList();
    }

    /**
     * Candidates come from a box around the circle; exact haversine distances
     * then decide membership and order. Ties are broken by id.
     *
     * @throws IllegalArgumentException for coordinates out of range or a radius outside (0, max]
     */
    @Override
    @Transactional(readOnly = true)
    public List<NearbyFountainDto> findNearby(double lat, double lng, Double radiusKm, Integer limit) {
        if (!Double.isFinite(lat) || lat < -90 || lat > 90) {
            throw new IllegalArgumentException("lat must be between -90 and 90");
        }
        if (!Double.isFinite(lng) || lng < -180 || lng > 180) {
            throw new IllegalArgumentException("lng must be between -180 and 180");
        }
        double radius = radiusKm != null ? radiusKm : defaultRadiusKm;
        if (!(radius > 0) || radius > maxRadiusKm) {
            throw new IllegalArgumentException("radius_km must be greater than 0 and at most " + maxRadiusKm);
        }
        int effectiveLimit = effectiveLimit(limit);

        BoundingBox candidates = GeoMath.searchBox(lat, lng, radius);
        List<NearbyFountain> nearby = fountainStore.findAllInBounds(candidates, FountainFilter.defaults()).stream()
                .map(f -> new NearbyFountain(f, GeoMath.distanceKm(
                        lat, lng, f.getLatitude().doubleValue(), f.getLongitude().doubleValue())))
                .filter(n -> n.getDistanceKm() <= radius)
                .sorted(Comparator.comparingDouble(NearbyFountain::getDistanceKm)
                        .thenComparing(n -> n.getFountain().getId()))
                .limit(effectiveLimit)
                .toList();

        logger.debug("Found {} fountains within {} km of ({}, {})", nearby.size(), radius, lat, lng);
        return nearby.stream().map(fountainMapper::toDto).toList();
    }

    /**
     * @throws IllegalArgumentException unless the prefix is 1 to 10 geohash characters
     */
    @Override
    @Transactional(readOnly = true)
    public List<FountainResponseDto> findByGeohashPrefix(String prefix, Integer limit) {
        String normalized = prefix == null ? null : prefix.trim().toLowerCase(Locale.ROOT);
        if (!GeohashEncoder.isValidPrefix(normalized, Fountain.GEOHASH_PRECISION)) {
            throw new IllegalArgumentException(
                    "Geohash prefix must be 1 to " + Fountain.GEOHASH_PRECISION + " base-32 geohash characters");
        }
        return fountainStore.findActiveByGeohashPrefix(normalized, effectiveLimit(limit)).stream()
                .map(fountainMapper::toDto)
                .toList();
    }

    private int effectiveLimit(Integer limit) {
        int effective = Math.min(limit != null ? limit : searchLimit, maxLimit);
        if (effective < 1) {
            throw new IllegalArgumentException("Limit must be at least 1");
        }
        return effective;
    }

    /**
     * Exception thrown when a fountain lookup finds no match.
     * An expected outcome, not an error.
     */
    public static class FountainNotFoundException extends RuntimeException {
        private final String fountainId;

        public FountainNotFoundException(String fountainId) {
            super("Fountain not found: " + fountainId);
            this.fountainId = fountainId;
        }

        public String getFountainId() {
            return fountainId;
        }
    }
}
