package com.tapmap.fountains.api.controller;

import com.tapmap.fountains.api.dto.FountainDetailsDto;
import com.tapmap.fountains.api.dto.FountainResponseDto;
import com.tapmap.fountains.api.dto.NearbyFountainDto;
import com.tapmap.fountains.application.port.in.LookupFountainUseCase;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Controller for single-fountain lookup, searches and proximity queries.
 */
@RestController
@RequestMapping("/api/fountains")
@Validated
public class FountainController {

    private static final Logger logger = LoggerFactory.getLogger(FountainController.class);

    private final LookupFountainUseCase lookupFountainUseCase;

    public FountainController(LookupFountainUseCase lookupFountainUseCase) {
        this.lookupFountainUseCase = lookupFountainUseCase;
    }

    /**
     * GET /api/fountains/search?name=X&limit=N
     */
    @GetMapping("/search")
    public ResponseEntity<List<FountainResponseDto>> search(
        @RequestParam @NotBlank(message = "name is required") String name,
        @RequestParam(required = false)
        @Min(value = 1, message = "limit must be between 1 and 500")
        @Max(value = 500, message = "limit must be between 1 and 500")
        Integer limit
    ) {
        logger.info("Searching fountains: name={}, limit={}", name, limit);
        return ResponseEntity.ok(lookupFountainUseCase.searchByName(name, limit));
    }

    /**
     * GET /api/fountains/search/tags?tag=X&limit=N
     */
    @GetMapping("/search/tags")
    public ResponseEntity<List<FountainDetailsDto>> searchByTag(
        @RequestParam @NotBlank(message = "tag is required") String tag,
        @RequestParam(required = false)
        @Min(value = 1, message = "limit must be between 1 and 500")
        @Max(value = 500, message = "limit must be between 1 and 500")
        Integer limit
    ) {
        logger.info("Searching fountains by tag: tag={}, limit={}", tag, limit);
        return ResponseEntity.ok(lookupFountainUseCase.searchByTag(tag, limit));
    }

    /**
     * GET /api/fountains/nearby?lat=X&lng=Y&radius_km=R&limit=N
     *
     * @return Active fountains within the radius, nearest first, each with its distance
     */
    @GetMapping("/nearby")
    public ResponseEntity<List<NearbyFountainDto>> nearby(
        @RequestParam
        @DecimalMin(value = "-90.0", message = "lat must be between -90 and 90")
        @DecimalMax(value = "90.0", message = "lat must be between -90 and 90")
        Double lat,
        @RequestParam
        @DecimalMin(value = "-180.0", message = "lng must be between -180 and 180")
        @DecimalMax(value = "180.0", message = "lng must be between -180 and 180")
        Double lng,
        @RequestParam(name = "radius_km", required = false) Double radiusKm,
        @RequestParam(required = false)
        @Min(value = 1, message = "limit must be between 1 and 500")
        @Max(value = 500, message = "limit must be between 1 and 500")
        Integer limit
    ) {
        logger.info("Finding fountains near: lat={}, lng={}, radiusKm={}, limit={}", lat, lng, radiusKm, limit);
        return ResponseEntity.ok(lookupFountainUseCase.findNearby(lat, lng, radiusKm, limit));
    }

    /**
     * GET /api/fountains/geohash/{prefix}?limit=N
     */
    @GetMapping("/geohash/{prefix}")
    public ResponseEntity<List<FountainResponseDto>> byGeohashPrefix(
        @PathVariable String prefix,
        @RequestParam(required = false)
        @Min(value = 1, message = "limit must be between 1 and 500")
        @Max(value = 500, message = "limit must be between 1 and 500")
        Integer limit
    ) {
        logger.info("Fetching fountains by geohash prefix: prefix={}, limit={}", prefix, limit);
        return ResponseEntity.ok(lookupFountainUseCase.findByGeohashPrefix(prefix, limit));
    }

    /**
     * GET /api/fountains/{id}
     *
     * @return Fountain details, or 404 if the identifier is unknown
     */
    @GetMapping("/{id}")
    public ResponseEntity<FountainDetailsDto> getFountain(@PathVariable String id) {
        logger.info("Fetching fountain: id={}", id);
        return ResponseEntity.ok(lookupFountainUseCase.findById(id));
    }
}
