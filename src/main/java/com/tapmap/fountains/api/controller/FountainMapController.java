package com.tapmap.fountains.api.controller;

import com.tapmap.fountains.api.dto.AggregatedResponseDto;
import com.tapmap.fountains.api.dto.BoundsDto;
import com.tapmap.fountains.api.dto.BoundsRequestDto;
import com.tapmap.fountains.api.dto.CountsRequestDto;
import com.tapmap.fountains.api.dto.FilteredBoundsDto;
import com.tapmap.fountains.api.dto.MapViewRequestDto;
import com.tapmap.fountains.api.dto.MapViewResponseDto;
import com.tapmap.fountains.api.dto.PointwiseResponseDto;
import com.tapmap.fountains.application.dto.ViewportQuery;
import com.tapmap.fountains.application.port.in.QueryMapViewUseCase;
import com.tapmap.fountains.domain.model.BoundingBox;
import com.tapmap.fountains.domain.model.FountainFilter;
import com.tapmap.fountains.domain.model.ViewMode;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;

/**
 * Controller for map rendering endpoints.
 * Low zoom views come back as geohash clusters, high zoom views as fountains.
 */
@RestController
@RequestMapping("/api/fountains")
@Validated
public class FountainMapController {

    private static final Logger logger = LoggerFactory.getLogger(FountainMapController.class);

    private static final int DEFAULT_COUNTS_PRECISION = 5;

    private final QueryMapViewUseCase queryMapViewUseCase;

    public FountainMapController(QueryMapViewUseCase queryMapViewUseCase) {
        this.queryMapViewUseCase = queryMapViewUseCase;
    }

    /**
     * POST /api/fountains/map-view
     *
     * Zoom-adaptive query: the viewport area decides between clusters and points
     * unless {@code mode} says otherwise.
     *
     * @param request Bounds, optional mode, filters and point limit
     * @return {@code type=aggregated} with cluster rows or {@code type=pointwise} with fountains
     */
    @PostMapping("/map-view")
    public ResponseEntity<MapViewResponseDto> getMapView(@Valid @RequestBody MapViewRequestDto request) {
        logger.info("Map view: lat=[{}, {}], lng=[{}, {}], mode={}",
                request.getMinLat(), request.getMaxLat(), request.getMinLng(), request.getMaxLng(), request.getMode());

        ViewportQuery query = new ViewportQuery(
                toBox(request),
                toMode(request.getMode()),
                toFilter(request),
                request.getLimit());
        return ResponseEntity.ok(queryMapViewUseCase.queryMapView(query));
    }

    /**
     * POST /api/fountains/counts
     *
     * Geohash-prefix counts at an explicit precision (default 5).
     */
    @PostMapping("/counts")
    public ResponseEntity<AggregatedResponseDto> getCounts(@Valid @RequestBody CountsRequestDto request) {
        int precision = request.getGeohashPrecision() != null
                ? request.getGeohashPrecision()
                : DEFAULT_COUNTS_PRECISION;
        logger.info("Counts: lat=[{}, {}], lng=[{}, {}], precision={}",
                request.getMinLat(), request.getMaxLat(), request.getMinLng(), request.getMaxLng(), precision);

        return ResponseEntity.ok(queryMapViewUseCase.queryCounts(toBox(request), precision, toFilter(request)));
    }

    /**
     * POST /api/fountains/bounds
     *
     * Active fountains in the box, ordered by latitude then longitude.
     */
    @PostMapping("/bounds")
    public ResponseEntity<PointwiseResponseDto> getBounds(@Valid @RequestBody BoundsRequestDto request) {
        logger.info("Bounds: lat=[{}, {}], lng=[{}, {}], maxResults={}",
                request.getMinLat(), request.getMaxLat(), request.getMinLng(), request.getMaxLng(),
                request.getMaxResults());

        return ResponseEntity.ok(queryMapViewUseCase.queryBounds(toBox(request), request.getMaxResults()));
    }

    private BoundingBox toBox(BoundsDto bounds) {
        return new BoundingBox(
                bounds.getMinLat().doubleValue(),
                bounds.getMaxLat().doubleValue(),
                bounds.getMinLng().doubleValue(),
                bounds.getMaxLng().doubleValue());
    }

    private FountainFilter toFilter(FilteredBoundsDto request) {
        return FountainFilter.of(
                request.getStatuses(),
                request.getWaterQualities(),
                request.getAccessibilities(),
                request.getTypes());
    }

    private ViewMode toMode(String mode) {
        if (mode == null || mode.isBlank()) {
            return null;
        }
        return ViewMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
    }
}
