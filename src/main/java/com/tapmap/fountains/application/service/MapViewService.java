package com.tapmap.fountains.application.service;

import com.tapmap.fountains.api.dto.AggregatedResponseDto;
import com.tapmap.fountains.api.dto.ClusterRowDto;
import com.tapmap.fountains.api.dto.FountainResponseDto;
import com.tapmap.fountains.api.dto.MapViewResponseDto;
import com.tapmap.fountains.api.dto.PointwiseResponseDto;
import com.tapmap.fountains.application.dto.ViewportQuery;
import com.tapmap.fountains.application.mapper.FountainMapper;
import com.tapmap.fountains.application.port.in.QueryMapViewUseCase;
import com.tapmap.fountains.domain.model.BoundingBox;
import com.tapmap.fountains.domain.model.ClusterRow;
import com.tapmap.fountains.domain.model.FountainFilter;
import com.tapmap.fountains.domain.model.PointPage;
import com.tapmap.fountains.domain.model.ViewportClassification;
import com.tapmap.fountains.domain.policy.ViewportClassifier;
import com.tapmap.fountains.infrastructure.cache.CacheConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Application service for map rendering.
 * Classifies each viewport, builds the filter once and hands it to either the
 * cluster aggregator or the point retriever. Cluster rows are cached per
 * (bounds, precision, filter); point pages are always read from the store.
 */
@Service
public class MapViewService implements QueryMapViewUseCase {

    private static final Logger logger = LoggerFactory.getLogger(MapViewService.class);

    static final String CLUSTER_CACHE = CacheConfig.CLUSTERS;

    private final ViewportClassifier viewportClassifier;
    private final ClusterAggregator clusterAggregator;
    private final PointRetriever pointRetriever;
    private final FountainMapper fountainMapper;
    private final CacheManager cacheManager;
    private final int defaultLimit;
    private final int legacyLimit;
    private final int maxLimit;

    public MapViewService(
            ViewportClassifier viewportClassifier,
            ClusterAggregator clusterAggregator,
            PointRetriever pointRetriever,
            FountainMapper fountainMapper,
            CacheManager cacheManager,
            @Value("${app.query.default-limit:1000}") int defaultLimit,
            @Value("${app.query.legacy-limit:5000}") int legacyLimit,
            @Value("${app.query.max-limit:5000}") int maxLimit) {
        this.viewportClassifier = viewportClassifier;
        this.clusterAggregator = clusterAggregator;
        this.pointRetriever = pointRetriever;
        this.fountainMapper = fountainMapper;
        this.cacheManager = cacheManager;
        this.defaultLimit = defaultLimit;
        this.legacyLimit = legacyLimit;
        this.maxLimit = maxLimit;
    }

    @Override
    public MapViewResponseDto queryMapView(ViewportQuery query) {
        ViewportClassification classification =
                viewportClassifier.classify(query.getBox(), query.getModeOverride());

        logger.debug("Classified {} as {} (area={} km2, override={})",
                query.getBox(), classification.getMode(), classification.getAreaKm2(), query.getModeOverride());

        if (classification.isAggregate()) {
            return queryCounts(query.getBox(), classification.getPrecision(), query.getFilter());
        }
        return toPointwise(pointRetriever.retrieve(
                query.getBox(), query.getFilter(), resolveLimit(query.getLimit(), defaultLimit)));
    }

    @Override
    public AggregatedResponseDto queryCounts(BoundingBox box, int precision, FountainFilter filter) {
        String cacheKey = buildCacheKey(box, precision, filter);

        Optional<List<ClusterRowDto>> cached = getClustersFromCache(cacheKey);
        if (cached.isPresent()) {
            logger.debug("Cluster cache hit for key: {}", cacheKey);
            return new AggregatedResponseDto(precision, cached.get());
        }
        logger.debug("Cluster cache miss for key: {}", cacheKey);

        List<ClusterRow> rows = clusterAggregator.aggregate(box, precision, filter);
        List<ClusterRowDto> rowDtos = rows.stream()
                .map(fountainMapper::toDto)
                .toList();

        putClustersInCache(cacheKey, rowDtos);
        return new AggregatedResponseDto(precision, rowDtos);
    }

    @Override
    public PointwiseResponseDto queryBounds(BoundingBox box, Integer maxResults) {
        return toPointwise(pointRetriever.retrieve(
                box, FountainFilter.defaults(), resolveLimit(maxResults, legacyLimit)));
    }

    /**
     * Requested limit if given, else the path's default; never above the configured ceiling.
     */
    int resolveLimit(Integer requested, int fallback) {
        int limit = requested != null ? requested : fallback;
        if (limit < 1) {
            throw new IllegalArgumentException("Limit must be at least 1");
        }
        if (limit > maxLimit) {
            logger.debug("Requested limit {} exceeds maximum, using {}", limit, maxLimit);
            return maxLimit;
        }
        return limit;
    }

    private PointwiseResponseDto toPointwise(PointPage page) {
        List<FountainResponseDto> rows = page.getPoints().stream()
                .map(fountainMapper::toDto)
                .toList();
        return new PointwiseResponseDto(rows, page.isTruncated());
    }

    private String buildCacheKey(BoundingBox box, int precision, FountainFilter filter) {
        return box.getMinLat() + ":" + box.getMaxLat() + ":" + box.getMinLng() + ":" + box.getMaxLng()
                + ":" + precision + ":" + filter.cacheKey();
    }

    /**
     * Gracefully handles cache unavailability (e.g., Redis connection failures).
     */
    private Optional<List<ClusterRowDto>> getClustersFromCache(String cacheKey) {
        try {
            Cache cache = cacheManager.getCache(CLUSTER_CACHE);
            if (cache != null) {
                Cache.ValueWrapper wrapper = cache.get(cacheKey);
                if (wrapper != null && wrapper.get() instanceof List<?> cachedList) {
                    @SuppressWarnings("unchecked")
                    List<ClusterRowDto> rows = (List<ClusterRowDto>) cachedList;
                    return Optional.of(rows);
                }
            }
        } catch (Exception e) {
            logger.warn("Failed to get clusters from cache, continuing without cache: {}", e.getMessage());
        }
        return Optional.empty();
    }

    private void putClustersInCache(String cacheKey, List<ClusterRowDto> rows) {
        try {
            Cache cache = cacheManager.getCache(CLUSTER_CACHE);
            if (cache != null) {
                // Concrete list type so the JSON serializer can read it back
                cache.put(cacheKey, new ArrayList<>(rows));
                logger.debug("Cluster cache populated for key: {}", cacheKey);
            }
        } catch (Exception e) {
            logger.warn("Failed to populate cluster cache, continuing without cache: {}", e.getMessage());
        }
    }
}
