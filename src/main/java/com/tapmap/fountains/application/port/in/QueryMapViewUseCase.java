package com.tapmap.fountains.application.port.in;

import com.tapmap.fountains.api.dto.AggregatedResponseDto;
import com.tapmap.fountains.api.dto.MapViewResponseDto;
import com.tapmap.fountains.api.dto.PointwiseResponseDto;
import com.tapmap.fountains.application.dto.ViewportQuery;
import com.tapmap.fountains.domain.model.BoundingBox;
import com.tapmap.fountains.domain.model.FountainFilter;

/**
 * Input port for map rendering queries.
 */
public interface QueryMapViewUseCase {

  /**
   * Classify the viewport and answer with clusters or points accordingly.
   *
   * @param query Viewport bounds, optional mode override, filters and limit
   * @return Aggregated or pointwise response
   */
  MapViewResponseDto queryMapView(ViewportQuery query);

  /**
   * Aggregate at a caller-chosen geohash precision, bypassing classification.
   */
  AggregatedResponseDto queryCounts(BoundingBox box, int precision, FountainFilter filter);

  /**
   * Unfiltered point listing (default status rule only), capped by the legacy limit
   * unless {@code maxResults} is given.
   */
  PointwiseResponseDto queryBounds(BoundingBox box, Integer maxResults);
}
