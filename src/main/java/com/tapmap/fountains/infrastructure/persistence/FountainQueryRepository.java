package com.tapmap.fountains.infrastructure.persistence;

import com.tapmap.fountains.domain.model.BoundingBox;
import com.tapmap.fountains.domain.model.ClusterRow;
import com.tapmap.fountains.domain.model.Fountain;
import com.tapmap.fountains.domain.model.FountainFilter;

import java.util.List;

/**
 * Custom repository fragment for bounding-box queries that apply a {@link FountainFilter}.
 */
public interface FountainQueryRepository {

    List<ClusterRow> aggregateByGeohashPrefix(BoundingBox box, int precision, FountainFilter filter);

    List<Fountain> findInBounds(BoundingBox box, FountainFilter filter, int maxResults);

    List<Fountain> findAllInBounds(BoundingBox box, FountainFilter filter);
}
