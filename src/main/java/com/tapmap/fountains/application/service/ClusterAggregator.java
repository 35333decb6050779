package com.tapmap.fountains.application.service;

import com.tapmap.fountains.application.port.out.FountainStore;
import com.tapmap.fountains.domain.model.BoundingBox;
import com.tapmap.fountains.domain.model.ClusterRow;
import com.tapmap.fountains.domain.model.Fountain;
import com.tapmap.fountains.domain.model.FountainFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Groups matching fountains by geohash prefix for low-zoom rendering.
 *
 * The number of rows is not capped: at the precision chosen for a view the prefix
 * space covering it is small, so the row count bounds itself.
 * Fountains without a stored geohash cannot be grouped and are left out.
 */
@Service
public class ClusterAggregator {

    private static final Logger logger = LoggerFactory.getLogger(ClusterAggregator.class);

    private final FountainStore fountainStore;

    public ClusterAggregator(FountainStore fountainStore) {
        this.fountainStore = fountainStore;
    }

    /**
     * @param box       Viewport bounds
     * @param precision Number of geohash characters to group on (1 to 10)
     * @param filter    Attribute filter, applied before grouping
     * @return One row per distinct prefix; empty for a degenerate box
     */
    @Transactional(readOnly = true)
    public List<ClusterRow> aggregate(BoundingBox box, int precision, FountainFilter filter) {
        if (precision < 1 || precision > Fountain.GEOHASH_PRECISION) {
            throw new IllegalArgumentException(
                    "Geohash precision must be between 1 and " + Fountain.GEOHASH_PRECISION);
        }
        if (box.isDegenerate()) {
            logger.debug("Degenerate bounding box {}, no clusters", box);
            return List.of();
        }

        List<ClusterRow> rows = fountainStore.aggregateByGeohashPrefix(box, precision, filter);
        logger.debug("Aggregated {} clusters at precision {} for {}", rows.size(), precision, box);
        return rows;
    }
}
