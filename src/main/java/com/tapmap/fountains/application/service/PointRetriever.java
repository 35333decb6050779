package com.tapmap.fountains.application.service;

import com.tapmap.fountains.application.port.out.FountainStore;
import com.tapmap.fountains.domain.model.BoundingBox;
import com.tapmap.fountains.domain.model.Fountain;
import com.tapmap.fountains.domain.model.FountainFilter;
import com.tapmap.fountains.domain.model.PointPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Fetches individual fountains for high-zoom rendering, ordered by
 * (latitude, longitude) and capped at a limit.
 */
@Service
public class PointRetriever {

    private static final Logger logger = LoggerFactory.getLogger(PointRetriever.class);

    private final FountainStore fountainStore;

    public PointRetriever(FountainStore fountainStore) {
        this.fountainStore = fountainStore;
    }

    /**
     * One extra row is requested so a page cut at the limit can be told apart
     * from one that happens to hold exactly {@code limit} fountains.
     *
     * @param box    Viewport bounds
     * @param filter Attribute filter
     * @param limit  Maximum number of fountains to return
     * @return At most {@code limit} fountains; empty for a degenerate box
     */
    @Transactional(readOnly = true)
    public PointPage retrieve(BoundingBox box, FountainFilter filter, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Limit must be at least 1");
        }
        if (box.isDegenerate()) {
            logger.debug("Degenerate bounding box {}, no points", box);
            return PointPage.empty();
        }

        // Integer.MAX_VALUE already means "everything", so there is no extra row to ask for
        int fetchSize = limit == Integer.MAX_VALUE ? limit : limit + 1;
        List<Fountain> fetched = fountainStore.findInBounds(box, filter, fetchSize);
        boolean truncated = fetched.size() > limit;
        List<Fountain> points = truncated ? fetched.subList(0, limit) : fetched;

        logger.debug("Retrieved {} points (truncated={}) for {}", points.size(), truncated, box);
        return new PointPage(points, truncated);
    }
}
