package com.tapmap.fountains.application.dto;

import com.tapmap.fountains.domain.model.BoundingBox;
import com.tapmap.fountains.domain.model.FountainFilter;
import com.tapmap.fountains.domain.model.ViewMode;
import lombok.Getter;
import lombok.ToString;

/**
 * Transport-agnostic map-view request: bounds, optional mode override, filters
 * and an optional point limit.
 */
@Getter
@ToString
public class ViewportQuery {
    private final BoundingBox box;
    private final ViewMode modeOverride;
    private final FountainFilter filter;
    private final Integer limit;

    public ViewportQuery(BoundingBox box, ViewMode modeOverride, FountainFilter filter, Integer limit) {
        if (box == null) {
            throw new IllegalArgumentException("Bounding box must not be null");
        }
        this.box = box;
        this.modeOverride = modeOverride;
        this.filter = filter != null ? filter : FountainFilter.defaults();
        this.limit = limit;
    }
}
