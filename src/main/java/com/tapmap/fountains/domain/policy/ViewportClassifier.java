package com.tapmap.fountains.domain.policy;

import com.tapmap.fountains.domain.model.BoundingBox;
import com.tapmap.fountains.domain.model.ViewMode;
import com.tapmap.fountains.domain.model.ViewportClassification;
import org.springframework.stereotype.Service;

/**
 * Domain service deciding whether a viewport is answered with clusters or points.
 *
 * Rules:
 * - An empty or inverted box is always points, and cannot be aggregated
 * - An explicit mode is honored, except that views of 10 km² or less are always points
 * - Without an explicit mode, views larger than 1000 km² are aggregated
 * - Aggregation precision follows {@link GeoMath#precisionForArea(double)}
 *
 * Stateless; the same bounds always classify the same way.
 */
@Service
public class ViewportClassifier {

    /**
     * Classify a viewport.
     *
     * @param box          Viewport bounds
     * @param modeOverride Caller's explicit mode, or null to decide from the area
     * @return Mode and, when aggregating, the geohash precision
     * @throws IllegalArgumentException if aggregation is forced on a box with no area
     */
    public ViewportClassification classify(BoundingBox box, ViewMode modeOverride) {
        double area = GeoMath.area(box);

        // An inverted box can still yield a positive area when both axes are inverted
        if (box.isDegenerate()) {
            if (modeOverride == ViewMode.AGGREGATE) {
                throw new IllegalArgumentException("Cannot aggregate an empty or inverted bounding box");
            }
            return ViewportClassification.points(area);
        }

        boolean aggregate = modeOverride != null
                ? modeOverride == ViewMode.AGGREGATE
                : area > GeoMath.AUTO_AGGREGATE_MIN_AREA_KM2;

        if (area <= GeoMath.POINTS_ONLY_MAX_AREA_KM2) {
            aggregate = false;
        }

        if (aggregate) {
            return ViewportClassification.aggregate(GeoMath.precisionForArea(area), area);
        }
        return ViewportClassification.points(area);
    }
}
