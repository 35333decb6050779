package com.tapmap.fountains.domain.model;

/**
 * Response shape for a viewport: per-cell counts or individual fountains.
 */
public enum ViewMode {
    AGGREGATE,
    POINTS
}
