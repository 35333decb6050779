package com.tapmap.fountains.domain.model;

import java.util.Optional;

/**
 * Lifecycle status of a fountain. Stored lowercase, matching the values clients send.
 */
public enum FountainStatus {
    active,
    inactive,
    removed;

    /**
     * Resolves a client-supplied value; unknown values resolve to empty rather than failing.
     */
    public static Optional<FountainStatus> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (FountainStatus status : values()) {
            if (status.name().equals(value)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
