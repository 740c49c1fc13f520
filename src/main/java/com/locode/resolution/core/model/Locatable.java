package com.locode.resolution.core.model;

import java.util.Optional;

/**
 * Capability of a code that may carry geographic coordinates.
 */
public interface Locatable {

    Optional<Coordinates> getCoordinates();

    default boolean hasCoordinates() {
        return getCoordinates().isPresent();
    }
}
