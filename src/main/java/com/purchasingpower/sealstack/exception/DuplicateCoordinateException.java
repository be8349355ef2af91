package com.purchasingpower.sealstack.exception;

import com.purchasingpower.sealstack.core.Coordinate;
import lombok.Getter;

/**
 * Two patterns in the same table share a coordinate. Only raised while the store is built.
 */
@Getter
public class DuplicateCoordinateException extends RuntimeException {

    private final Coordinate coordinate;

    public DuplicateCoordinateException(Coordinate coordinate) {
        super("Duplicate coordinate in pattern table: " + coordinate);
        this.coordinate = coordinate;
    }

}
