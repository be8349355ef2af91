package com.purchasingpower.sealstack.exception;

import lombok.Getter;

/**
 * Coordinate text did not match the address grammar or carried an out-of-range field.
 */
@Getter
public class MalformedCoordinateException extends RuntimeException {

    private final String coordinateText;

    public MalformedCoordinateException(String coordinateText, String reason) {
        super("Malformed coordinate '" + coordinateText + "': " + reason);
        this.coordinateText = coordinateText;
    }

}
