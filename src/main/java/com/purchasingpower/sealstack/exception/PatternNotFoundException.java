package com.purchasingpower.sealstack.exception;

import com.purchasingpower.sealstack.core.Coordinate;
import lombok.Getter;

@Getter
public class PatternNotFoundException extends RuntimeException {

    private final Coordinate coordinate;

    public PatternNotFoundException(Coordinate coordinate) {
        super("No pattern stored at " + coordinate);
        this.coordinate = coordinate;
    }

}
