package com.purchasingpower.sealstack.api;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Error envelope used by {@link ApiExceptionHandler}.
 *
 * @since 1.0.0
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    private boolean success;
    private String error;

    /** Nearby stored coordinates, only set when a lookup missed. */
    private List<String> suggestions;

    public static ErrorResponse of(String error) {
        return new ErrorResponse(false, error, null);
    }

    public static ErrorResponse of(String error, List<String> suggestions) {
        return new ErrorResponse(false, error, suggestions);
    }
}
