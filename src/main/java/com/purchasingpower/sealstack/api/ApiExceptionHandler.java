package com.purchasingpower.sealstack.api;

import com.purchasingpower.sealstack.exception.EmptyModuleException;
import com.purchasingpower.sealstack.exception.MalformedCoordinateException;
import com.purchasingpower.sealstack.exception.PatternNotFoundException;
import com.purchasingpower.sealstack.search.SealStackService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps exceptions to HTTP statuses in the success/error envelope.
 *
 * <p>Spring MVC's own failures (unreadable body, bad parameter type, unknown path,
 * wrong method) keep the 4xx status {@link ResponseEntityExceptionHandler} gives them.
 * Domain failures map to 400, 404 or 422. Anything else is a 500.
 *
 * @since 1.0.0
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class ApiExceptionHandler extends ResponseEntityExceptionHandler {

    private static final int SUGGESTIONS = 3;

    private final SealStackService sealStackService;

    @ExceptionHandler(MalformedCoordinateException.class)
    public ResponseEntity<ErrorResponse> malformed(MalformedCoordinateException e) {
        log.warn("Rejected coordinate: {}", e.getCoordinateText());
        return ResponseEntity.badRequest().body(ErrorResponse.of(e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> badArgument(IllegalArgumentException e) {
        log.warn("Bad request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.of(e.getMessage()));
    }

    @ExceptionHandler(PatternNotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(PatternNotFoundException e) {
        List<String> suggestions = sealStackService.nearest(e.getCoordinate().toString(), SUGGESTIONS).stream()
            .map(n -> n.getPattern().getCoordinate().toString())
            .collect(Collectors.toList());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of(e.getMessage(), suggestions));
    }

    @ExceptionHandler(EmptyModuleException.class)
    public ResponseEntity<ErrorResponse> emptyModule(EmptyModuleException e) {
        log.info("Module request produced no layers: {}", e.getMessage());
        return ResponseEntity.unprocessableEntity().body(ErrorResponse.of(e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> unexpected(Exception e) {
        log.error("Request failed", e);
        return ResponseEntity.internalServerError().body(ErrorResponse.of("Request failed: " + e.getMessage()));
    }

    @Override
    protected ResponseEntity<Object> handleExceptionInternal(Exception ex, Object body, HttpHeaders headers,
                                                             HttpStatusCode statusCode, WebRequest request) {
        log.warn("Rejected request with {}: {}", statusCode.value(), ex.getMessage());
        return ResponseEntity.status(statusCode)
            .headers(headers)
            .body(ErrorResponse.of(describe(ex)));
    }

    private static String describe(Exception ex) {
        if (ex instanceof HttpMessageNotReadableException) {
            return "Request body is missing or not valid JSON";
        }
        if (ex instanceof MethodArgumentTypeMismatchException mismatch) {
            return "Invalid value '" + mismatch.getValue() + "' for parameter '" + mismatch.getName() + "'";
        }
        if (ex instanceof NoResourceFoundException missing) {
            return "No endpoint at /" + missing.getResourcePath();
        }
        return ex.getMessage();
    }
}
