package com.eveapi.client.common;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

/**
 * Maps client failures to {@link ApiErrorResponse} bodies.
 * <ul>
 *   <li>unknown method name → 404</li>
 *   <li>invalid argument or caller-supplied document → 400</li>
 *   <li>upstream transport, parse or structure failure → 502</li>
 * </ul>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(UnknownEveApiMethodException.class)
    public ResponseEntity<ApiErrorResponse> handleUnknownMethod(
            final UnknownEveApiMethodException exception,
            final HttpServletRequest request
    ) {
        return respond(HttpStatus.NOT_FOUND, exception.getMessage(), request);
    }

    @ExceptionHandler(EveApiException.class)
    public ResponseEntity<ApiErrorResponse> handleEveApiException(
            final EveApiException exception,
            final HttpServletRequest request
    ) {
        log.warn("EVE API call for {} failed: {}", request.getRequestURI(), exception.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, exception.getMessage(), request);
    }

    @ExceptionHandler(InvalidDocumentException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidDocument(
            final InvalidDocumentException exception,
            final HttpServletRequest request
    ) {
        return respond(HttpStatus.BAD_REQUEST, exception.getMessage(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorResponse> handleIllegalArgument(
            final IllegalArgumentException exception,
            final HttpServletRequest request
    ) {
        return respond(HttpStatus.BAD_REQUEST, exception.getMessage(), request);
    }

    private static ResponseEntity<ApiErrorResponse> respond(final HttpStatus status,
                                                            final String message,
                                                            final HttpServletRequest request) {
        ApiErrorResponse body = new ApiErrorResponse(
                Instant.now(),
                status.value(),
                status.getReasonPhrase(),
                message,
                request.getRequestURI()
        );
        return ResponseEntity.status(status).body(body);
    }
}
