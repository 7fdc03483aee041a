package com.smoothcomp.calendar.infrastructure.web;

import com.smoothcomp.calendar.domain.port.out.EventStoreException;
import com.smoothcomp.calendar.infrastructure.web.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(EventStoreException.class)
    public ResponseEntity<ErrorResponse> handleStoreUnavailable(EventStoreException e) {
        logger.error("Event store unavailable", e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("store_unavailable", "Event store is temporarily unavailable"));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        logger.warn("Invalid value for parameter '{}': {}", e.getName(), e.getValue());
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("invalid_parameter", "Invalid value for parameter '" + e.getName() + "'"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        logger.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("invalid_parameter", e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        // framework errors (unknown path, wrong method) keep their own status
        if (e instanceof org.springframework.web.ErrorResponse frameworkError) {
            logger.debug("Request rejected by framework: {}", e.getMessage());
            return ResponseEntity.status(frameworkError.getStatusCode())
                    .body(new ErrorResponse("request_rejected", frameworkError.getBody().getDetail()));
        }

        logger.error("Unexpected error handling request", e);
        return ResponseEntity.internalServerError()
                .body(new ErrorResponse("internal_error", "Unexpected error"));
    }
}
