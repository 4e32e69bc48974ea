package com.layergen.web;

import com.layergen.api.ErrorResponse;
import com.layergen.config.GenerationConfigException;
import com.layergen.schema.SchemaConnectionException;
import com.layergen.service.GenerationInProgressException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(SchemaConnectionException.class)
    public ResponseEntity<ErrorResponse> handleSchemaConnection(SchemaConnectionException ex) {
        log.error("Schema source unavailable: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "DATABASE_UNAVAILABLE", "Failed to read the database schema", ex.getMessage());
    }

    @ExceptionHandler(GenerationConfigException.class)
    public ResponseEntity<ErrorResponse> handleConfig(GenerationConfigException ex) {
        log.error("Invalid generation config: {}", ex.getMessage());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "CONFIG_ERROR", "Generation config is invalid", ex.getMessage());
    }

    @ExceptionHandler(GenerationInProgressException.class)
    public ResponseEntity<ErrorResponse> handleInProgress(GenerationInProgressException ex) {
        return respond(HttpStatus.CONFLICT, "GENERATION_IN_PROGRESS", ex.getMessage(), null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST_BODY", "Request body must be a JSON array of table names",
                ex.getMostSpecificCause().getMessage());
    }

    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFoundException(Exception ex) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", "Not found", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(Exception ex) {
        log.error("Unhandled exception occurred", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR", "An unexpected error occurred", ex.getMessage());
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message, String details) {
        ErrorResponse error = ErrorResponse.builder()
                .code(code)
                .message(message)
                .details(details)
                .traceId(MDC.get(TraceIdFilter.MDC_TRACE_ID))
                .build();
        return ResponseEntity.status(status).body(error);
    }
}
