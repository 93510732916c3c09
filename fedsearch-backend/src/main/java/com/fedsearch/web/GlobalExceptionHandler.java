package com.fedsearch.web;

import com.fedsearch.api.ErrorResponse;
import com.fedsearch.connection.QueryExecutionException;
import com.fedsearch.connection.UnknownConnectionException;
import com.fedsearch.schema.SchemaIntrospectionException;
import com.fedsearch.sql.QueryRejectedException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String TRACE_ID = "trace_id";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Input validation failed", details);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "Malformed request", ex.getMessage());
    }

    @ExceptionHandler(QueryRejectedException.class)
    public ResponseEntity<ErrorResponse> handleQueryRejected(QueryRejectedException ex) {
        log.info("Query rejected: connection={}, reason={}", ex.getConnectionId(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(error("QUERY_REJECTED", ex.getMessage(), null)
                .connectionId(ex.getConnectionId())
                .sql(ex.getSql())
                .build());
    }

    @ExceptionHandler(UnknownConnectionException.class)
    public ResponseEntity<ErrorResponse> handleUnknownConnection(UnknownConnectionException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error("UNKNOWN_CONNECTION", ex.getMessage(), null)
                .connectionId(ex.getConnectionId())
                .build());
    }

    @ExceptionHandler(SchemaIntrospectionException.class)
    public ResponseEntity<ErrorResponse> handleSchemaError(SchemaIntrospectionException ex) {
        log.error("Schema introspection failed: connection={}, table={}", ex.getConnectionId(), ex.getTable(), ex);
        String details = ex.getCause() != null ? ex.getCause().getMessage() : null;
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(error("SCHEMA_ERROR", ex.getMessage(), details)
                .connectionId(ex.getConnectionId())
                .build());
    }

    @ExceptionHandler(QueryExecutionException.class)
    public ResponseEntity<ErrorResponse> handleExecutionError(QueryExecutionException ex) {
        log.error("Query execution failed: connection={}", ex.getConnectionId(), ex);
        String details = ex.getCause() != null ? ex.getCause().getMessage() : null;
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(error("EXECUTION_ERROR", ex.getMessage(), details)
                .connectionId(ex.getConnectionId())
                .build());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), null);
    }

    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFoundException(Exception ex) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", "Not found", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(Exception ex) {
        log.error("Unhandled exception occurred", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR",
                "An unexpected error occurred", ex.getMessage());
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message, String details) {
        return ResponseEntity.status(status).body(error(code, message, details).build());
    }

    private static ErrorResponse.ErrorResponseBuilder error(String code, String message, String details) {
        return ErrorResponse.builder()
                .code(code)
                .message(message)
                .details(details)
                .traceId(MDC.get(TRACE_ID));
    }
}
