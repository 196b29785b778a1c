package com.poc.svc.treasury.controller;

import com.poc.svc.treasury.dto.ErrorResponse;
import com.poc.svc.treasury.exception.InvalidPoolConfigurationException;
import com.poc.svc.treasury.exception.NettingTransactionNotFoundException;
import com.poc.svc.treasury.exception.PoolNotFoundException;
import com.poc.svc.treasury.util.TraceContext;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.StreamSupport;

@RestControllerAdvice
public class ErrorHandlingAdvice {

    private static final Logger log = LoggerFactory.getLogger(ErrorHandlingAdvice.class);

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatusException(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        String code = ex.getReason() != null && !ex.getReason().isBlank()
                ? ex.getReason().replace(' ', '_').toUpperCase(Locale.ROOT)
                : status.name();
        return ResponseEntity.status(status)
                .body(ErrorResponse.of(code, ex.getReason(), Map.of(), TraceContext.traceId()));
    }

    @ExceptionHandler({
            IllegalArgumentException.class,
            BindException.class,
            ConstraintViolationException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<ErrorResponse> handleValidationExceptions(Exception ex) {
        Map<String, Object> details = Map.of();
        if (ex instanceof ConstraintViolationException constraintViolationException) {
            details = Map.of("violations", mapViolations(constraintViolationException.getConstraintViolations()));
        } else if (ex instanceof BindException bindException) {
            // MethodArgumentNotValidException is a BindException
            details = Map.of("violations", bindException.getBindingResult()
                    .getFieldErrors()
                    .stream()
                    .map(error -> Map.of(
                            "field", error.getField(),
                            "message", String.valueOf(error.getDefaultMessage())))
                    .toList());
        } else if (ex instanceof MethodArgumentTypeMismatchException mismatch) {
            details = Map.of("parameter", mismatch.getName(), "value", String.valueOf(mismatch.getValue()));
        }
        String message = ex instanceof MethodArgumentNotValidException ? "Request body validation failed" : ex.getMessage();
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of("BAD_REQUEST", message, details, TraceContext.traceId()));
    }

    @ExceptionHandler({PoolNotFoundException.class, NettingTransactionNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException ex) {
        String code = ex instanceof PoolNotFoundException ? "POOL_NOT_FOUND" : "NETTING_TRANSACTION_NOT_FOUND";
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorResponse.of(code, ex.getMessage(), Map.of(), TraceContext.traceId()));
    }

    @ExceptionHandler(InvalidPoolConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleInvalidPool(InvalidPoolConfigurationException ex) {
        log.warn("TraceId={} invalid pool configuration pool={} reason={}", TraceContext.traceId(), ex.poolName(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(ErrorResponse.of("INVALID_POOL_CONFIGURATION", ex.getMessage(),
                        Map.of("pool_name", ex.poolName()), TraceContext.traceId()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleConflict(IllegalStateException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ErrorResponse.of("CONFLICT", ex.getMessage(), Map.of(), TraceContext.traceId()));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccessException(DataAccessException ex) {
        log.error("TraceId={} MongoDB operation failed", TraceContext.traceId(), ex);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(ErrorResponse.of(
                        "DATA_ACCESS_ERROR",
                        "資料存取發生錯誤",
                        Map.of("error", String.valueOf(ex.getMostSpecificCause().getMessage())),
                        TraceContext.traceId()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("TraceId={} unhandled exception", TraceContext.traceId(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(
                        "INTERNAL_SERVER_ERROR",
                        "系統發生未預期錯誤",
                        Map.of("error", String.valueOf(ex.getMessage())),
                        TraceContext.traceId()));
    }

    private List<Map<String, String>> mapViolations(Iterable<ConstraintViolation<?>> violations) {
        if (violations == null) {
            return List.of();
        }
        return StreamSupport.stream(violations.spliterator(), false)
                .map(violation -> Map.of(
                        "property", violation.getPropertyPath().toString(),
                        "message", violation.getMessage()))
                .toList();
    }
}
