package org.livo.warehouse.config;

import lombok.extern.slf4j.Slf4j;
import org.livo.warehouse.exception.ErrorCode;
import org.livo.warehouse.exception.FulfillmentException;
import org.livo.warehouse.exception.InvalidStateException;
import org.livo.warehouse.util.ResponseUtil;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(FulfillmentException.class)
    public ResponseEntity<Map<String, Object>> handleFulfillment(FulfillmentException ex) {
        log.warn("[Request rejected] code={}, message={}", ex.getCode(), ex.getMessage());
        Map<String, Object> body = ResponseUtil.error(ex.getCode().name(), ex.getMessage());
        if (ex instanceof InvalidStateException) {
            body.put("currentStatus", ((InvalidStateException) ex).getCurrentStatus());
        }
        return ResponseEntity.status(statusOf(ex.getCode())).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBody(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("[Request validation failed] {}", message);
        return ResponseEntity.badRequest().body(ResponseUtil.error(ErrorCode.VALIDATION_FAILED.name(), message));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleUnreadable(Exception ex) {
        log.warn("[Malformed request] {}", ex.getMessage());
        return ResponseEntity.badRequest()
                .body(ResponseUtil.error(ErrorCode.VALIDATION_FAILED.name(), "Malformed request"));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Map<String, Object>> handleMissingHeader(MissingRequestHeaderException ex) {
        log.warn("[Unauthenticated request] missingHeader={}", ex.getHeaderName());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(ResponseUtil.error(ErrorCode.UNAUTHENTICATED.name(), "User not authenticated"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
        log.error("[Unexpected error] error={}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ResponseUtil.error("ERROR", "Internal server error"));
    }

    static HttpStatus statusOf(ErrorCode code) {
        switch (code) {
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case INVALID_STATE:
            case CONFLICT:
                return HttpStatus.CONFLICT;
            case FORBIDDEN:
                return HttpStatus.FORBIDDEN;
            case VALIDATION_FAILED:
                return HttpStatus.BAD_REQUEST;
            case UNAUTHENTICATED:
                return HttpStatus.UNAUTHORIZED;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
