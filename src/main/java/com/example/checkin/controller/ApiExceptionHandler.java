package com.example.checkin.controller;

import com.example.checkin.service.error.AttendanceException;
import com.example.checkin.service.error.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(AttendanceException.class)
    public ResponseEntity<Map<String, Object>> attendance(AttendanceException ex) {
        if (ex.getKind() == ErrorKind.TRANSIENT) {
            log.warn("Transient failure: {}", ex.getMessage(), ex.getCause());
        } else {
            log.debug("Request refused {}: {}", ex.getCode(), ex.getMessage());
        }
        return ApiErrors.body(ex.getKind(), ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> badRequest(Exception ex) {
        return ApiErrors.body(ErrorKind.VALIDATION_FAILED, "invalid_request", ex.getMessage());
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<Map<String, Object>> forbidden(AccessDeniedException ex) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(Map.of("success", false, "error", "forbidden", "message", ex.getMessage()));
    }
}
