package com.example.checkin.controller;

import com.example.checkin.service.checkin.CheckInError;
import com.example.checkin.service.error.ErrorKind;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.HashMap;
import java.util.Map;

/**
 * JSON error bodies shared by the controllers and the exception handler.
 */
final class ApiErrors {

    private ApiErrors() {
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CONFLICT -> HttpStatus.CONFLICT;
            case EXPIRED -> HttpStatus.GONE;
            case VALIDATION_FAILED -> HttpStatus.BAD_REQUEST;
            case OUT_OF_RANGE -> HttpStatus.FORBIDDEN;
            case TRANSIENT -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    static ResponseEntity<Map<String, Object>> body(ErrorKind kind, String code, String message) {
        return ResponseEntity.status(statusFor(kind)).body(errorMap(kind, code, message));
    }

    static ResponseEntity<Map<String, Object>> checkInFailure(CheckInError error) {
        Map<String, Object> m = errorMap(error.getKind(), error.getCode().name().toLowerCase(), error.getMessage());
        if (error.getDistanceMeters() != null) {
            m.put("distance", error.getDistanceMeters());
            m.put("radius", error.getRadiusMeters());
        }
        return ResponseEntity.status(statusFor(error.getKind())).body(m);
    }

    private static Map<String, Object> errorMap(ErrorKind kind, String code, String message) {
        Map<String, Object> m = new HashMap<>();
        m.put("success", false);
        m.put("error", code);
        m.put("kind", kind.name());
        m.put("message", message);
        m.put("retryable", kind.isRetryable());
        return m;
    }
}
