package com.example.checkin.controller;

import com.example.checkin.service.checkin.CheckInError;
import com.example.checkin.service.error.ErrorKind;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ApiErrorsTest {

    @Test
    void everyKindHasAStatus() {
        assertEquals(HttpStatus.NOT_FOUND, ApiErrors.statusFor(ErrorKind.NOT_FOUND));
        assertEquals(HttpStatus.CONFLICT, ApiErrors.statusFor(ErrorKind.CONFLICT));
        assertEquals(HttpStatus.GONE, ApiErrors.statusFor(ErrorKind.EXPIRED));
        assertEquals(HttpStatus.BAD_REQUEST, ApiErrors.statusFor(ErrorKind.VALIDATION_FAILED));
        assertEquals(HttpStatus.FORBIDDEN, ApiErrors.statusFor(ErrorKind.OUT_OF_RANGE));
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, ApiErrors.statusFor(ErrorKind.TRANSIENT));
    }

    @Test
    void outOfRangeBodyCarriesDistanceAndRadius() {
        ResponseEntity<Map<String, Object>> response = ApiErrors.checkInFailure(CheckInError.outOfRange(600, 500));

        assertEquals(HttpStatus.FORBIDDEN, response.getStatusCode());
        Map<String, Object> body = response.getBody();
        assertNotNull(body);
        assertEquals(false, body.get("success"));
        assertEquals("out_of_range", body.get("error"));
        assertEquals(600L, body.get("distance"));
        assertEquals(500.0, body.get("radius"));
        assertEquals(false, body.get("retryable"));
    }

    @Test
    void onlyTransientFailuresAreRetryable() {
        assertEquals(true, ApiErrors.body(ErrorKind.TRANSIENT, "store_unavailable", "down").getBody().get("retryable"));
        assertEquals(false, ApiErrors.body(ErrorKind.CONFLICT, "already_checked_in", "dup").getBody().get("retryable"));
    }
}
