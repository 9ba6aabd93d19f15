package com.example.checkin.service.checkin;

import com.example.checkin.service.error.ErrorKind;

public enum CheckInErrorCode {
    SESSION_NOT_FOUND(ErrorKind.NOT_FOUND),
    STUDENT_NOT_ENROLLED(ErrorKind.NOT_FOUND),
    SESSION_EXPIRED(ErrorKind.EXPIRED),
    LOCATION_REQUIRED(ErrorKind.VALIDATION_FAILED),
    INVALID_COORDINATES(ErrorKind.VALIDATION_FAILED),
    OUT_OF_RANGE(ErrorKind.OUT_OF_RANGE),
    ALREADY_CHECKED_IN(ErrorKind.CONFLICT),
    STORE_UNAVAILABLE(ErrorKind.TRANSIENT);

    private final ErrorKind kind;

    CheckInErrorCode(ErrorKind kind) {
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
