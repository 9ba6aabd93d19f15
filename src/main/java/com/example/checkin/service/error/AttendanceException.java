package com.example.checkin.service.error;

import lombok.Getter;

/**
 * Typed failure of a lifecycle, semester or analytics operation.
 * code is a stable machine-readable identifier, e.g. "class_not_found".
 */
@Getter
public class AttendanceException extends RuntimeException {

    private final ErrorKind kind;
    private final String code;

    public AttendanceException(ErrorKind kind, String code, String message) {
        super(message);
        this.kind = kind;
        this.code = code;
    }

    public AttendanceException(ErrorKind kind, String code, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.code = code;
    }

    public static AttendanceException notFound(String code, String message) {
        return new AttendanceException(ErrorKind.NOT_FOUND, code, message);
    }

    public static AttendanceException storeUnavailable(String operation, Throwable cause) {
        return new AttendanceException(ErrorKind.TRANSIENT, "store_unavailable",
                "Attendance store unavailable during " + operation, cause);
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
