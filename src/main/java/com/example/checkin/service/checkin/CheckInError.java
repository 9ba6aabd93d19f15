package com.example.checkin.service.checkin;

import com.example.checkin.service.error.ErrorKind;
import lombok.Value;

/**
 * Why a check-in attempt was refused. distanceMeters and radiusMeters are set for OUT_OF_RANGE only.
 */
@Value
public class CheckInError {
    CheckInErrorCode code;
    String message;
    Long distanceMeters;
    Double radiusMeters;

    public static CheckInError of(CheckInErrorCode code, String message) {
        return new CheckInError(code, message, null, null);
    }

    public static CheckInError outOfRange(long distanceMeters, double radiusMeters) {
        return new CheckInError(CheckInErrorCode.OUT_OF_RANGE,
                String.format("You are too far from campus. Distance: %dm (max: %.0fm)", distanceMeters, radiusMeters),
                distanceMeters, radiusMeters);
    }

    public ErrorKind getKind() {
        return code.kind();
    }

    public boolean isRetryable() {
        return code.kind().isRetryable();
    }
}
