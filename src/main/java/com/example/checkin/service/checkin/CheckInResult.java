package com.example.checkin.service.checkin;

import com.example.checkin.entities.CheckIn;

import java.util.Objects;

/**
 * Either the committed check-in or the reason it was refused.
 */
public final class CheckInResult {

    private final CheckIn checkIn;
    private final CheckInError error;

    private CheckInResult(CheckIn checkIn, CheckInError error) {
        this.checkIn = checkIn;
        this.error = error;
    }

    public static CheckInResult success(CheckIn checkIn) {
        return new CheckInResult(Objects.requireNonNull(checkIn), null);
    }

    public static CheckInResult failure(CheckInError error) {
        return new CheckInResult(null, Objects.requireNonNull(error));
    }

    public static CheckInResult failure(CheckInErrorCode code, String message) {
        return failure(CheckInError.of(code, message));
    }

    public boolean isSuccess() {
        return checkIn != null;
    }

    public CheckIn getCheckIn() {
        if (checkIn == null) throw new IllegalStateException("Check-in failed: " + error.getCode());
        return checkIn;
    }

    public CheckInError getError() {
        if (error == null) throw new IllegalStateException("Check-in succeeded");
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? "CheckInResult{success id=" + checkIn.getId() + "}" : "CheckInResult{" + error.getCode() + "}";
    }
}
