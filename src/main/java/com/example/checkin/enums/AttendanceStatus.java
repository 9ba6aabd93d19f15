package com.example.checkin.enums;

/**
 * Derived per (student, session) attendance state. Never persisted.
 *
 * PRESENT - a check-in row exists.
 * MISSED  - no check-in and the session window is over.
 * PENDING - no check-in yet and the session still accepts check-ins.
 */
public enum AttendanceStatus {
    PRESENT,
    MISSED,
    PENDING;

    public static AttendanceStatus derive(boolean checkedIn, boolean sessionExpired) {
        if (checkedIn) return PRESENT;
        return sessionExpired ? MISSED : PENDING;
    }
}
