package com.example.checkin.enums;

/**
 * Stored status of a check-in row. Both values count as present.
 * MANUAL marks a lecturer override recorded without a location.
 */
public enum CheckInStatus {
    PRESENT,
    MANUAL
}
