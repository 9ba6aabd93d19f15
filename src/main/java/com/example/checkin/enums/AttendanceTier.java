package com.example.checkin.enums;

public enum AttendanceTier {
    GOOD,
    WARNING,
    CRITICAL;

    public static AttendanceTier forRate(int rate) {
        if (rate >= 90) return GOOD;
        if (rate >= 80) return WARNING;
        return CRITICAL;
    }
}
