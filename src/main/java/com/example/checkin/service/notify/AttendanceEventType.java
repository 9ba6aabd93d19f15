package com.example.checkin.service.notify;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AttendanceEventType {
    SESSION_OPENED("session_opened"),
    CHECK_IN_RECORDED("check_in_recorded"),
    SESSION_EXPIRED("session_expired");

    private final String wireName;

    AttendanceEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
