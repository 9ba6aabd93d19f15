package com.example.checkin.service.analytics;

import com.example.checkin.enums.AttendanceStatus;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

@Value
public class SessionStatusEntry {
    Long sessionId;
    LocalDate occurrenceDate;
    Instant startedAt;
    Instant expiresAt;
    boolean onlineMode;
    AttendanceStatus status;
}
