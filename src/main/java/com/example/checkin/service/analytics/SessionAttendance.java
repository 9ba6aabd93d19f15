package com.example.checkin.service.analytics;

import com.example.checkin.service.session.SessionState;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Roll call of one session across the enrolled students. rate is present over enrolled.
 */
@Value
public class SessionAttendance {
    Long sessionId;
    LocalDate occurrenceDate;
    Instant startedAt;
    boolean onlineMode;
    SessionState state;
    int present;
    int missed;
    int pending;
    int rate;
}
