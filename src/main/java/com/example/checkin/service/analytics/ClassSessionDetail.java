package com.example.checkin.service.analytics;

import com.example.checkin.enums.AttendanceStatus;
import com.example.checkin.enums.CheckInStatus;
import com.example.checkin.service.session.SessionState;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * A class on one date: its session (if one was opened) and every enrolled student's status for it.
 * Without a session, roster statuses are null. The session entry's
 * own status is not used here; see {@link #sessionState}.
 */
@Value
public class ClassSessionDetail {
    Long classId;
    String className;
    String courseCode;
    String lecturerName;
    LocalDate date;
    SessionStatusEntry session;
    SessionState sessionState;
    int checkInCount;
    List<RosterEntry> roster;

    @Value
    public static class RosterEntry {
        Long studentId;
        String name;
        String email;
        AttendanceStatus status;
        Instant checkedInAt;
        CheckInStatus checkInStatus;
    }
}
