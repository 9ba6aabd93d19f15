package com.example.checkin.service.analytics;

import lombok.Value;

/**
 * One line of an overview screen. For the lecturer overview the summary covers every enrolled
 * student; for the student overview it covers that student only.
 */
@Value
public class ClassAttendanceOverview {
    Long classId;
    String className;
    String courseCode;
    String lecturerName;
    int totalSessions;
    AttendanceSummary summary;
}
