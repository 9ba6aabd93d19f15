package com.example.checkin.service.analytics;

import lombok.Value;

import java.util.List;

@Value
public class ClassAttendanceReport {
    Long classId;
    String className;
    String courseCode;
    int totalSessions;
    AttendanceSummary totals;
    List<StudentAttendance> students;
    List<SessionAttendance> sessions;
    List<StudentAttendance> leastAttending;
}
