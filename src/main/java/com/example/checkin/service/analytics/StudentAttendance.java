package com.example.checkin.service.analytics;

import lombok.Value;

@Value
public class StudentAttendance {
    Long studentId;
    String name;
    String email;
    AttendanceSummary summary;
}
