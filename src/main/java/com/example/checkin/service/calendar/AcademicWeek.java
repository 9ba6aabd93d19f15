package com.example.checkin.service.calendar;

import lombok.Value;

@Value
public class AcademicWeek {
    int weekNumber;
    boolean semesterBreak;
}
