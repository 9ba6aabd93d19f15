package com.example.checkin.service.schedule;

import lombok.Value;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Timetable of one academic week, Monday to Friday always present. The break week has no classes
 * and no weekStart.
 */
@Value
public class WeekSchedule {
    int weekNumber;
    boolean semesterBreak;
    LocalDate weekStart;
    Map<DayOfWeek, List<ScheduledClass>> days;
}
