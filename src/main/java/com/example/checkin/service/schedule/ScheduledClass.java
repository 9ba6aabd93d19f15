package com.example.checkin.service.schedule;

import com.example.checkin.enums.ClassType;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * One class meeting placed on a concrete date of the requested week.
 */
@Value
public class ScheduledClass {
    Long classId;
    String className;
    String courseCode;
    ClassType classType;
    LocalDate date;
    LocalTime startTime;
    LocalTime endTime;
    String lecturerName;
}
