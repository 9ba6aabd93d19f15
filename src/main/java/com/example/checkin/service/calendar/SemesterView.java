package com.example.checkin.service.calendar;

import com.example.checkin.entities.Semester;
import com.example.checkin.enums.SemesterStatus;
import lombok.Value;

import java.time.LocalDate;

/**
 * Semester row plus the week information derived for "today".
 */
@Value
public class SemesterView {
    Long id;
    String name;
    LocalDate startDate;
    LocalDate endDate;
    SemesterStatus status;
    int currentWeek;
    boolean semesterBreak;

    public static SemesterView of(Semester semester, AcademicWeek week) {
        return new SemesterView(semester.getId(), semester.getName(), semester.getStartDate(),
                semester.getEndDate(), semester.getStatus(), week.getWeekNumber(), week.isSemesterBreak());
    }
}
