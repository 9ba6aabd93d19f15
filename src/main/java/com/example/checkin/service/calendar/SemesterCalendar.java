package com.example.checkin.service.calendar;

import com.example.checkin.entities.CourseClass;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * Academic week numbering for a 14-week semester with a one-week break after week 7.
 *
 * <pre>
 *   days 0..48    weeks 1..7
 *   days 49..55   break (reported as week 8)
 *   days 56..104  weeks 8..14
 * </pre>
 *
 * Dates before the start clamp to week 1 and dates after day 104 clamp to week 14.
 */
public final class SemesterCalendar {

    public static final int FIRST_WEEK = 1;
    public static final int LAST_WEEK = 14;

    private static final int BREAK_START_DAY = 49;
    private static final int BREAK_END_DAY = 56;
    private static final int SEMESTER_END_DAY = 105;

    private SemesterCalendar() {
    }

    public static AcademicWeek computeWeek(LocalDate startDate, LocalDate today) {
        long days = ChronoUnit.DAYS.between(startDate, today);

        if (days < 0) {
            return new AcademicWeek(FIRST_WEEK, false);
        }
        if (days < BREAK_START_DAY) {
            return new AcademicWeek((int) (days / 7) + 1, false);
        }
        if (days < BREAK_END_DAY) {
            return new AcademicWeek(8, true);
        }
        if (days < SEMESTER_END_DAY) {
            // the break week does not count
            return new AcademicWeek((int) ((days - 7) / 7) + 1, false);
        }
        return new AcademicWeek(LAST_WEEK, false);
    }

    /**
     * First day of a teaching week, the inverse of {@link #computeWeek} for weeks 1..14. Weeks 8 and
     * later start one week later because of the break.
     */
    public static LocalDate weekStart(LocalDate startDate, int weekNumber) {
        if (weekNumber < FIRST_WEEK || weekNumber > LAST_WEEK) {
            throw new IllegalArgumentException("Week must be between " + FIRST_WEEK + " and " + LAST_WEEK + ": " + weekNumber);
        }
        int offsetWeeks = weekNumber <= 7 ? weekNumber - 1 : weekNumber;
        return startDate.plusWeeks(offsetWeeks);
    }

    /** Whether the class meets in the given teaching week. Missing bounds default to the full semester. */
    public static boolean runsInWeek(CourseClass courseClass, int weekNumber) {
        int first = courseClass.getStartWeek() == null ? FIRST_WEEK : courseClass.getStartWeek();
        int last = courseClass.getEndWeek() == null ? LAST_WEEK : courseClass.getEndWeek();
        return weekNumber >= first && weekNumber <= last;
    }

    /**
     * Date on which the given class meets during the Monday-based calendar week containing {@code today}.
     */
    public static LocalDate occurrenceDate(CourseClass courseClass, LocalDate today) {
        LocalDate monday = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        return monday.plusDays(courseClass.getDayOfWeek().getValue() - 1L);
    }
}
