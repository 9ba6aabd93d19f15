package com.example.checkin.service.calendar;

import com.example.checkin.entities.CourseClass;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class SemesterCalendarTest {

    private static final LocalDate START = LocalDate.of(2025, 1, 6);

    @Test
    void weeksBeforeTheBreakCountFromStart() {
        AcademicWeek week = SemesterCalendar.computeWeek(START, LocalDate.of(2025, 2, 10));
        assertEquals(6, week.getWeekNumber());
        assertFalse(week.isSemesterBreak());

        // day 42 opens week 7
        assertEquals(7, SemesterCalendar.computeWeek(START, LocalDate.of(2025, 2, 17)).getWeekNumber());
        assertEquals(7, SemesterCalendar.computeWeek(START, START.plusDays(48)).getWeekNumber());
    }

    @Test
    void breakWeekReportsWeekEightWithFlag() {
        AcademicWeek week = SemesterCalendar.computeWeek(START, LocalDate.of(2025, 2, 24));
        assertEquals(8, week.getWeekNumber());
        assertTrue(week.isSemesterBreak());

        AcademicWeek lastBreakDay = SemesterCalendar.computeWeek(START, START.plusDays(55));
        assertTrue(lastBreakDay.isSemesterBreak());
    }

    @Test
    void weeksAfterTheBreakSkipIt() {
        AcademicWeek week = SemesterCalendar.computeWeek(START, LocalDate.of(2025, 3, 10));
        assertEquals(9, week.getWeekNumber());
        assertFalse(week.isSemesterBreak());

        assertEquals(8, SemesterCalendar.computeWeek(START, START.plusDays(56)).getWeekNumber());
        assertEquals(14, SemesterCalendar.computeWeek(START, START.plusDays(104)).getWeekNumber());
    }

    @Test
    void clampsOutsideTheSemester() {
        assertEquals(1, SemesterCalendar.computeWeek(START, START.minusDays(30)).getWeekNumber());
        assertEquals(14, SemesterCalendar.computeWeek(START, START.plusDays(105)).getWeekNumber());
        assertEquals(14, SemesterCalendar.computeWeek(START, START.plusYears(1)).getWeekNumber());
    }

    @Test
    void weekNumberNeverDecreasesAndStaysInRange() {
        int previous = 0;
        for (int day = -10; day < 200; day++) {
            AcademicWeek week = SemesterCalendar.computeWeek(START, START.plusDays(day));
            assertTrue(week.getWeekNumber() >= 1 && week.getWeekNumber() <= 14, "day " + day);
            assertTrue(week.getWeekNumber() >= previous, "day " + day);
            assertEquals(day >= 49 && day <= 55, week.isSemesterBreak(), "day " + day);
            previous = week.getWeekNumber();
        }
    }

    @Test
    void occurrenceDateFallsInTheCurrentMondayWeek() {
        CourseClass wednesdayClass = CourseClass.builder().dayOfWeek(DayOfWeek.WEDNESDAY).build();

        // Monday, Wednesday and Sunday of the same week all map to that week's Wednesday
        LocalDate expected = LocalDate.of(2025, 2, 19);
        assertEquals(expected, SemesterCalendar.occurrenceDate(wednesdayClass, LocalDate.of(2025, 2, 17)));
        assertEquals(expected, SemesterCalendar.occurrenceDate(wednesdayClass, LocalDate.of(2025, 2, 19)));
        assertEquals(expected, SemesterCalendar.occurrenceDate(wednesdayClass, LocalDate.of(2025, 2, 23)));
    }

    @Test
    void weekStartInvertsComputeWeekAcrossTheBreak() {
        assertEquals(START, SemesterCalendar.weekStart(START, 1));
        assertEquals(LocalDate.of(2025, 2, 17), SemesterCalendar.weekStart(START, 7));
        // week 8 resumes after the break week
        assertEquals(LocalDate.of(2025, 3, 3), SemesterCalendar.weekStart(START, 8));

        for (int week = 1; week <= 14; week++) {
            AcademicWeek computed = SemesterCalendar.computeWeek(START, SemesterCalendar.weekStart(START, week));
            assertEquals(week, computed.getWeekNumber());
            assertFalse(computed.isSemesterBreak(), "week " + week);
        }
        assertThrows(IllegalArgumentException.class, () -> SemesterCalendar.weekStart(START, 0));
        assertThrows(IllegalArgumentException.class, () -> SemesterCalendar.weekStart(START, 15));
    }

    @Test
    void runsInWeekHonoursTheClassRange() {
        CourseClass secondHalf = CourseClass.builder().dayOfWeek(DayOfWeek.MONDAY).startWeek(8).endWeek(14).build();
        CourseClass unbounded = CourseClass.builder().dayOfWeek(DayOfWeek.MONDAY).startWeek(null).endWeek(null).build();

        assertFalse(SemesterCalendar.runsInWeek(secondHalf, 7));
        assertTrue(SemesterCalendar.runsInWeek(secondHalf, 8));
        assertTrue(SemesterCalendar.runsInWeek(secondHalf, 14));
        assertTrue(SemesterCalendar.runsInWeek(unbounded, 1));
        assertTrue(SemesterCalendar.runsInWeek(unbounded, 14));
    }
}
