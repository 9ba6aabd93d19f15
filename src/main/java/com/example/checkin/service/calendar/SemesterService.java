package com.example.checkin.service.calendar;

import com.example.checkin.entities.Semester;
import com.example.checkin.enums.SemesterStatus;
import com.example.checkin.repository.SemesterRepository;
import com.example.checkin.service.error.AttendanceException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Resolves semesters from the store. Callers pass the resolved semester on explicitly;
 * nothing here caches "the current semester".
 */
@Service
@RequiredArgsConstructor
public class SemesterService {

    private final SemesterRepository semesterRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Semester getActiveSemester() {
        return semesterRepository.findFirstByStatusOrderByStartDateDesc(SemesterStatus.ACTIVE)
                .orElseThrow(() -> AttendanceException.notFound("no_active_semester", "No active semester found"));
    }

    @Transactional(readOnly = true)
    public Semester getSemester(Long semesterId) {
        return semesterRepository.findById(semesterId)
                .orElseThrow(() -> AttendanceException.notFound("semester_not_found", "Semester not found: " + semesterId));
    }

    public AcademicWeek currentWeek(Semester semester) {
        return SemesterCalendar.computeWeek(semester.getStartDate(), today());
    }

    public SemesterView describe(Semester semester) {
        return SemesterView.of(semester, currentWeek(semester));
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /** First instant of the semester's start date. */
    public Instant rangeStart(Semester semester) {
        return semester.getStartDate().atStartOfDay(zone()).toInstant();
    }

    /** First instant after the semester's end date (exclusive bound). */
    public Instant rangeEnd(Semester semester) {
        return semester.getEndDate().plusDays(1).atStartOfDay(zone()).toInstant();
    }

    private ZoneId zone() {
        return clock.getZone();
    }
}
