package com.example.checkin.service.schedule;

import com.example.checkin.entities.CourseClass;
import com.example.checkin.entities.Enrollment;
import com.example.checkin.entities.Lecturer;
import com.example.checkin.entities.Semester;
import com.example.checkin.repository.CourseClassRepository;
import com.example.checkin.repository.EnrollmentRepository;
import com.example.checkin.repository.LecturerRepository;
import com.example.checkin.service.calendar.AcademicWeek;
import com.example.checkin.service.calendar.SemesterCalendar;
import com.example.checkin.service.calendar.SemesterService;
import com.example.checkin.service.error.AttendanceException;
import com.example.checkin.service.error.ErrorKind;
import com.example.checkin.service.error.StoreFailures;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Weekly timetables for students and lecturers. Week numbers come from {@link SemesterCalendar}, the
 * same numbering the analytics use.
 *
 * The week selector is a number 1..14, "break", or empty for the current week.
 */
@Service
@RequiredArgsConstructor
public class WeekScheduleService {

    public static final String BREAK = "break";

    private static final List<DayOfWeek> WORKING_DAYS = List.of(
            DayOfWeek.MONDAY, DayOfWeek.TUESDAY, DayOfWeek.WEDNESDAY, DayOfWeek.THURSDAY, DayOfWeek.FRIDAY);

    private final CourseClassRepository courseClassRepository;
    private final EnrollmentRepository enrollmentRepository;
    private final LecturerRepository lecturerRepository;
    private final SemesterService semesterService;

    public WeekSchedule forStudent(Long studentId, Semester semester, String week) {
        List<Long> classIds = StoreFailures.guard("load enrollments", () -> enrollmentRepository.findByStudentId(studentId))
                .stream()
                .map(Enrollment::getClassId)
                .collect(Collectors.toList());
        List<CourseClass> classes = classIds.isEmpty() ? List.of()
                : StoreFailures.guard("load classes", () -> courseClassRepository.findByIdInOrderByClassNameAsc(classIds));
        return build(classes, semester, week);
    }

    public WeekSchedule forLecturer(Long lecturerId, Semester semester, String week) {
        List<CourseClass> classes = StoreFailures.guard("load classes",
                () -> courseClassRepository.findByLecturerIdOrderByClassNameAsc(lecturerId));
        return build(classes, semester, week);
    }

    private WeekSchedule build(List<CourseClass> classes, Semester semester, String week) {
        AcademicWeek selected = resolveWeek(semester, week);
        if (selected.isSemesterBreak()) {
            return new WeekSchedule(selected.getWeekNumber(), true, null, emptyDays());
        }

        LocalDate weekStart = SemesterCalendar.weekStart(semester.getStartDate(), selected.getWeekNumber());
        Map<Long, String> lecturerNames = lecturerNames(classes);
        Map<DayOfWeek, List<ScheduledClass>> days = emptyDays();
        classes.stream()
                .filter(c -> SemesterCalendar.runsInWeek(c, selected.getWeekNumber()))
                .sorted(Comparator.comparing(CourseClass::getDayOfWeek)
                        .thenComparing(CourseClass::getStartTime, Comparator.nullsLast(Comparator.naturalOrder())))
                .forEach(c -> days.computeIfAbsent(c.getDayOfWeek(), d -> new ArrayList<>())
                        .add(new ScheduledClass(c.getId(), c.getClassName(), c.getCourseCode(), c.getClassType(),
                                SemesterCalendar.occurrenceDate(c, weekStart), c.getStartTime(), c.getEndTime(),
                                lecturerNames.get(c.getLecturerId()))));
        return new WeekSchedule(selected.getWeekNumber(), false, weekStart, days);
    }

    private AcademicWeek resolveWeek(Semester semester, String week) {
        if (week == null || week.isBlank()) {
            return semesterService.currentWeek(semester);
        }
        if (BREAK.equalsIgnoreCase(week.trim())) {
            return new AcademicWeek(8, true);
        }
        int number;
        try {
            number = Integer.parseInt(week.trim());
        } catch (NumberFormatException ex) {
            throw new AttendanceException(ErrorKind.VALIDATION_FAILED, "invalid_week",
                    "Week must be a number or \"break\": " + week);
        }
        if (number < SemesterCalendar.FIRST_WEEK || number > SemesterCalendar.LAST_WEEK) {
            throw new AttendanceException(ErrorKind.VALIDATION_FAILED, "invalid_week",
                    "Week must be between 1 and 14: " + number);
        }
        return new AcademicWeek(number, false);
    }

    private Map<Long, String> lecturerNames(List<CourseClass> classes) {
        Set<Long> ids = classes.stream().map(CourseClass::getLecturerId).collect(Collectors.toSet());
        if (ids.isEmpty()) return Map.of();
        return StoreFailures.guard("load lecturers", () -> lecturerRepository.findAllById(ids))
                .stream()
                .collect(Collectors.toMap(Lecturer::getId, Lecturer::getName));
    }

    private static Map<DayOfWeek, List<ScheduledClass>> emptyDays() {
        Map<DayOfWeek, List<ScheduledClass>> days = new EnumMap<>(DayOfWeek.class);
        WORKING_DAYS.forEach(d -> days.put(d, new ArrayList<>()));
        return days;
    }
}
