package com.example.checkin.config;

import com.example.checkin.entities.CourseClass;
import com.example.checkin.entities.Enrollment;
import com.example.checkin.entities.Lecturer;
import com.example.checkin.entities.Semester;
import com.example.checkin.entities.Student;
import com.example.checkin.enums.ClassType;
import com.example.checkin.enums.SemesterStatus;
import com.example.checkin.enums.UserRole;
import com.example.checkin.repository.CourseClassRepository;
import com.example.checkin.repository.EnrollmentRepository;
import com.example.checkin.repository.LecturerRepository;
import com.example.checkin.repository.SemesterRepository;
import com.example.checkin.repository.StudentRepository;
import com.example.checkin.service.access.AppUserService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.temporal.TemporalAdjusters;

/**
 * Development data: an active semester that started this week, one lecturer teaching a class that
 * meets today, three enrolled students and their login accounts. Only runs with checkin.seed-demo-data=true.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "checkin", name = "seed-demo-data", havingValue = "true")
public class DataInitializer {

    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    private final SemesterRepository semesterRepository;
    private final LecturerRepository lecturerRepository;
    private final StudentRepository studentRepository;
    private final CourseClassRepository courseClassRepository;
    private final EnrollmentRepository enrollmentRepository;
    private final AppUserService appUserService;
    private final Clock clock;

    @PostConstruct
    public void init() {
        if (semesterRepository.count() > 0) {
            log.info("Demo data already present, skipping");
            return;
        }
        LocalDate today = LocalDate.now(clock);
        LocalDate start = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));

        semesterRepository.save(Semester.builder()
                .name("Demo semester")
                .startDate(start)
                .endDate(start.plusWeeks(15).minusDays(1))
                .status(SemesterStatus.ACTIVE)
                .build());

        Lecturer lecturer = lecturerRepository.save(Lecturer.builder().name("Demo Lecturer").email("lecturer@example.edu").build());
        CourseClass course = courseClassRepository.save(CourseClass.builder()
                .className("Distributed Systems")
                .courseCode("CS3001")
                .classType(ClassType.LECTURE)
                .dayOfWeek(today.getDayOfWeek())
                .startTime(LocalTime.of(9, 0))
                .endTime(LocalTime.of(11, 0))
                .lecturerId(lecturer.getId())
                .build());
        appUserService.createUserDirect("lecturer", "lecturer", UserRole.LECTURER, lecturer.getId());

        for (int i = 1; i <= 3; i++) {
            Student student = studentRepository.save(Student.builder()
                    .name("Student " + i)
                    .email("student" + i + "@example.edu")
                    .build());
            enrollmentRepository.save(Enrollment.builder().studentId(student.getId()).classId(course.getId()).build());
            appUserService.createUserDirect("student" + i, "student", UserRole.STUDENT, student.getId());
        }
        appUserService.createUserDirect("admin", "admin", UserRole.ADMIN, null);

        log.info("Seeded demo semester starting {}, class id={} meeting on {}", start, course.getId(), course.getDayOfWeek());
    }
}
