package com.example.checkin.support;

import com.example.checkin.entities.AppUser;
import com.example.checkin.entities.CourseClass;
import com.example.checkin.entities.Enrollment;
import com.example.checkin.entities.Lecturer;
import com.example.checkin.entities.Semester;
import com.example.checkin.entities.Student;
import com.example.checkin.enums.ClassType;
import com.example.checkin.enums.SemesterStatus;
import com.example.checkin.enums.UserRole;
import com.example.checkin.repository.AppUserRepository;
import com.example.checkin.repository.CheckInRepository;
import com.example.checkin.repository.CheckInSessionRepository;
import com.example.checkin.repository.CourseClassRepository;
import com.example.checkin.repository.EnrollmentRepository;
import com.example.checkin.repository.LecturerRepository;
import com.example.checkin.repository.SemesterRepository;
import com.example.checkin.repository.StudentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.test.context.TestComponent;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Builds roster data for engine and controller tests. Each test starts from empty tables.
 */
@TestComponent
@RequiredArgsConstructor
public class AttendanceFixtures {

    public static final LocalDate SEMESTER_START = LocalDate.of(2025, 1, 6);

    private final SemesterRepository semesterRepository;
    private final LecturerRepository lecturerRepository;
    private final StudentRepository studentRepository;
    private final CourseClassRepository courseClassRepository;
    private final EnrollmentRepository enrollmentRepository;
    private final CheckInSessionRepository sessionRepository;
    private final CheckInRepository checkInRepository;
    private final AppUserRepository appUserRepository;

    public void clear() {
        checkInRepository.deleteAll();
        sessionRepository.deleteAll();
        enrollmentRepository.deleteAll();
        courseClassRepository.deleteAll();
        studentRepository.deleteAll();
        lecturerRepository.deleteAll();
        semesterRepository.deleteAll();
        appUserRepository.deleteAll();
    }

    public Semester activeSemester() {
        return semesterRepository.save(Semester.builder()
                .name("Semester 2 2024/2025")
                .startDate(SEMESTER_START)
                .endDate(SEMESTER_START.plusDays(104))
                .status(SemesterStatus.ACTIVE)
                .build());
    }

    public Lecturer lecturer(String name) {
        return lecturerRepository.save(Lecturer.builder()
                .name(name)
                .email(name.toLowerCase().replace(' ', '.') + "@uni.test")
                .build());
    }

    public CourseClass courseClass(String name, Lecturer lecturer, DayOfWeek day) {
        return courseClass(name, lecturer, day, 1, 14);
    }

    public CourseClass courseClass(String name, Lecturer lecturer, DayOfWeek day, int startWeek, int endWeek) {
        return courseClassRepository.save(CourseClass.builder()
                .className(name)
                .courseCode("CS" + Math.abs(name.hashCode() % 1000))
                .classType(ClassType.LECTURE)
                .dayOfWeek(day)
                .startTime(LocalTime.of(9, 0))
                .endTime(LocalTime.of(11, 0))
                .startWeek(startWeek)
                .endWeek(endWeek)
                .lecturerId(lecturer.getId())
                .build());
    }

    public Student enrolledStudent(String name, CourseClass courseClass) {
        Student student = studentRepository.save(Student.builder()
                .name(name)
                .email(name.toLowerCase().replace(' ', '.') + "@student.test")
                .build());
        enroll(student, courseClass);
        return student;
    }

    public void enroll(Student student, CourseClass courseClass) {
        enrollmentRepository.save(Enrollment.builder()
                .studentId(student.getId())
                .classId(courseClass.getId())
                .build());
    }

    public AppUser account(String username, UserRole role, Long subjectId) {
        return appUserRepository.save(AppUser.builder()
                .username(username)
                .password("{noop}secret")
                .role(role)
                .subjectId(subjectId)
                .build());
    }
}
