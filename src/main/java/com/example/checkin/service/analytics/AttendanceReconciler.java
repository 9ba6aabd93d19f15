package com.example.checkin.service.analytics;

import com.example.checkin.config.CheckInProperties;
import com.example.checkin.entities.CheckIn;
import com.example.checkin.entities.CheckInSession;
import com.example.checkin.entities.CourseClass;
import com.example.checkin.entities.Enrollment;
import com.example.checkin.entities.Lecturer;
import com.example.checkin.entities.Semester;
import com.example.checkin.entities.Student;
import com.example.checkin.enums.AttendanceStatus;
import com.example.checkin.repository.CourseClassRepository;
import com.example.checkin.repository.EnrollmentRepository;
import com.example.checkin.repository.LecturerRepository;
import com.example.checkin.repository.StudentRepository;
import com.example.checkin.service.calendar.SemesterService;
import com.example.checkin.service.error.AttendanceException;
import com.example.checkin.service.error.ErrorKind;
import com.example.checkin.service.error.StoreFailures;
import com.example.checkin.service.session.SessionState;
import com.example.checkin.service.session.SessionStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Derives present / missed / pending from session and check-in rows on every call. Nothing computed
 * here is stored.
 *
 * Every view counts the session rows actually created for the class inside the semester's date range,
 * so per-class and per-student screens always agree.
 */
@Service
@RequiredArgsConstructor
public class AttendanceReconciler {

    private static final int LEAST_ATTENDING_LIMIT = 5;

    private final SessionStore sessionStore;
    private final CourseClassRepository courseClassRepository;
    private final EnrollmentRepository enrollmentRepository;
    private final StudentRepository studentRepository;
    private final LecturerRepository lecturerRepository;
    private final SemesterService semesterService;
    private final CheckInProperties properties;
    private final Clock clock;

    public static AttendanceStatus statusFor(boolean checkedIn, CheckInSession session, Instant now) {
        return AttendanceStatus.derive(checkedIn, SessionState.isExpired(session, now));
    }

    public AttendanceStatus statusFor(Long studentId, CheckInSession session) {
        boolean checkedIn = StoreFailures.guard("load check-in", () -> sessionStore.hasCheckIn(session.getId(), studentId));
        return statusFor(checkedIn, session, clock.instant());
    }

    public AttendanceSummary summarize(Long studentId, Long classId, Semester semester) {
        List<CheckInSession> sessions = sessionsInRange(classId, semester);
        Set<Long> attended = attendedSessions(studentId, sessions);
        return summarizeStudent(attended, sessions, clock.instant());
    }

    public StudentClassDetail studentClassDetail(Long studentId, Long classId, Semester semester) {
        CourseClass courseClass = requireClass(classId);
        requireEnrollment(studentId, classId);

        Instant now = clock.instant();
        List<CheckInSession> sessions = sessionsInRange(classId, semester);
        Set<Long> attended = attendedSessions(studentId, sessions);

        List<SessionStatusEntry> timeline = sessions.stream()
                .map(s -> new SessionStatusEntry(s.getId(), s.getOccurrenceDate(), s.getStartedAt(), s.getExpiresAt(),
                        s.isOnlineMode(), statusFor(attended.contains(s.getId()), s, now)))
                .collect(Collectors.toList());
        AttendanceSummary summary = summarizeStudent(attended, sessions, now);

        return new StudentClassDetail(courseClass.getId(), courseClass.getClassName(), courseClass.getCourseCode(),
                lecturerName(courseClass), summary, timeline,
                StudentClassDetail.Insights.of(summary, properties.getSemesterWeeks()));
    }

    /**
     * Roster view of one class meeting. A null date picks the most recent session in the semester.
     * When several sessions share the date the latest one wins.
     */
    public ClassSessionDetail classDetail(Long classId, LocalDate date, Semester semester) {
        CourseClass courseClass = requireClass(classId);
        Instant now = clock.instant();

        CheckInSession session;
        if (date == null) {
            List<CheckInSession> sessions = sessionsInRange(classId, semester);
            session = sessions.isEmpty() ? null : sessions.get(sessions.size() - 1);
        } else {
            session = StoreFailures.guard("load sessions", () -> sessionStore.findSessionsOn(classId, date))
                    .stream().findFirst().orElse(null);
        }

        Map<Long, CheckIn> checkIns = session == null ? Map.of()
                : StoreFailures.guard("load check-ins", () -> sessionStore.findCheckIns(session.getId()))
                .stream()
                .collect(Collectors.toMap(CheckIn::getStudentId, c -> c, (a, b) -> a));

        List<ClassSessionDetail.RosterEntry> entries = new ArrayList<>();
        for (Student st : roster(classId)) {
            CheckIn checkIn = checkIns.get(st.getId());
            AttendanceStatus status = session == null ? null : statusFor(checkIn != null, session, now);
            entries.add(new ClassSessionDetail.RosterEntry(st.getId(), st.getName(), st.getEmail(), status,
                    checkIn == null ? null : checkIn.getCheckedInAt(),
                    checkIn == null ? null : checkIn.getStatus()));
        }

        SessionStatusEntry sessionEntry = session == null ? null
                : new SessionStatusEntry(session.getId(), session.getOccurrenceDate(), session.getStartedAt(),
                session.getExpiresAt(), session.isOnlineMode(), null);
        LocalDate shownDate = date != null ? date : session == null ? null : session.getOccurrenceDate();
        return new ClassSessionDetail(courseClass.getId(), courseClass.getClassName(), courseClass.getCourseCode(),
                lecturerName(courseClass), shownDate, sessionEntry,
                session == null ? null : SessionState.of(session, now), checkIns.size(), entries);
    }

    public List<ClassAttendanceOverview> studentOverview(Long studentId, Semester semester) {
        List<Long> classIds = enrolledClassIds(studentId);
        if (classIds.isEmpty()) return List.of();

        List<CourseClass> classes = StoreFailures.guard("load classes",
                () -> courseClassRepository.findByIdInOrderByClassNameAsc(classIds));
        Instant now = clock.instant();
        List<ClassAttendanceOverview> out = new ArrayList<>();
        for (CourseClass c : classes) {
            List<CheckInSession> sessions = sessionsInRange(c.getId(), semester);
            AttendanceSummary summary = summarizeStudent(attendedSessions(studentId, sessions), sessions, now);
            out.add(new ClassAttendanceOverview(c.getId(), c.getClassName(), c.getCourseCode(),
                    lecturerName(c), sessions.size(), summary));
        }
        return out;
    }

    public List<ClassAttendanceOverview> lecturerOverview(Long lecturerId, Semester semester) {
        List<CourseClass> classes = StoreFailures.guard("load classes",
                () -> courseClassRepository.findByLecturerIdOrderByClassNameAsc(lecturerId));
        List<ClassAttendanceOverview> out = new ArrayList<>();
        for (CourseClass c : classes) {
            ClassAttendanceReport report = buildReport(c, semester);
            out.add(new ClassAttendanceOverview(c.getId(), c.getClassName(), c.getCourseCode(),
                    lecturerName(c), report.getTotalSessions(), report.getTotals()));
        }
        return out;
    }

    public ClassAttendanceReport classReport(Long classId, Semester semester) {
        return buildReport(requireClass(classId), semester);
    }

    private ClassAttendanceReport buildReport(CourseClass courseClass, Semester semester) {
        Instant now = clock.instant();
        List<CheckInSession> sessions = sessionsInRange(courseClass.getId(), semester);
        List<Student> roster = roster(courseClass.getId());

        List<Long> sessionIds = sessions.stream().map(CheckInSession::getId).collect(Collectors.toList());
        Map<Long, Set<Long>> attendeesBySession = StoreFailures.guard("load check-ins",
                        () -> sessionStore.findCheckIns(sessionIds))
                .stream()
                .collect(Collectors.groupingBy(CheckIn::getSessionId,
                        Collectors.mapping(CheckIn::getStudentId, Collectors.toSet())));

        Map<Long, int[]> perStudent = new LinkedHashMap<>();
        roster.forEach(st -> perStudent.put(st.getId(), new int[3]));

        List<SessionAttendance> sessionRows = new ArrayList<>();
        for (CheckInSession session : sessions) {
            Set<Long> attendees = attendeesBySession.getOrDefault(session.getId(), Set.of());
            int[] counts = new int[3];
            for (Student st : roster) {
                AttendanceStatus status = statusFor(attendees.contains(st.getId()), session, now);
                counts[status.ordinal()]++;
                perStudent.get(st.getId())[status.ordinal()]++;
            }
            int present = counts[AttendanceStatus.PRESENT.ordinal()];
            int rate = roster.isEmpty() ? 0 : AttendanceSummary.rateOf(present, roster.size());
            sessionRows.add(new SessionAttendance(session.getId(), session.getOccurrenceDate(), session.getStartedAt(),
                    session.isOnlineMode(), SessionState.of(session, now), present,
                    counts[AttendanceStatus.MISSED.ordinal()], counts[AttendanceStatus.PENDING.ordinal()], rate));
        }

        List<StudentAttendance> students = new ArrayList<>();
        AttendanceSummary totals = AttendanceSummary.empty();
        for (Student st : roster) {
            int[] c = perStudent.get(st.getId());
            AttendanceSummary summary = AttendanceSummary.of(c[AttendanceStatus.PRESENT.ordinal()],
                    c[AttendanceStatus.MISSED.ordinal()], c[AttendanceStatus.PENDING.ordinal()]);
            students.add(new StudentAttendance(st.getId(), st.getName(), st.getEmail(), summary));
            totals = totals.plus(summary);
        }

        List<StudentAttendance> leastAttending = students.stream()
                .sorted(Comparator.comparingInt((StudentAttendance s) -> s.getSummary().getRate())
                        .thenComparing(StudentAttendance::getName, Comparator.nullsLast(Comparator.naturalOrder())))
                .limit(LEAST_ATTENDING_LIMIT)
                .collect(Collectors.toList());

        return new ClassAttendanceReport(courseClass.getId(), courseClass.getClassName(), courseClass.getCourseCode(),
                sessions.size(), totals, students, sessionRows, leastAttending);
    }

    /* ---------- helpers ---------- */

    private AttendanceSummary summarizeStudent(Set<Long> attended, List<CheckInSession> sessions, Instant now) {
        int present = 0, missed = 0, pending = 0;
        for (CheckInSession session : sessions) {
            switch (statusFor(attended.contains(session.getId()), session, now)) {
                case PRESENT -> present++;
                case MISSED -> missed++;
                case PENDING -> pending++;
            }
        }
        return AttendanceSummary.of(present, missed, pending);
    }

    private List<CheckInSession> sessionsInRange(Long classId, Semester semester) {
        Instant from = semesterService.rangeStart(semester);
        Instant to = semesterService.rangeEnd(semester);
        return StoreFailures.guard("load sessions", () -> sessionStore.findSessionsInRange(classId, from, to));
    }

    private Set<Long> attendedSessions(Long studentId, List<CheckInSession> sessions) {
        List<Long> ids = sessions.stream().map(CheckInSession::getId).collect(Collectors.toList());
        return StoreFailures.guard("load check-ins", () -> sessionStore.findCheckInsForStudent(studentId, ids))
                .stream()
                .map(CheckIn::getSessionId)
                .collect(Collectors.toSet());
    }

    private List<Student> roster(Long classId) {
        List<Long> studentIds = StoreFailures.guard("load roster", () -> enrollmentRepository.findByClassId(classId))
                .stream()
                .map(Enrollment::getStudentId)
                .collect(Collectors.toList());
        if (studentIds.isEmpty()) return List.of();
        return StoreFailures.guard("load students", () -> studentRepository.findByIdInOrderByNameAsc(studentIds));
    }

    private List<Long> enrolledClassIds(Long studentId) {
        return StoreFailures.guard("load enrollments", () -> enrollmentRepository.findByStudentId(studentId))
                .stream()
                .map(Enrollment::getClassId)
                .collect(Collectors.toList());
    }

    private CourseClass requireClass(Long classId) {
        return StoreFailures.guard("load class", () -> courseClassRepository.findById(classId))
                .orElseThrow(() -> AttendanceException.notFound("class_not_found", "Class not found: " + classId));
    }

    private void requireEnrollment(Long studentId, Long classId) {
        boolean enrolled = StoreFailures.guard("load enrollment",
                () -> enrollmentRepository.existsByStudentIdAndClassId(studentId, classId));
        if (!enrolled) {
            throw new AttendanceException(ErrorKind.NOT_FOUND, "not_enrolled",
                    "Student " + studentId + " is not enrolled in class " + classId);
        }
    }

    private String lecturerName(CourseClass courseClass) {
        return StoreFailures.guard("load lecturer", () -> lecturerRepository.findById(courseClass.getLecturerId()))
                .map(Lecturer::getName)
                .orElse(null);
    }
}
