package com.example.checkin.service.session;

import com.example.checkin.config.CheckInProperties;
import com.example.checkin.entities.CheckInSession;
import com.example.checkin.entities.CourseClass;
import com.example.checkin.entities.Enrollment;
import com.example.checkin.entities.Semester;
import com.example.checkin.repository.CourseClassRepository;
import com.example.checkin.repository.EnrollmentRepository;
import com.example.checkin.service.calendar.AcademicWeek;
import com.example.checkin.service.calendar.SemesterCalendar;
import com.example.checkin.service.calendar.SemesterService;
import com.example.checkin.service.error.AttendanceException;
import com.example.checkin.service.error.ErrorKind;
import com.example.checkin.service.error.StoreFailures;
import com.example.checkin.service.notify.AttendanceEvent;
import com.example.checkin.service.notify.AttendanceNotifier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Owns the open / expire transitions of check-in sessions.
 *
 * Methods here are not transactional: every store call commits on its own, so a unique
 * key violation on insert can be caught and answered by re-reading the row that won.
 */
@Service
@RequiredArgsConstructor
public class SessionLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(SessionLifecycleManager.class);

    // attempts at the read / insert cycle before reporting the occurrence as contended
    private static final int MAX_OPEN_ATTEMPTS = 3;

    private final SessionStore sessionStore;
    private final CourseClassRepository courseClassRepository;
    private final EnrollmentRepository enrollmentRepository;
    private final SemesterService semesterService;
    private final AttendanceNotifier notifier;
    private final CheckInProperties properties;
    private final Clock clock;

    /**
     * Opens the check-in window for one occurrence of a class, or returns the window that is already
     * open for it.
     */
    public OpenedSession openSession(Long classId, LocalDate occurrenceDate, boolean onlineMode) {
        CourseClass courseClass = requireClass(classId);
        return open(courseClass, occurrenceDate, onlineMode, null);
    }

    /**
     * Opens the window for this week's occurrence of the class within the given semester. Refused
     * outside the class's week range; allowed, with a warning, during the break.
     */
    public OpenedSession openSessionForToday(Long classId, Semester semester, boolean onlineMode) {
        CourseClass courseClass = requireClass(classId);
        LocalDate today = semesterService.today();
        AcademicWeek week = SemesterCalendar.computeWeek(semester.getStartDate(), today);
        if (week.isSemesterBreak()) {
            log.warn("Opening session for class={} during semester break (semester={})", classId, semester.getId());
        } else if (!SemesterCalendar.runsInWeek(courseClass, week.getWeekNumber())) {
            throw new AttendanceException(ErrorKind.VALIDATION_FAILED, "class_not_running_this_week",
                    "Class " + classId + " runs in weeks " + courseClass.getStartWeek() + "-" + courseClass.getEndWeek()
                            + ", current week is " + week.getWeekNumber());
        }
        LocalDate occurrence = SemesterCalendar.occurrenceDate(courseClass, today);
        return open(courseClass, occurrence, onlineMode, week.getWeekNumber());
    }

    private OpenedSession open(CourseClass courseClass, LocalDate occurrenceDate, boolean onlineMode, Integer weekNumber) {
        String activeKey = CheckInSession.activeKeyFor(courseClass.getId(), occurrenceDate);

        for (int attempt = 1; attempt <= MAX_OPEN_ATTEMPTS; attempt++) {
            Optional<CheckInSession> current = currentHolder(activeKey);
            if (current.isPresent()) {
                log.info("Session already active for class={} occurrence={} id={}",
                        courseClass.getId(), occurrenceDate, current.get().getId());
                return new OpenedSession(current.get(), false);
            }

            Instant now = clock.instant();
            CheckInSession candidate = CheckInSession.builder()
                    .classId(courseClass.getId())
                    .occurrenceDate(occurrenceDate)
                    .weekNumber(weekNumber)
                    .startedAt(now)
                    .expiresAt(now.plus(properties.getWindow()))
                    .onlineMode(onlineMode)
                    .expired(false)
                    .activeKey(activeKey)
                    .build();

            try {
                CheckInSession saved = StoreFailures.guard("open session", () -> sessionStore.insertSession(candidate));
                log.info("Opened session id={} class={} occurrence={} expiresAt={} online={}",
                        saved.getId(), saved.getClassId(), occurrenceDate, saved.getExpiresAt(), onlineMode);
                notifier.publish(AttendanceEvent.sessionOpened(saved));
                return new OpenedSession(saved, true);
            } catch (DataIntegrityViolationException ex) {
                // another open for this occurrence committed first; loop re-reads the holder
                log.debug("Concurrent open for {} (attempt {}): {}", activeKey, attempt, ex.getMessage());
            }
        }

        throw new AttendanceException(ErrorKind.CONFLICT, "session_open_contended",
                "Could not open a session for class " + courseClass.getId() + " on " + occurrenceDate);
    }

    /**
     * Active session holding the occurrence key. An overdue holder is expired on the way, which frees the key.
     */
    private Optional<CheckInSession> currentHolder(String activeKey) {
        Optional<CheckInSession> holder = StoreFailures.guard("load active session",
                () -> sessionStore.findByActiveKey(activeKey));
        if (holder.isEmpty()) {
            return Optional.empty();
        }
        CheckInSession session = expireIfDue(holder.get());
        return SessionState.of(session, clock.instant()) == SessionState.ACTIVE ? Optional.of(session) : Optional.empty();
    }

    /**
     * Flags the session expired if its window has passed. Safe to call any number of times from any
     * path; only the call that performs the transition publishes session_expired.
     */
    public CheckInSession expireIfDue(CheckInSession session) {
        expire(session);
        return session;
    }

    private boolean expire(CheckInSession session) {
        if (!SessionState.isDueForExpiry(session, clock.instant())) {
            return false;
        }
        boolean transitioned = StoreFailures.guard("expire session", () -> sessionStore.markExpired(session.getId()));
        session.setExpired(true);
        session.setActiveKey(null);
        if (transitioned) {
            log.info("Session {} (class {}) expired", session.getId(), session.getClassId());
            notifier.publish(AttendanceEvent.sessionExpired(session));
        }
        return transitioned;
    }

    public SessionState stateOf(CheckInSession session) {
        return SessionState.of(session, clock.instant());
    }

    public CheckInSession requireSession(Long sessionId) {
        CheckInSession session = StoreFailures.guard("load session", () -> sessionStore.findSession(sessionId))
                .orElseThrow(() -> AttendanceException.notFound("session_not_found", "Session not found: " + sessionId));
        return expireIfDue(session);
    }

    /**
     * Sessions of the class that currently accept check-ins, newest first.
     */
    public List<CheckInSession> findActiveSessions(Long classId) {
        List<CheckInSession> candidates = StoreFailures.guard("load class sessions",
                () -> sessionStore.findUnflaggedByClass(classId));
        return keepActive(candidates);
    }

    /**
     * Sessions accepting check-ins across every class the student is enrolled in, soonest expiry first.
     */
    public List<CheckInSession> findActiveSessionsForStudent(Long studentId) {
        List<Long> classIds = StoreFailures.guard("load enrollments", () -> enrollmentRepository.findByStudentId(studentId))
                .stream()
                .map(Enrollment::getClassId)
                .collect(Collectors.toList());
        List<CheckInSession> candidates = StoreFailures.guard("load student sessions",
                () -> sessionStore.findUnflaggedByClasses(classIds));
        return keepActive(candidates);
    }

    /**
     * Sweep body: flags up to {@code batchSize} overdue sessions. Returns how many this call transitioned.
     */
    public int expireOverdueSessions(int batchSize) {
        List<CheckInSession> overdue = StoreFailures.guard("load overdue sessions",
                () -> sessionStore.findOverdue(clock.instant(), batchSize));
        int transitioned = 0;
        for (CheckInSession session : overdue) {
            if (expire(session)) transitioned++;
        }
        return transitioned;
    }

    private List<CheckInSession> keepActive(List<CheckInSession> candidates) {
        List<CheckInSession> active = new ArrayList<>();
        for (CheckInSession session : candidates) {
            expire(session);
            if (stateOf(session) == SessionState.ACTIVE) {
                active.add(session);
            }
        }
        return active;
    }

    private CourseClass requireClass(Long classId) {
        return StoreFailures.guard("load class", () -> courseClassRepository.findById(classId))
                .orElseThrow(() -> AttendanceException.notFound("class_not_found", "Class not found: " + classId));
    }
}
