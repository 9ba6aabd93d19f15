package com.example.checkin.service.session;

import com.example.checkin.entities.CheckInSession;
import com.example.checkin.entities.CourseClass;
import com.example.checkin.entities.Lecturer;
import com.example.checkin.entities.Semester;
import com.example.checkin.repository.CheckInSessionRepository;
import com.example.checkin.service.error.AttendanceException;
import com.example.checkin.service.error.ErrorKind;
import com.example.checkin.service.notify.AttendanceEventType;
import com.example.checkin.support.EngineTestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.*;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SessionLifecycleManagerTest extends EngineTestBase {

    private static final LocalDate OCCURRENCE = LocalDate.of(2025, 2, 17);

    @Autowired
    private SessionLifecycleManager lifecycleManager;

    @Autowired
    private CheckInSessionRepository sessionRepository;

    private CourseClass courseClass;
    private Semester semester;

    @BeforeEach
    void setUp() {
        semester = fixtures.activeSemester();
        Lecturer lecturer = fixtures.lecturer("Grace Hopper");
        courseClass = fixtures.courseClass("Compilers", lecturer, DayOfWeek.MONDAY);
    }

    @Test
    void openCreatesSessionWithTwoMinuteWindow() {
        OpenedSession opened = lifecycleManager.openSession(courseClass.getId(), OCCURRENCE, false);

        assertTrue(opened.isCreated());
        CheckInSession session = opened.getSession();
        assertNotNull(session.getId());
        assertEquals(Duration.ofMinutes(2), Duration.between(session.getStartedAt(), session.getExpiresAt()));
        assertEquals(SessionState.ACTIVE, lifecycleManager.stateOf(session));
        assertEquals(1, notifier.ofType(AttendanceEventType.SESSION_OPENED).size());
    }

    @Test
    void openIsIdempotentWhileActive() {
        OpenedSession first = lifecycleManager.openSession(courseClass.getId(), OCCURRENCE, false);
        clock.advance(Duration.ofSeconds(30));
        OpenedSession second = lifecycleManager.openSession(courseClass.getId(), OCCURRENCE, true);

        assertFalse(second.isCreated());
        assertEquals(first.getSession().getId(), second.getSession().getId());
        assertEquals(1, sessionRepository.count());
        assertEquals(1, notifier.ofType(AttendanceEventType.SESSION_OPENED).size());
    }

    @Test
    void reopenAfterExpiryCreatesANewSession() {
        OpenedSession first = lifecycleManager.openSession(courseClass.getId(), OCCURRENCE, false);
        clock.advance(Duration.ofMinutes(3));
        OpenedSession second = lifecycleManager.openSession(courseClass.getId(), OCCURRENCE, false);

        assertTrue(second.isCreated());
        assertNotEquals(first.getSession().getId(), second.getSession().getId());
        assertTrue(sessionRepository.findById(first.getSession().getId()).orElseThrow().isExpired());
        assertEquals(1, notifier.ofType(AttendanceEventType.SESSION_EXPIRED).size());
    }

    @Test
    void openForTodayUsesThisWeeksOccurrence() {
        OpenedSession opened = lifecycleManager.openSessionForToday(courseClass.getId(), semester, false);

        assertEquals(OCCURRENCE, opened.getSession().getOccurrenceDate());
        assertEquals(7, opened.getSession().getWeekNumber());
    }

    @Test
    void openForTodayRefusedOutsideTheClassWeekRange() {
        // the clock sits in week 7
        CourseClass lateStarter = fixtures.courseClass("Distributed Systems", fixtures.lecturer("Leslie Lamport"),
                DayOfWeek.MONDAY, 9, 14);

        AttendanceException ex = assertThrows(AttendanceException.class,
                () -> lifecycleManager.openSessionForToday(lateStarter.getId(), semester, false));

        assertEquals(ErrorKind.VALIDATION_FAILED, ex.getKind());
        assertEquals("class_not_running_this_week", ex.getCode());
        assertEquals(0, sessionRepository.count());
        assertTrue(notifier.getAllEvents().isEmpty());
    }

    @Test
    void openForTodayAllowedDuringTheBreakWhateverTheWeekRange() {
        CourseClass lateStarter = fixtures.courseClass("Distributed Systems", fixtures.lecturer("Leslie Lamport"),
                DayOfWeek.MONDAY, 9, 14);
        clock.advance(Duration.ofDays(7));

        OpenedSession opened = lifecycleManager.openSessionForToday(lateStarter.getId(), semester, false);

        assertTrue(opened.isCreated());
        assertEquals(LocalDate.of(2025, 2, 24), opened.getSession().getOccurrenceDate());
    }

    @Test
    void openForUnknownClassIsNotFound() {
        AttendanceException ex = assertThrows(AttendanceException.class,
                () -> lifecycleManager.openSession(9_999L, OCCURRENCE, false));
        assertEquals(ErrorKind.NOT_FOUND, ex.getKind());
        assertEquals("class_not_found", ex.getCode());
    }

    @Test
    void concurrentOpensConvergeOnOneSession() throws Exception {
        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<OpenedSession>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return lifecycleManager.openSession(courseClass.getId(), OCCURRENCE, false);
                }));
            }
            start.countDown();

            List<OpenedSession> results = new ArrayList<>();
            for (Future<OpenedSession> f : futures) {
                results.add(f.get(30, TimeUnit.SECONDS));
            }

            assertEquals(callers, results.size());
            Set<Long> ids = results.stream().map(r -> r.getSession().getId()).collect(Collectors.toSet());
            assertEquals(1, ids.size());
            assertEquals(1, results.stream().filter(OpenedSession::isCreated).count());
            assertEquals(1, sessionRepository.count());
            assertEquals(1, notifier.ofType(AttendanceEventType.SESSION_OPENED).size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void requireSessionExpiresLazily() {
        CheckInSession session = lifecycleManager.openSession(courseClass.getId(), OCCURRENCE, false).getSession();
        clock.advance(Duration.ofSeconds(121));

        CheckInSession reloaded = lifecycleManager.requireSession(session.getId());

        assertTrue(reloaded.isExpired());
        assertEquals(SessionState.EXPIRED, lifecycleManager.stateOf(reloaded));
        assertNull(sessionRepository.findById(session.getId()).orElseThrow().getActiveKey());
        assertEquals(1, notifier.ofType(AttendanceEventType.SESSION_EXPIRED).size());
    }

    @Test
    void sweepAndLazyExpiryPublishOnce() {
        CheckInSession session = lifecycleManager.openSession(courseClass.getId(), OCCURRENCE, false).getSession();
        clock.advance(Duration.ofMinutes(5));

        assertEquals(1, lifecycleManager.expireOverdueSessions(100));
        assertEquals(0, lifecycleManager.expireOverdueSessions(100));
        lifecycleManager.requireSession(session.getId());

        assertEquals(1, notifier.ofType(AttendanceEventType.SESSION_EXPIRED).size());
    }

    @Test
    void sweepLeavesActiveSessionsAlone() {
        lifecycleManager.openSession(courseClass.getId(), OCCURRENCE, false);
        clock.advance(Duration.ofSeconds(60));

        assertEquals(0, lifecycleManager.expireOverdueSessions(100));
        assertEquals(1, lifecycleManager.findActiveSessions(courseClass.getId()).size());
    }

    @Test
    void activeSessionsForStudentCoverEnrolledClassesOnly() {
        CourseClass other = fixtures.courseClass("Databases", fixtures.lecturer("Edgar Codd"), DayOfWeek.MONDAY);
        var student = fixtures.enrolledStudent("Ada Lovelace", courseClass);
        lifecycleManager.openSession(courseClass.getId(), OCCURRENCE, false);
        lifecycleManager.openSession(other.getId(), OCCURRENCE, false);

        List<CheckInSession> active = lifecycleManager.findActiveSessionsForStudent(student.getId());

        assertEquals(1, active.size());
        assertEquals(courseClass.getId(), active.get(0).getClassId());

        clock.advance(Duration.ofMinutes(3));
        assertTrue(lifecycleManager.findActiveSessionsForStudent(student.getId()).isEmpty());
    }
}
