package com.example.checkin.service.session;

import com.example.checkin.entities.CheckIn;
import com.example.checkin.entities.CheckInSession;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence operations the engine needs for sessions and check-ins. Each call is its own unit of
 * work. Inserts that break a uniqueness rule fail with a
 * {@link org.springframework.dao.DataIntegrityViolationException}.
 */
public interface SessionStore {

    Optional<CheckInSession> findSession(Long sessionId);

    Optional<CheckInSession> findByActiveKey(String activeKey);

    CheckInSession insertSession(CheckInSession session);

    /**
     * Conditionally flags the session expired. Returns true only when this call changed the row.
     */
    boolean markExpired(Long sessionId);

    List<CheckInSession> findOverdue(Instant now, int limit);

    List<CheckInSession> findUnflaggedByClass(Long classId);

    List<CheckInSession> findUnflaggedByClasses(Collection<Long> classIds);

    List<CheckInSession> findSessionsOn(Long classId, LocalDate occurrenceDate);

    List<CheckInSession> findSessionsInRange(Long classId, Instant from, Instant to);

    boolean hasCheckIn(Long sessionId, Long studentId);

    /**
     * Inserts the check-in only while its session accepts it: the session row is re-read under a row
     * lock and must be unflagged with {@code checkedInAt} not after expiresAt. Returns empty when the
     * session is closed or gone.
     */
    Optional<CheckIn> insertCheckInWhileOpen(CheckIn checkIn);

    List<CheckIn> findCheckIns(Long sessionId);

    List<CheckIn> findCheckIns(Collection<Long> sessionIds);

    List<CheckIn> findCheckInsForStudent(Long studentId, Collection<Long> sessionIds);
}
