package com.example.checkin.service.session;

import com.example.checkin.entities.CheckIn;
import com.example.checkin.entities.CheckInSession;
import com.example.checkin.repository.CheckInRepository;
import com.example.checkin.repository.CheckInSessionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class JpaSessionStore implements SessionStore {

    private final CheckInSessionRepository sessionRepository;
    private final CheckInRepository checkInRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<CheckInSession> findSession(Long sessionId) {
        return sessionRepository.findById(sessionId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CheckInSession> findByActiveKey(String activeKey) {
        return sessionRepository.findByActiveKey(activeKey);
    }

    /**
     * saveAndFlush so a unique key violation surfaces here, inside this transaction boundary,
     * rather than at some later commit.
     */
    @Override
    @Transactional
    public CheckInSession insertSession(CheckInSession session) {
        return sessionRepository.saveAndFlush(session);
    }

    @Override
    @Transactional
    public boolean markExpired(Long sessionId) {
        return sessionRepository.markExpired(sessionId) == 1;
    }

    @Override
    @Transactional(readOnly = true)
    public List<CheckInSession> findOverdue(Instant now, int limit) {
        return sessionRepository.findOverdue(now, PageRequest.of(0, limit));
    }

    @Override
    @Transactional(readOnly = true)
    public List<CheckInSession> findUnflaggedByClass(Long classId) {
        return sessionRepository.findByClassIdAndExpiredFalseOrderByStartedAtDesc(classId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<CheckInSession> findUnflaggedByClasses(Collection<Long> classIds) {
        if (classIds.isEmpty()) return List.of();
        return sessionRepository.findByClassIdInAndExpiredFalseOrderByExpiresAtAsc(classIds);
    }

    @Override
    @Transactional(readOnly = true)
    public List<CheckInSession> findSessionsOn(Long classId, LocalDate occurrenceDate) {
        return sessionRepository.findByClassIdAndOccurrenceDateOrderByStartedAtDesc(classId, occurrenceDate);
    }

    @Override
    @Transactional(readOnly = true)
    public List<CheckInSession> findSessionsInRange(Long classId, Instant from, Instant to) {
        return sessionRepository.findByClassIdAndStartedAtGreaterThanEqualAndStartedAtLessThanOrderByStartedAtAsc(classId, from, to);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean hasCheckIn(Long sessionId, Long studentId) {
        return checkInRepository.existsBySessionIdAndStudentId(sessionId, studentId);
    }

    @Override
    @Transactional
    public Optional<CheckIn> insertCheckInWhileOpen(CheckIn checkIn) {
        Optional<CheckInSession> locked = sessionRepository.findByIdForUpdate(checkIn.getSessionId());
        if (locked.isEmpty()) {
            return Optional.empty();
        }
        CheckInSession session = locked.get();
        if (session.isExpired() || checkIn.getCheckedInAt().isAfter(session.getExpiresAt())) {
            return Optional.empty();
        }
        return Optional.of(checkInRepository.saveAndFlush(checkIn));
    }

    @Override
    @Transactional(readOnly = true)
    public List<CheckIn> findCheckIns(Long sessionId) {
        return checkInRepository.findBySessionIdOrderByCheckedInAtAsc(sessionId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<CheckIn> findCheckIns(Collection<Long> sessionIds) {
        if (sessionIds.isEmpty()) return List.of();
        return checkInRepository.findBySessionIdIn(sessionIds);
    }

    @Override
    @Transactional(readOnly = true)
    public List<CheckIn> findCheckInsForStudent(Long studentId, Collection<Long> sessionIds) {
        if (sessionIds.isEmpty()) return List.of();
        return checkInRepository.findForStudentInSessions(studentId, sessionIds);
    }
}
