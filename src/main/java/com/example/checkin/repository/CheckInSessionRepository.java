package com.example.checkin.repository;

import com.example.checkin.entities.CheckInSession;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface CheckInSessionRepository extends JpaRepository<CheckInSession, Long> {

    Optional<CheckInSession> findByActiveKey(String activeKey);

    List<CheckInSession> findByClassIdAndStartedAtGreaterThanEqualAndStartedAtLessThanOrderByStartedAtAsc(
            Long classId, Instant from, Instant to);

    List<CheckInSession> findByClassIdAndOccurrenceDateOrderByStartedAtDesc(Long classId, LocalDate occurrenceDate);

    List<CheckInSession> findByClassIdAndExpiredFalseOrderByStartedAtDesc(Long classId);

    List<CheckInSession> findByClassIdInAndExpiredFalseOrderByExpiresAtAsc(Collection<Long> classIds);

    /**
     * Reads the session holding its row lock until the surrounding transaction ends. markExpired on the
     * same row waits behind it.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from CheckInSession s where s.id = :id")
    Optional<CheckInSession> findByIdForUpdate(@Param("id") Long id);

    @Query("select s from CheckInSession s where s.expired = false and s.expiresAt < :now order by s.expiresAt asc")
    List<CheckInSession> findOverdue(@Param("now") Instant now, Pageable page);

    /**
     * Flags the session expired and releases its active key. Returns 1 only for the caller that
     * performed the transition.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update CheckInSession s set s.expired = true, s.activeKey = null, s.version = s.version + 1 " +
            "where s.id = :id and s.expired = false")
    int markExpired(@Param("id") Long id);
}
