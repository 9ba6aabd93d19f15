package com.example.checkin.repository;

import com.example.checkin.entities.CheckIn;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface CheckInRepository extends JpaRepository<CheckIn, Long> {
    boolean existsBySessionIdAndStudentId(Long sessionId, Long studentId);
    List<CheckIn> findBySessionIdOrderByCheckedInAtAsc(Long sessionId);
    List<CheckIn> findBySessionIdIn(Collection<Long> sessionIds);

    @Query("select c from CheckIn c where c.studentId = :studentId and c.sessionId in :sessionIds")
    List<CheckIn> findForStudentInSessions(@Param("studentId") Long studentId,
                                           @Param("sessionIds") Collection<Long> sessionIds);
}
