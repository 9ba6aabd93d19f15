package com.example.checkin.repository;

import com.example.checkin.entities.Semester;
import com.example.checkin.enums.SemesterStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface SemesterRepository extends JpaRepository<Semester, Long> {
    Optional<Semester> findFirstByStatusOrderByStartDateDesc(SemesterStatus status);
}
