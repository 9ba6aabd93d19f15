package com.example.checkin.repository;

import com.example.checkin.entities.Enrollment;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface EnrollmentRepository extends JpaRepository<Enrollment, Long> {
    List<Enrollment> findByClassId(Long classId);
    List<Enrollment> findByStudentId(Long studentId);
    boolean existsByStudentIdAndClassId(Long studentId, Long classId);
}
