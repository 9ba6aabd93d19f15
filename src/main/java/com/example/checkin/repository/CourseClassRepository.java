package com.example.checkin.repository;

import com.example.checkin.entities.CourseClass;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface CourseClassRepository extends JpaRepository<CourseClass, Long> {
    List<CourseClass> findByLecturerIdOrderByClassNameAsc(Long lecturerId);
    List<CourseClass> findByIdInOrderByClassNameAsc(Collection<Long> ids);
}
