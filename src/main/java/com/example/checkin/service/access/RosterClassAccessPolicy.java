package com.example.checkin.service.access;

import com.example.checkin.repository.CourseClassRepository;
import com.example.checkin.repository.EnrollmentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Lecturers manage the classes they teach (admins manage all); students attend classes they are enrolled in.
 */
@Component
@RequiredArgsConstructor
public class RosterClassAccessPolicy implements ClassAccessPolicy {

    private final CourseClassRepository courseClassRepository;
    private final EnrollmentRepository enrollmentRepository;

    @Override
    @Transactional(readOnly = true)
    public boolean canManage(CallerIdentity caller, Long classId) {
        if (caller.isAdmin()) return true;
        if (!caller.isLecturer() || caller.getSubjectId() == null || classId == null) return false;
        return courseClassRepository.findById(classId)
                .map(c -> caller.getSubjectId().equals(c.getLecturerId()))
                .orElse(false);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean canAttend(CallerIdentity caller, Long classId) {
        if (!caller.isStudent() || caller.getSubjectId() == null) return false;
        return enrollmentRepository.existsByStudentIdAndClassId(caller.getSubjectId(), classId);
    }
}
