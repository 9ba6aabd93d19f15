package com.example.checkin.service.access;

import com.example.checkin.entities.AppUser;
import com.example.checkin.enums.UserRole;
import lombok.Value;

/**
 * Verified caller: role plus the lecturer or student id the account acts as.
 */
@Value
public class CallerIdentity {
    Long subjectId;
    UserRole role;

    public static CallerIdentity of(AppUser user) {
        return new CallerIdentity(user.getSubjectId(), user.getRole());
    }

    public boolean isLecturer() {
        return role == UserRole.LECTURER;
    }

    public boolean isStudent() {
        return role == UserRole.STUDENT;
    }

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }
}
