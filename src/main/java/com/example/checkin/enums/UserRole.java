package com.example.checkin.enums;

public enum UserRole {
    ADMIN,
    LECTURER,
    STUDENT
}
