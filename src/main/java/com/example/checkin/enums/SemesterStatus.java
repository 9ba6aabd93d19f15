package com.example.checkin.enums;

public enum SemesterStatus {
    ACTIVE,
    INACTIVE
}
