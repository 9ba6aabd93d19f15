package com.example.checkin.enums;

public enum ClassType {
    LECTURE,
    TUTORIAL
}
