package com.example.checkin.controller;

import com.example.checkin.entities.CheckIn;
import com.example.checkin.entities.CheckInSession;
import com.example.checkin.service.session.SessionState;

import java.util.HashMap;
import java.util.Map;

final class SessionViews {

    private SessionViews() {
    }

    static Map<String, Object> session(CheckInSession s, SessionState state) {
        Map<String, Object> m = new HashMap<>();
        m.put("session_id", s.getId());
        m.put("class_id", s.getClassId());
        m.put("occurrence_date", s.getOccurrenceDate().toString());
        m.put("week_number", s.getWeekNumber());
        m.put("started_at", s.getStartedAt().toString());
        m.put("expires_at", s.getExpiresAt().toString());
        m.put("online_mode", s.isOnlineMode());
        m.put("is_expired", state == SessionState.EXPIRED);
        return m;
    }

    static Map<String, Object> checkIn(CheckIn c) {
        Map<String, Object> m = new HashMap<>();
        m.put("checkin_id", c.getId());
        m.put("session_id", c.getSessionId());
        m.put("student_id", c.getStudentId());
        m.put("checked_in_at", c.getCheckedInAt().toString());
        m.put("status", c.getStatus().name().toLowerCase());
        return m;
    }
}
