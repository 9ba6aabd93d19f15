package com.example.checkin.service.notify;

import com.example.checkin.entities.CheckIn;
import com.example.checkin.entities.CheckInSession;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Payload pushed to subscribers of a class topic. Fields that do not apply to the event type are null
 * and left out of the JSON.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AttendanceEvent {

    AttendanceEventType type;

    @JsonProperty("class_id")
    Long classId;

    @JsonProperty("session_id")
    Long sessionId;

    @JsonProperty("started_at")
    Instant startedAt;

    @JsonProperty("expires_at")
    Instant expiresAt;

    @JsonProperty("online_mode")
    Boolean onlineMode;

    @JsonProperty("student_id")
    Long studentId;

    Instant timestamp;

    public static AttendanceEvent sessionOpened(CheckInSession session) {
        return AttendanceEvent.builder()
                .type(AttendanceEventType.SESSION_OPENED)
                .classId(session.getClassId())
                .sessionId(session.getId())
                .startedAt(session.getStartedAt())
                .expiresAt(session.getExpiresAt())
                .onlineMode(session.isOnlineMode())
                .build();
    }

    public static AttendanceEvent checkInRecorded(CheckInSession session, CheckIn checkIn) {
        return AttendanceEvent.builder()
                .type(AttendanceEventType.CHECK_IN_RECORDED)
                .classId(session.getClassId())
                .sessionId(session.getId())
                .studentId(checkIn.getStudentId())
                .timestamp(checkIn.getCheckedInAt())
                .build();
    }

    public static AttendanceEvent sessionExpired(CheckInSession session) {
        return AttendanceEvent.builder()
                .type(AttendanceEventType.SESSION_EXPIRED)
                .classId(session.getClassId())
                .sessionId(session.getId())
                .build();
    }
}
