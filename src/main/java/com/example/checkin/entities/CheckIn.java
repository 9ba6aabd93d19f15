package com.example.checkin.entities;

import com.example.checkin.enums.CheckInStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One student's attendance record against a session. Written once, never updated.
 */
@Entity
@Table(name = "checkin", uniqueConstraints = {
        @UniqueConstraint(name = "uk_checkin_session_student", columnNames = {"session_id", "student_id"})
}, indexes = {
        @Index(name = "idx_checkin_student", columnList = "student_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CheckIn {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false, updatable = false)
    private Long sessionId;

    @Column(name = "student_id", nullable = false, updatable = false)
    private Long studentId;

    @Column(name = "checked_in_at", nullable = false, updatable = false)
    private Instant checkedInAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private CheckInStatus status;

    // location is null for online sessions and manual check-ins
    @Column(updatable = false)
    private Double latitude;

    @Column(updatable = false)
    private Double longitude;

    @Column(updatable = false)
    private Double accuracy;
}
