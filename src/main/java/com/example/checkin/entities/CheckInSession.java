package com.example.checkin.entities;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;

/**
 * A concrete check-in window for one occurrence of a class.
 *
 * activeKey holds "{classId}:{occurrenceDate}" while this row is the open session of that
 * occurrence and is cleared when the row is marked expired. The unique constraint on it is what
 * keeps two open sessions for the same occurrence out of the store.
 */
@Entity
@Table(name = "checkin_session", uniqueConstraints = {
        @UniqueConstraint(name = "uk_session_active_key", columnNames = {"active_key"})
}, indexes = {
        @Index(name = "idx_session_class_started", columnList = "class_id, started_at"),
        @Index(name = "idx_session_expiry", columnList = "expired, expires_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CheckInSession {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "class_id", nullable = false, updatable = false)
    private Long classId;

    @Column(name = "occurrence_date", nullable = false, updatable = false)
    private LocalDate occurrenceDate;

    // academic week at open time, informational only
    @Column(name = "week_number")
    private Integer weekNumber;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    @Column(name = "online_mode", nullable = false, updatable = false)
    private boolean onlineMode;

    @Column(name = "expired", nullable = false)
    private boolean expired;

    @Column(name = "active_key", length = 64)
    private String activeKey;

    @Version
    private Long version;

    public static String activeKeyFor(Long classId, LocalDate occurrenceDate) {
        return classId + ":" + occurrenceDate;
    }
}
