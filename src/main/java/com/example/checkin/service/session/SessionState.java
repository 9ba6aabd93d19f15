package com.example.checkin.service.session;

import com.example.checkin.entities.CheckInSession;

import java.time.Instant;

/**
 * Lifecycle state of a session row. "Pending" (no row yet) is never observed here.
 *
 * A session is EXPIRED when it is flagged or when {@code now} is past expiresAt, whichever
 * happens first, so readers never depend on the sweep having run.
 */
public enum SessionState {
    ACTIVE,
    EXPIRED;

    public static SessionState of(CheckInSession session, Instant now) {
        return isExpired(session, now) ? EXPIRED : ACTIVE;
    }

    public static boolean isExpired(CheckInSession session, Instant now) {
        return session.isExpired() || now.isAfter(session.getExpiresAt());
    }

    /** Past its window but not flagged yet. */
    public static boolean isDueForExpiry(CheckInSession session, Instant now) {
        return !session.isExpired() && now.isAfter(session.getExpiresAt());
    }
}
