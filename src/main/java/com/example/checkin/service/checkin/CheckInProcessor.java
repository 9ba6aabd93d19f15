package com.example.checkin.service.checkin;

import com.example.checkin.config.CheckInProperties;
import com.example.checkin.entities.CheckIn;
import com.example.checkin.entities.CheckInSession;
import com.example.checkin.enums.CheckInStatus;
import com.example.checkin.repository.EnrollmentRepository;
import com.example.checkin.service.error.AttendanceException;
import com.example.checkin.service.error.ErrorKind;
import com.example.checkin.service.error.StoreFailures;
import com.example.checkin.service.geo.CampusGeofence;
import com.example.checkin.service.geo.GeoDistance;
import com.example.checkin.service.geo.GeoLocation;
import com.example.checkin.service.geo.GeofenceCheck;
import com.example.checkin.service.notify.AttendanceEvent;
import com.example.checkin.service.notify.AttendanceNotifier;
import com.example.checkin.service.session.SessionLifecycleManager;
import com.example.checkin.service.session.SessionState;
import com.example.checkin.service.session.SessionStore;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Validates and records check-in attempts.
 *
 * Order of checks for a student submission:
 * - session exists
 * - session is active (flag or wall clock)
 * - location present, well-formed and inside the campus radius, unless the session is online
 * - no earlier check-in for (session, student); the store's unique key settles concurrent attempts
 * - at insert, the session row is re-read under lock and must still be open at the attempt's instant
 *
 * Nothing is retried here. Every failure is returned to the caller as a {@link CheckInError}.
 */
@Service
@RequiredArgsConstructor
public class CheckInProcessor {

    private static final Logger log = LoggerFactory.getLogger(CheckInProcessor.class);

    private final SessionLifecycleManager lifecycleManager;
    private final SessionStore sessionStore;
    private final EnrollmentRepository enrollmentRepository;
    private final CampusGeofence campusGeofence;
    private final AttendanceNotifier notifier;
    private final CheckInProperties properties;
    private final Clock clock;

    public CheckInResult submitCheckIn(Long sessionId, Long studentId, GeoLocation location) {
        Instant now = clock.instant();
        try {
            CheckInSession session = lifecycleManager.requireSession(sessionId);
            if (SessionState.of(session, now) != SessionState.ACTIVE) {
                return CheckInResult.failure(CheckInErrorCode.SESSION_EXPIRED, "Session has expired");
            }

            GeoLocation recorded = null;
            if (!session.isOnlineMode()) {
                CheckInError locationError = validateLocation(studentId, location);
                if (locationError != null) {
                    return CheckInResult.failure(locationError);
                }
                recorded = location;
            }

            return record(session, studentId, CheckInStatus.PRESENT, recorded, now);
        } catch (AttendanceException ex) {
            return CheckInResult.failure(translate(ex));
        }
    }

    /**
     * Lecturer override: marks an enrolled student present without a location check.
     */
    public CheckInResult recordManualCheckIn(Long sessionId, Long studentId) {
        Instant now = clock.instant();
        try {
            CheckInSession session = lifecycleManager.requireSession(sessionId);
            if (SessionState.of(session, now) != SessionState.ACTIVE) {
                return CheckInResult.failure(CheckInErrorCode.SESSION_EXPIRED, "Session already expired");
            }
            boolean enrolled = StoreFailures.guard("load enrollment",
                    () -> enrollmentRepository.existsByStudentIdAndClassId(studentId, session.getClassId()));
            if (!enrolled) {
                return CheckInResult.failure(CheckInErrorCode.STUDENT_NOT_ENROLLED,
                        "Student " + studentId + " is not enrolled in class " + session.getClassId());
            }
            return record(session, studentId, CheckInStatus.MANUAL, null, now);
        } catch (AttendanceException ex) {
            return CheckInResult.failure(translate(ex));
        }
    }

    private CheckInError validateLocation(Long studentId, GeoLocation location) {
        if (location == null || location.getLatitude() == null || location.getLongitude() == null) {
            return CheckInError.of(CheckInErrorCode.LOCATION_REQUIRED,
                    "Geolocation (latitude, longitude) is required for in-person sessions");
        }
        if (!GeoDistance.isValidCoordinate(location.getLatitude(), location.getLongitude())) {
            return CheckInError.of(CheckInErrorCode.INVALID_COORDINATES,
                    "Coordinates out of range: " + location.getLatitude() + ", " + location.getLongitude());
        }

        GeofenceCheck check = campusGeofence.check(location);
        log.debug("Geofence check student={} at ({}, {}) distance={}m radius={}m accuracy={}",
                studentId, location.getLatitude(), location.getLongitude(),
                check.getDistanceMeters(), check.getRadiusMeters(), location.getAccuracy());
        if (!check.isInside()) {
            return CheckInError.outOfRange(check.getDistanceMeters(), check.getRadiusMeters());
        }

        Double accuracy = location.getAccuracy();
        if (accuracy != null && accuracy > properties.getAccuracyWarningMeters()) {
            log.warn("Poor GPS accuracy ({}m) for student {}", accuracy, studentId);
        }
        return null;
    }

    /**
     * {@code now} is the instant the attempt was judged at. It becomes checkedInAt, and the store
     * refuses the row if the session was flagged or its window ended before that instant.
     */
    private CheckInResult record(CheckInSession session, Long studentId, CheckInStatus status, GeoLocation location,
                                 Instant now) {
        boolean exists = StoreFailures.guard("load check-in", () -> sessionStore.hasCheckIn(session.getId(), studentId));
        if (exists) {
            return alreadyCheckedIn(session, studentId);
        }

        CheckIn candidate = CheckIn.builder()
                .sessionId(session.getId())
                .studentId(studentId)
                .checkedInAt(now)
                .status(status)
                .latitude(location == null ? null : location.getLatitude())
                .longitude(location == null ? null : location.getLongitude())
                .accuracy(location == null ? null : location.getAccuracy())
                .build();

        Optional<CheckIn> inserted;
        try {
            inserted = StoreFailures.guard("save check-in", () -> sessionStore.insertCheckInWhileOpen(candidate));
        } catch (DataIntegrityViolationException ex) {
            // a concurrent submission for the same pair committed first
            log.debug("Unique key rejected check-in session={} student={}: {}", session.getId(), studentId, ex.getMessage());
            return alreadyCheckedIn(session, studentId);
        }
        if (inserted.isEmpty()) {
            // expired between validation and insert
            log.info("Check-in refused, session {} closed before insert (student {})", session.getId(), studentId);
            return CheckInResult.failure(CheckInErrorCode.SESSION_EXPIRED, "Session has expired");
        }
        CheckIn saved = inserted.get();

        log.info("Check-in recorded session={} class={} student={} status={}",
                session.getId(), session.getClassId(), studentId, status);
        notifier.publish(AttendanceEvent.checkInRecorded(session, saved));
        return CheckInResult.success(saved);
    }

    private CheckInResult alreadyCheckedIn(CheckInSession session, Long studentId) {
        log.info("Duplicate check-in rejected session={} student={}", session.getId(), studentId);
        return CheckInResult.failure(CheckInErrorCode.ALREADY_CHECKED_IN, "Already checked in for this session");
    }

    private CheckInError translate(AttendanceException ex) {
        if (ex.getKind() == ErrorKind.TRANSIENT) {
            log.warn("Check-in aborted, store unavailable: {}", ex.getMessage());
            return CheckInError.of(CheckInErrorCode.STORE_UNAVAILABLE, ex.getMessage());
        }
        if (ex.getKind() == ErrorKind.NOT_FOUND) {
            return CheckInError.of(CheckInErrorCode.SESSION_NOT_FOUND, ex.getMessage());
        }
        throw ex;
    }
}
