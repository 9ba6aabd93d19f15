package com.example.checkin.service.session;

import com.example.checkin.config.CheckInProperties;
import com.example.checkin.service.error.AttendanceException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically flags overdue sessions so session_expired reaches clients without waiting for a read.
 * Readers evaluate expiry themselves, so disabling this only delays the notification.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "checkin.sweep", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SessionExpirySweeper {

    private static final Logger log = LoggerFactory.getLogger(SessionExpirySweeper.class);

    private final SessionLifecycleManager lifecycleManager;
    private final CheckInProperties properties;

    @Scheduled(fixedDelayString = "${checkin.sweep.interval-ms:15000}",
            initialDelayString = "${checkin.sweep.interval-ms:15000}")
    public void sweep() {
        try {
            int expired = lifecycleManager.expireOverdueSessions(properties.getSweep().getBatchSize());
            if (expired > 0) {
                log.info("Expiry sweep flagged {} session(s)", expired);
            }
        } catch (AttendanceException ex) {
            // next run picks the same rows up again
            log.warn("Expiry sweep skipped: {}", ex.getMessage());
        }
    }
}
