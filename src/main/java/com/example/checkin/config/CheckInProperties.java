package com.example.checkin.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings under the {@code checkin.*} prefix.
 */
@Data
@ConfigurationProperties(prefix = "checkin")
public class CheckInProperties {

    /** How long a freshly opened session accepts check-ins. */
    private Duration window = Duration.ofMinutes(2);

    /** Zone used to turn instants into calendar dates (semester ranges, occurrences). */
    private String zone = "UTC";

    /** GPS accuracy above this value is logged but never blocks a check-in. */
    private double accuracyWarningMeters = 100;

    /** Planned number of teaching weeks, used for "remaining sessions" insights. */
    private int semesterWeeks = 14;

    /** Seed a demo semester, class, roster and accounts on startup. */
    private boolean seedDemoData = false;

    private Campus campus = new Campus();

    private Sweep sweep = new Sweep();

    @Data
    public static class Campus {
        private Double latitude;
        private Double longitude;
        private double radiusMeters = 500;
    }

    @Data
    public static class Sweep {
        private boolean enabled = true;
        private long intervalMs = 15000;
        private int batchSize = 100;
    }
}
