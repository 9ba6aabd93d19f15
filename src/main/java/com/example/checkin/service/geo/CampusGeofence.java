package com.example.checkin.service.geo;

import com.example.checkin.config.CheckInProperties;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * The circular check-in area around the configured campus reference point.
 */
@Component
@RequiredArgsConstructor
public class CampusGeofence {

    private static final Logger log = LoggerFactory.getLogger(CampusGeofence.class);

    private final CheckInProperties properties;

    @PostConstruct
    void logConfiguration() {
        CheckInProperties.Campus campus = properties.getCampus();
        if (isConfigured()) {
            log.info("Campus geofence at ({}, {}) radius={}m", campus.getLatitude(), campus.getLongitude(), campus.getRadiusMeters());
        } else {
            log.warn("Campus location not configured (checkin.campus.latitude/longitude); in-person check-ins will be rejected");
        }
    }

    public boolean isConfigured() {
        CheckInProperties.Campus campus = properties.getCampus();
        return GeoDistance.isValidCoordinate(campus.getLatitude(), campus.getLongitude());
    }

    /**
     * Measures the position against the campus center. Distance is rounded to the nearest meter
     * before the radius comparison.
     */
    public GeofenceCheck check(GeoLocation location) {
        if (!isConfigured()) {
            throw new IllegalStateException("Campus location not configured");
        }
        CheckInProperties.Campus campus = properties.getCampus();
        long distance = Math.round(GeoDistance.distanceMeters(
                location.getLatitude(), location.getLongitude(), campus.getLatitude(), campus.getLongitude()));
        double radius = campus.getRadiusMeters();
        return new GeofenceCheck(distance, radius, GeoDistance.withinRadius(distance, radius));
    }
}
