package com.example.checkin.service.geo;

import lombok.Value;

@Value
public class GeofenceCheck {
    long distanceMeters;
    double radiusMeters;
    boolean inside;
}
