package com.example.checkin.service.geo;

import lombok.Value;

/**
 * Device-reported position. accuracy is the reported radius of uncertainty in meters, may be null.
 */
@Value
public class GeoLocation {
    Double latitude;
    Double longitude;
    Double accuracy;

    public static GeoLocation of(double latitude, double longitude) {
        return new GeoLocation(latitude, longitude, null);
    }
}
