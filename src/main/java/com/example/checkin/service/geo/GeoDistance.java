package com.example.checkin.service.geo;

/**
 * Great-circle distance on a spherical Earth (haversine).
 */
public final class GeoDistance {

    public static final double EARTH_RADIUS_METERS = 6_371_000d;

    private GeoDistance() {
    }

    public static double distanceMeters(double lat1, double lon1, double lat2, double lon2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double dPhi = Math.toRadians(lat2 - lat1);
        double dLambda = Math.toRadians(lon2 - lon1);

        double a = Math.sin(dPhi / 2) * Math.sin(dPhi / 2)
                + Math.cos(phi1) * Math.cos(phi2) * Math.sin(dLambda / 2) * Math.sin(dLambda / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_METERS * c;
    }

    public static boolean withinRadius(double distanceMeters, double radiusMeters) {
        return distanceMeters <= radiusMeters;
    }

    public static boolean isValidCoordinate(Double latitude, Double longitude) {
        if (latitude == null || longitude == null) return false;
        if (!Double.isFinite(latitude) || !Double.isFinite(longitude)) return false;
        return latitude >= -90 && latitude <= 90 && longitude >= -180 && longitude <= 180;
    }
}
