package com.propertyintel.leads.service;

/**
 * Great-circle distance on a spherical Earth.
 */
public final class GeoDistance {

    public static final double EARTH_RADIUS_MILES = 3958.8;

    private GeoDistance() {
    }

    /** Haversine distance in miles between two lat/lon points given in degrees. */
    public static double haversineMiles(double lat1, double lon1, double lat2, double lon2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double dPhi = Math.toRadians(lat2 - lat1);
        double dLambda = Math.toRadians(lon2 - lon1);

        double a = Math.pow(Math.sin(dPhi / 2), 2)
                + Math.cos(phi1) * Math.cos(phi2) * Math.pow(Math.sin(dLambda / 2), 2);
        double c = 2 * Math.asin(Math.sqrt(Math.min(1.0, a)));
        return EARTH_RADIUS_MILES * c;
    }
}
