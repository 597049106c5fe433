package com.railwise.backend.util;

import com.railwise.backend.model.Coordinate;

import java.util.List;

public final class GeoUtils {

    public static final double EARTH_RADIUS_KM = 6371.0;

    private GeoUtils() {
    }

    /**
     * Great-circle distance in km (haversine), rounded to 2 decimals.
     */
    public static double distanceKm(Coordinate from, Coordinate to) {
        double lat1 = from.getLatitude();
        double lat2 = to.getLatitude();
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(to.getLongitude() - from.getLongitude());
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2) +
                Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2)) *
                        Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return RailwayUtils.round(EARTH_RADIUS_KM * c, 2);
    }

    /**
     * Sum of the consecutive-pair distances along an ordered list of points.
     */
    public static double routeDistanceKm(List<Coordinate> points) {
        double total = 0.0;
        for (int i = 0; i + 1 < points.size(); i++) {
            total += distanceKm(points.get(i), points.get(i + 1));
        }
        return RailwayUtils.round(total, 2);
    }
}
