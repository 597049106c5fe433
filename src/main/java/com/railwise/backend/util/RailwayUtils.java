package com.railwise.backend.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class RailwayUtils {

    // Busiest hubs of the network, matched as name substrings
    public static final List<String> MAJOR_STATIONS = List.of(
            "Dhaka", "Chattogram", "Rajshahi", "Khulna", "Sylhet");

    // Station delay multipliers, first case-insensitive substring match wins
    public static final Map<String, Double> STATION_DELAY_FACTORS;

    static {
        Map<String, Double> factors = new LinkedHashMap<>();
        factors.put("Dhaka", 1.5);
        factors.put("Chattogram", 1.4);
        factors.put("Rajshahi", 1.2);
        factors.put("Khulna", 1.2);
        factors.put("Sylhet", 1.1);
        factors.put("Barisal", 1.1);
        factors.put("Rangpur", 1.1);
        factors.put("Mymensingh", 1.0);
        STATION_DELAY_FACTORS = Collections.unmodifiableMap(factors);
    }

    private RailwayUtils() {
    }

    public static boolean isMajorStation(String stationName) {
        if (stationName == null) {
            return false;
        }
        return MAJOR_STATIONS.stream().anyMatch(stationName::contains);
    }

    public static double getStationDelayFactor(String stationName) {
        if (stationName == null) {
            return 1.0;
        }
        String lower = stationName.toLowerCase();
        return STATION_DELAY_FACTORS.entrySet().stream()
                .filter(e -> lower.contains(e.getKey().toLowerCase()))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(1.0);
    }

    public static double round(double value, int places) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }
}
