package com.wanradar.ingestion.query;

import com.wanradar.ingestion.adapter.GatewayDeviceStatsSource;
import com.wanradar.ingestion.adapter.GatewayPortStatsSource;

import java.util.Arrays;
import java.util.Optional;

/**
 * Cached telemetry categories as addressed over HTTP ({@code port-stats}) and in cache keys ({@code port_stats}).
 */
public enum TelemetryCategory {
    PORT_STATS("port-stats", GatewayPortStatsSource.CATEGORY),
    DEVICE_STATS("device-stats", GatewayDeviceStatsSource.CATEGORY);

    private final String pathName;
    private final String cacheName;

    TelemetryCategory(String pathName, String cacheName) {
        this.pathName = pathName;
        this.cacheName = cacheName;
    }

    public String pathName() {
        return pathName;
    }

    public String cacheName() {
        return cacheName;
    }

    public static Optional<TelemetryCategory> fromPathName(String name) {
        return Arrays.stream(values())
                .filter(c -> c.pathName.equalsIgnoreCase(name) || c.cacheName.equalsIgnoreCase(name))
                .findFirst();
    }
}
