package com.wanradar.api.controller;

import com.wanradar.api.dto.ErrorBody;
import com.wanradar.api.dto.SiteCacheEntryResponse;
import com.wanradar.cache.CacheEntry;
import com.wanradar.ingestion.query.CollectionStatusService;
import com.wanradar.ingestion.query.TelemetryCategory;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

/**
 * Cached per-site telemetry: GET /api/v1/sites/{siteId}/port-stats and /device-stats. 404 when nothing is cached.
 */
@RestController
@RequestMapping("/api/v1/sites")
@RequiredArgsConstructor
public class SiteCacheController {

    private final CollectionStatusService statusService;
    private final Clock clock;

    @GetMapping("/{siteId}/port-stats")
    public ResponseEntity<?> portStats(@PathVariable String siteId) {
        return entry(TelemetryCategory.PORT_STATS, siteId);
    }

    @GetMapping("/{siteId}/device-stats")
    public ResponseEntity<?> deviceStats(@PathVariable String siteId) {
        return entry(TelemetryCategory.DEVICE_STATS, siteId);
    }

    private ResponseEntity<?> entry(TelemetryCategory category, String siteId) {
        return statusService.findSiteEntry(category, siteId)
                .<ResponseEntity<?>>map(e -> ResponseEntity.ok(toResponse(category, e)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ErrorBody.of(HttpStatus.NOT_FOUND, "SITE_NOT_CACHED", "No cached " + category.pathName() + " for site")));
    }

    private SiteCacheEntryResponse toResponse(TelemetryCategory category, CacheEntry entry) {
        return new SiteCacheEntryResponse(
                entry.entityId(),
                category.pathName(),
                entry.timestamp(),
                entry.ageAt(clock.instant()).toMillis() / 1000.0,
                entry.payload());
    }
}
