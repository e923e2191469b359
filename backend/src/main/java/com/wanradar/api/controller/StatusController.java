package com.wanradar.api.controller;

import com.wanradar.api.dto.CacheSummaryResponse;
import com.wanradar.api.dto.CollectionStatusResponse;
import com.wanradar.api.dto.ErrorBody;
import com.wanradar.cache.FreshnessSummary;
import com.wanradar.ingestion.query.CollectionStatusService;
import com.wanradar.ingestion.query.RateLimitSummary;
import com.wanradar.ingestion.query.TelemetryCategory;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Collection status: quota countdown, scheduler counters and cache freshness over the known sites.
 */
@RestController
@RequestMapping("/api/v1/status")
@RequiredArgsConstructor
public class StatusController {

    private final CollectionStatusService statusService;

    @GetMapping
    public ResponseEntity<CollectionStatusResponse> status() {
        return ResponseEntity.ok(new CollectionStatusResponse(
                statusService.getRateLimitStatus(),
                statusService.getSchedulerStatuses(),
                statusService.getLastCollectedAt().orElse(null),
                statusService.isCacheAvailable()));
    }

    @GetMapping("/rate-limit")
    public ResponseEntity<RateLimitSummary> rateLimit() {
        return ResponseEntity.ok(statusService.getRateLimitStatus());
    }

    /**
     * GET /api/v1/status/cache?category=port-stats. 400 for an unknown category.
     */
    @GetMapping("/cache")
    public ResponseEntity<?> cache(@RequestParam(name = "category", defaultValue = "port-stats") String category) {
        return TelemetryCategory.fromPathName(category)
                .<ResponseEntity<?>>map(c -> {
                    FreshnessSummary summary = statusService.getCacheSummary(c);
                    return ResponseEntity.ok(new CacheSummaryResponse(
                            c.pathName(),
                            statusService.maxAge(c).toSeconds(),
                            summary.fresh(),
                            summary.stale(),
                            summary.missing(),
                            summary.total()));
                })
                .orElseGet(() -> ResponseEntity.badRequest()
                        .body(ErrorBody.of(HttpStatus.BAD_REQUEST, "UNKNOWN_CATEGORY", "Unknown telemetry category")));
    }
}
