package com.wanradar.api.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

/**
 * GET /api/v1/sites/{siteId}/{category} response: the cached records for one site.
 */
public record SiteCacheEntryResponse(
        String siteId,
        String category,
        Instant timestamp,
        double ageSeconds,
        List<JsonNode> records
) {
}
