package com.wanradar.ingestion.job;

/**
 * Logging mode of a scheduler: per-cycle progress until every known entity is cached once, then periodic heartbeat.
 */
public enum RefreshMode {
    PROGRESS,
    HEARTBEAT
}
