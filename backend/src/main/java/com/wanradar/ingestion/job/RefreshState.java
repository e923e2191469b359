package com.wanradar.ingestion.job;

public enum RefreshState {
    IDLE,
    RATE_LIMITED_WAIT,
    FETCHING,
    CACHING,
    STOPPED
}
