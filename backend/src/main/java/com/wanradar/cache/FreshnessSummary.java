package com.wanradar.cache;

/**
 * Fresh / stale / missing counts over a set of entities for one staleness threshold.
 */
public record FreshnessSummary(int fresh, int stale, int missing) {

    public int total() {
        return fresh + stale + missing;
    }
}
