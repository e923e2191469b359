package com.wanradar.cache;

/**
 * Cache age of one entity in seconds; {@link Double#POSITIVE_INFINITY} when nothing is cached.
 */
public record EntityAge(String entityId, double ageSeconds) {

    public static EntityAge missing(String entityId) {
        return new EntityAge(entityId, Double.POSITIVE_INFINITY);
    }

    public boolean isMissing() {
        return Double.isInfinite(ageSeconds);
    }
}
