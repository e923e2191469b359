package com.wanradar.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Set;

/**
 * Progress of one snapshot fetch, persisted after every batch so an interrupted fetch can continue
 * from {@code lastCursor} instead of starting over.
 */
public record FetchSession(
        String sessionId,
        Status status,
        Instant startedAt,
        Instant updatedAt,
        int batchesCompleted,
        int recordsSaved,
        Set<String> entityIds,
        String lastCursor
) {

    public enum Status {
        IN_PROGRESS,
        COMPLETED,
        INTERRUPTED
    }

    public FetchSession {
        entityIds = entityIds == null ? Set.of() : Set.copyOf(entityIds);
    }

    public static FetchSession start(String category, Instant now) {
        return new FetchSession(category + "_" + now.getEpochSecond(), Status.IN_PROGRESS, now, now, 0, 0, Set.of(), null);
    }

    public FetchSession afterBatch(int records, Collection<String> entitiesSoFar, String nextCursor, Instant now) {
        return new FetchSession(sessionId, status, startedAt, now, batchesCompleted + 1, recordsSaved + records,
                Set.copyOf(entitiesSoFar), nextCursor);
    }

    public FetchSession finish(Status finalStatus, Instant now) {
        return new FetchSession(sessionId, finalStatus, startedAt, now, batchesCompleted, recordsSaved, entityIds, lastCursor);
    }

    /**
     * In progress, has a cursor to continue from, and started less than {@code maxAge} ago.
     */
    public boolean isResumable(Instant now, Duration maxAge) {
        return status == Status.IN_PROGRESS
                && lastCursor != null
                && Duration.between(startedAt, now).compareTo(maxAge) < 0;
    }
}
