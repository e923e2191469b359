package com.wanradar.ingestion.job;

import com.fasterxml.jackson.databind.JsonNode;
import com.wanradar.cache.EntityCache;
import com.wanradar.cache.FetchSession;
import com.wanradar.ingestion.adapter.ApiCallResult;
import com.wanradar.ingestion.adapter.BatchListener;
import com.wanradar.ingestion.adapter.SnapshotSource;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * One snapshot fetch of a refresh cycle. Every batch is merged into the per-site cache entries as it arrives and
 * the session (batches, sites, last cursor) is saved after it, so pages fetched before a rate limit are kept and
 * a cursor source continues from the last cursor on the next cycle.
 */
@Slf4j
class SnapshotSession implements BatchListener {

    static final Duration FINISHED_SESSION_TTL = Duration.ofDays(1);

    private final EntityCache cache;
    private final SnapshotSource source;
    private final RefreshSettings settings;
    private final Clock clock;
    private final boolean resumed;
    private final String resumeCursor;
    private final Set<String> entitiesWritten;
    private FetchSession session;

    private SnapshotSession(EntityCache cache, SnapshotSource source, RefreshSettings settings, Clock clock,
                            FetchSession session, boolean resumed) {
        this.cache = cache;
        this.source = source;
        this.settings = settings;
        this.clock = clock;
        this.session = session;
        this.resumed = resumed;
        this.resumeCursor = resumed ? session.lastCursor() : null;
        this.entitiesWritten = new LinkedHashSet<>(session.entityIds());
    }

    /**
     * Continues the stored session when the source supports it and the session is still resumable;
     * otherwise starts and saves a new one.
     */
    static SnapshotSession open(EntityCache cache, SnapshotSource source, RefreshSettings settings, Clock clock) {
        Instant now = clock.instant();
        Optional<FetchSession> previous = source.supportsResume()
                ? cache.fetchSession().filter(s -> s.isResumable(now, settings.resumeMaxAge()))
                : Optional.empty();
        if (previous.isPresent()) {
            FetchSession stored = previous.get();
            log.info("Resuming {} fetch {} after batch {} ({} records, {} sites already cached)",
                    source.category(), stored.sessionId(), stored.batchesCompleted(), stored.recordsSaved(),
                    stored.entityIds().size());
            return new SnapshotSession(cache, source, settings, clock, stored, true);
        }
        FetchSession fresh = FetchSession.start(source.category(), now);
        cache.saveFetchSession(fresh, settings.resumeMaxAge());
        return new SnapshotSession(cache, source, settings, clock, fresh, false);
    }

    boolean isResumed() {
        return resumed;
    }

    /** Null for a full fetch. */
    String resumeCursor() {
        return resumeCursor;
    }

    @Override
    public void onBatch(List<JsonNode> records, int batchNumber, String nextCursor) {
        List<String> ids = cache.appendBatch(records, settings.keyField(), source.recordIdentityFields(),
                session.startedAt(), settings.entryTtl());
        entitiesWritten.addAll(ids);
        session = session.afterBatch(records.size(), entitiesWritten, nextCursor, clock.instant());
        cache.saveFetchSession(session, settings.resumeMaxAge());
        log.debug("{} fetch {}: batch {} saved ({} records, {} sites so far)", source.category(),
                session.sessionId(), session.batchesCompleted(), records.size(), entitiesWritten.size());
    }

    /**
     * Writes the completed snapshot and closes the session. A full fetch replaces every site's entry with its
     * records; a resumed fetch only holds the records after the cursor, which the batches already merged.
     *
     * @return number of sites written by this fetch
     */
    int complete(List<JsonNode> records) {
        int written = resumed
                ? entitiesWritten.size()
                : cache.bulkSet(records, settings.keyField(), settings.entryTtl());
        session = session.finish(FetchSession.Status.COMPLETED, clock.instant());
        cache.saveFetchSession(session, FINISHED_SESSION_TTL);
        return written;
    }

    /**
     * Leaves the session resumable after a rate limit, or after a failed full fetch that handed out a cursor.
     * A resumed fetch that fails for any other reason is abandoned so the next cycle starts over.
     */
    void suspend(ApiCallResult.Status outcome) {
        boolean keep = source.supportsResume()
                && session.lastCursor() != null
                && (outcome == ApiCallResult.Status.RATE_LIMITED || !resumed);
        if (keep) {
            log.info("{} fetch {} interrupted ({}): {} batches and {} sites kept, next cycle continues from the last cursor",
                    source.category(), session.sessionId(), outcome, session.batchesCompleted(), entitiesWritten.size());
            return;
        }
        session = session.finish(FetchSession.Status.INTERRUPTED, clock.instant());
        cache.saveFetchSession(session, FINISHED_SESSION_TTL);
        if (session.batchesCompleted() > 0) {
            log.info("{} fetch {} interrupted ({}): {} sites cached from {} batches",
                    source.category(), session.sessionId(), outcome, entitiesWritten.size(), session.batchesCompleted());
        }
    }
}
