package com.wanradar.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Freshness-tracked per-entity cache over a key-value backing store, keys {@code <namespace>:<entityId>}.
 * <p>
 * Staleness is computed here from the write timestamp; the store's TTL only bounds growth and is kept far
 * longer than any staleness threshold. Backing-store failures never propagate: writes report false,
 * reads report nothing cached.
 */
public interface EntityCache {

    String namespace();

    /**
     * Stores {@code payload} for {@code entityId} stamped with the current time, replacing any previous entry.
     */
    boolean set(String entityId, List<JsonNode> payload, Duration ttl);

    boolean set(String entityId, List<JsonNode> payload);

    Optional<CacheEntry> get(String entityId);

    /**
     * False when nothing is cached; otherwise whether the entry is younger than {@code maxAge}.
     */
    boolean isFresh(String entityId, Duration maxAge);

    /**
     * Ages of the given entities, oldest first; entities with no entry come first with infinite age.
     */
    List<EntityAge> getAges(Collection<String> entityIds);

    /**
     * Up to {@code limit} entities whose age is at least {@code maxAge}, oldest (or missing) first.
     */
    List<String> getStaleIds(Collection<String> entityIds, Duration maxAge, int limit);

    /**
     * Groups {@code records} by the text value of {@code keyField}, writes one entry per group and returns
     * the number of entities written. Records without the field are skipped.
     */
    int bulkSet(List<JsonNode> records, String keyField, Duration ttl);

    /**
     * Groups {@code records} by {@code keyField} like {@link #bulkSet} but merges each group into the entity's
     * entry when that entry was written at or after {@code since}; older entries are replaced. Records with equal
     * {@code identityFields} values replace each other; with no identity fields records are appended.
     *
     * @return ids of the entities written
     */
    List<String> appendBatch(List<JsonNode> records, String keyField, List<String> identityFields, Instant since,
                             Duration ttl);

    /**
     * All cached records for the given entities, concatenated in no particular order.
     */
    List<JsonNode> getAll(Collection<String> entityIds);

    FreshnessSummary summarize(Collection<String> entityIds, Duration maxAge);

    /**
     * Records the process-wide "last successful collection" time.
     */
    boolean markCollected(Instant at);

    Optional<Instant> lastCollectedAt();

    boolean saveFetchSession(FetchSession session, Duration ttl);

    /** The latest fetch session of this namespace, finished or not. */
    Optional<FetchSession> fetchSession();

    boolean isAvailable();
}
