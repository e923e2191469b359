package com.wanradar.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Freshness logic shared by the store-backed caches. Entries are stored as
 * {@code {"timestamp": <epoch millis>, "payload": [...]}} JSON strings; the fetch session under its own key.
 */
@Slf4j
public abstract class AbstractEntityCache implements EntityCache {

    static final String FIELD_TIMESTAMP = "timestamp";
    static final String FIELD_PAYLOAD = "payload";

    private final String namespace;
    private final String metadataKey;
    private final String sessionKey;
    private final Duration defaultTtl;
    protected final ObjectMapper objectMapper;
    protected final Clock clock;

    protected AbstractEntityCache(String namespace, String metadataKey, String sessionKey, Duration defaultTtl,
                                  ObjectMapper objectMapper, Clock clock) {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace is required");
        }
        this.namespace = namespace;
        this.metadataKey = metadataKey;
        this.sessionKey = sessionKey;
        this.defaultTtl = defaultTtl;
        this.objectMapper = objectMapper;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    /** Stores {@code value} under {@code key}; a null ttl means no expiry. */
    protected abstract void write(String key, String value, Duration ttl);

    protected abstract String read(String key);

    /**
     * Values for {@code keys} in the same order, null where absent. Stores with a batch read override this.
     */
    protected List<String> readAll(List<String> keys) {
        List<String> values = new ArrayList<>(keys.size());
        for (String key : keys) {
            values.add(read(key));
        }
        return values;
    }

    @Override
    public String namespace() {
        return namespace;
    }

    String keyFor(String entityId) {
        return namespace + ":" + entityId;
    }

    @Override
    public boolean set(String entityId, List<JsonNode> payload) {
        return set(entityId, payload, defaultTtl);
    }

    @Override
    public boolean set(String entityId, List<JsonNode> payload, Duration ttl) {
        try {
            ObjectNode entry = objectMapper.createObjectNode();
            entry.put(FIELD_TIMESTAMP, clock.millis());
            ArrayNode records = entry.putArray(FIELD_PAYLOAD);
            if (payload != null) {
                records.addAll(payload);
            }
            write(keyFor(entityId), objectMapper.writeValueAsString(entry), ttl != null ? ttl : defaultTtl);
            return true;
        } catch (Exception e) {
            log.error("Error storing cache entry {}: {}", keyFor(entityId), e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<CacheEntry> get(String entityId) {
        String raw;
        try {
            raw = read(keyFor(entityId));
        } catch (RuntimeException e) {
            log.error("Error reading cache entry {}: {}", keyFor(entityId), e.getMessage());
            return Optional.empty();
        }
        return decode(entityId, raw);
    }

    @Override
    public boolean isFresh(String entityId, Duration maxAge) {
        return get(entityId)
                .map(entry -> entry.ageAt(clock.instant()).compareTo(maxAge) < 0)
                .orElse(false);
    }

    @Override
    public List<EntityAge> getAges(Collection<String> entityIds) {
        if (entityIds == null || entityIds.isEmpty()) {
            return List.of();
        }
        List<String> ids = List.copyOf(entityIds);
        List<String> raw = readBatch(ids);
        long now = clock.millis();
        List<EntityAge> ages = new ArrayList<>(ids.size());
        for (int i = 0; i < ids.size(); i++) {
            String id = ids.get(i);
            Optional<Long> written = decodeTimestamp(id, raw.get(i));
            ages.add(written.map(ts -> new EntityAge(id, (now - ts) / 1000.0)).orElseGet(() -> EntityAge.missing(id)));
        }
        ages.sort(Comparator.comparingDouble(EntityAge::ageSeconds).reversed());
        return ages;
    }

    @Override
    public List<String> getStaleIds(Collection<String> entityIds, Duration maxAge, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        double maxAgeSeconds = maxAge.toMillis() / 1000.0;
        return getAges(entityIds).stream()
                .filter(age -> age.ageSeconds() >= maxAgeSeconds)
                .limit(limit)
                .map(EntityAge::entityId)
                .toList();
    }

    @Override
    public int bulkSet(List<JsonNode> records, String keyField, Duration ttl) {
        if (records == null || records.isEmpty()) {
            return 0;
        }
        int written = 0;
        for (Map.Entry<String, List<JsonNode>> e : groupByEntity(records, keyField).entrySet()) {
            if (set(e.getKey(), e.getValue(), ttl)) {
                written++;
            }
        }
        log.info("Cached {} for {} entities", namespace, written);
        return written;
    }

    @Override
    public List<String> appendBatch(List<JsonNode> records, String keyField, List<String> identityFields,
                                    Instant since, Duration ttl) {
        if (records == null || records.isEmpty()) {
            return List.of();
        }
        List<String> written = new ArrayList<>();
        for (Map.Entry<String, List<JsonNode>> e : groupByEntity(records, keyField).entrySet()) {
            List<JsonNode> merged = get(e.getKey())
                    .filter(entry -> since == null || !entry.timestamp().isBefore(since))
                    .map(entry -> merge(entry.payload(), e.getValue(), identityFields))
                    .orElse(e.getValue());
            if (set(e.getKey(), merged, ttl)) {
                written.add(e.getKey());
            }
        }
        log.debug("Merged batch of {} records into {} {} entries", records.size(), written.size(), namespace);
        return written;
    }

    @Override
    public List<JsonNode> getAll(Collection<String> entityIds) {
        if (entityIds == null || entityIds.isEmpty()) {
            return List.of();
        }
        List<String> ids = List.copyOf(entityIds);
        List<String> raw = readBatch(ids);
        List<JsonNode> all = new ArrayList<>();
        for (int i = 0; i < ids.size(); i++) {
            decode(ids.get(i), raw.get(i)).ifPresent(entry -> all.addAll(entry.payload()));
        }
        return all;
    }

    @Override
    public FreshnessSummary summarize(Collection<String> entityIds, Duration maxAge) {
        double maxAgeSeconds = maxAge.toMillis() / 1000.0;
        int fresh = 0;
        int stale = 0;
        int missing = 0;
        for (EntityAge age : getAges(entityIds)) {
            if (age.isMissing()) {
                missing++;
            } else if (age.ageSeconds() >= maxAgeSeconds) {
                stale++;
            } else {
                fresh++;
            }
        }
        return new FreshnessSummary(fresh, stale, missing);
    }

    @Override
    public boolean markCollected(Instant at) {
        try {
            write(metadataKey, Long.toString(at.toEpochMilli()), null);
            return true;
        } catch (RuntimeException e) {
            log.error("Error storing last collection time: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<Instant> lastCollectedAt() {
        try {
            String raw = read(metadataKey);
            return raw == null ? Optional.empty() : Optional.of(Instant.ofEpochMilli(Long.parseLong(raw.strip())));
        } catch (NumberFormatException e) {
            log.warn("Unreadable last collection time under {}", metadataKey);
            return Optional.empty();
        } catch (RuntimeException e) {
            log.error("Error reading last collection time: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean saveFetchSession(FetchSession session, Duration ttl) {
        try {
            ObjectNode node = objectMapper.createObjectNode();
            node.put("session_id", session.sessionId());
            node.put("status", session.status().name());
            node.put("started_at", session.startedAt().toEpochMilli());
            node.put("updated_at", session.updatedAt().toEpochMilli());
            node.put("batches_completed", session.batchesCompleted());
            node.put("records_saved", session.recordsSaved());
            ArrayNode ids = node.putArray("entity_ids");
            session.entityIds().forEach(ids::add);
            node.put("last_cursor", session.lastCursor());
            write(sessionKey, objectMapper.writeValueAsString(node), ttl);
            return true;
        } catch (Exception e) {
            log.error("Error storing fetch session {}: {}", session.sessionId(), e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<FetchSession> fetchSession() {
        try {
            String raw = read(sessionKey);
            if (raw == null) {
                return Optional.empty();
            }
            JsonNode node = objectMapper.readTree(raw);
            Set<String> ids = new LinkedHashSet<>();
            node.path("entity_ids").forEach(id -> ids.add(id.asText()));
            JsonNode cursor = node.get("last_cursor");
            return Optional.of(new FetchSession(
                    node.path("session_id").asText(),
                    FetchSession.Status.valueOf(node.path("status").asText()),
                    Instant.ofEpochMilli(node.path("started_at").asLong()),
                    Instant.ofEpochMilli(node.path("updated_at").asLong()),
                    node.path("batches_completed").asInt(),
                    node.path("records_saved").asInt(),
                    ids,
                    cursor == null || cursor.isNull() ? null : cursor.asText()));
        } catch (Exception e) {
            log.warn("Unreadable fetch session under {}: {}", sessionKey, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    private static Map<String, List<JsonNode>> groupByEntity(List<JsonNode> records, String keyField) {
        Map<String, List<JsonNode>> byEntity = new LinkedHashMap<>();
        for (JsonNode record : records) {
            String id = record.path(keyField).asText("");
            if (!id.isBlank()) {
                byEntity.computeIfAbsent(id, k -> new ArrayList<>()).add(record);
            }
        }
        return byEntity;
    }

    static List<JsonNode> merge(List<JsonNode> existing, List<JsonNode> incoming, List<String> identityFields) {
        if (identityFields == null || identityFields.isEmpty()) {
            List<JsonNode> all = new ArrayList<>(existing);
            all.addAll(incoming);
            return all;
        }
        Map<String, JsonNode> byIdentity = new LinkedHashMap<>();
        for (JsonNode record : existing) {
            byIdentity.put(identityOf(record, identityFields), record);
        }
        for (JsonNode record : incoming) {
            byIdentity.put(identityOf(record, identityFields), record);
        }
        return new ArrayList<>(byIdentity.values());
    }

    private static String identityOf(JsonNode record, List<String> identityFields) {
        StringBuilder key = new StringBuilder();
        for (String field : identityFields) {
            key.append(record.path(field).asText("")).append('\u0000');
        }
        return key.toString();
    }

    private List<String> readBatch(List<String> ids) {
        List<String> keys = ids.stream().map(this::keyFor).toList();
        try {
            List<String> values = readAll(keys);
            if (values != null && values.size() == keys.size()) {
                return values;
            }
            log.warn("Batch read of {} returned {} values; reading keys one by one",
                    namespace, values == null ? 0 : values.size());
        } catch (RuntimeException e) {
            log.warn("Batch read of {} failed, reading keys one by one: {}", namespace, e.getMessage());
        }
        List<String> values = new ArrayList<>(keys.size());
        for (String key : keys) {
            try {
                values.add(read(key));
            } catch (RuntimeException e) {
                log.error("Error reading cache entry {}: {}", key, e.getMessage());
                values.add(null);
            }
        }
        return values;
    }

    private Optional<CacheEntry> decode(String entityId, String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(raw);
            JsonNode ts = node.get(FIELD_TIMESTAMP);
            if (ts == null || !ts.canConvertToLong()) {
                log.warn("Cache entry {} has no timestamp", keyFor(entityId));
                return Optional.empty();
            }
            List<JsonNode> payload = new ArrayList<>();
            node.path(FIELD_PAYLOAD).forEach(payload::add);
            return Optional.of(new CacheEntry(entityId, Instant.ofEpochMilli(ts.asLong()), payload));
        } catch (Exception e) {
            log.warn("Unreadable cache entry {}: {}", keyFor(entityId), e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<Long> decodeTimestamp(String entityId, String raw) {
        return decode(entityId, raw).map(entry -> entry.timestamp().toEpochMilli());
    }
}
