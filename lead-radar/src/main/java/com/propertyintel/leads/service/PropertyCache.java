package com.propertyintel.leads.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertyintel.leads.config.LeadRadarProperties;
import com.propertyintel.leads.model.CacheSnapshot;
import com.propertyintel.leads.model.CacheStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Holds the raw Realie snapshot behind a TTL.
 *
 * Reads of a fresh snapshot never lock. A stale or missing snapshot is reloaded
 * under a single lock with a re-check, so concurrent misses collapse into one
 * upstream fetch. When a {@link CacheMirror} is configured it is tried before the
 * upstream source and written after every fetch; mirror failures only cost a miss.
 */
@Service
@Slf4j
public class PropertyCache {

    private static final TypeReference<List<Map<String, Object>>> RECORD_LIST = new TypeReference<>() {};

    private final RawPropertySource source;
    private final ObjectMapper objectMapper;
    private final CacheMirror mirror;
    private final int maxRecords;
    private final Duration ttl;
    private final String mirrorKey;
    private final LongSupplier nanoTime;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private volatile CacheSnapshot snapshot;

    @Autowired
    public PropertyCache(RawPropertySource source,
                         LeadRadarProperties properties,
                         ObjectMapper objectMapper,
                         Optional<CacheMirror> mirror,
                         Clock clock) {
        this(source, objectMapper, mirror.orElse(null),
                properties.getMaxProperties(),
                Duration.ofSeconds(properties.getCache().getTtlSeconds()),
                properties.getCache().getNamespace(),
                System::nanoTime,
                clock);
    }

    PropertyCache(RawPropertySource source,
                  ObjectMapper objectMapper,
                  CacheMirror mirror,
                  int maxRecords,
                  Duration ttl,
                  String namespace,
                  LongSupplier nanoTime,
                  Clock clock) {
        this.source = source;
        this.objectMapper = objectMapper;
        this.mirror = mirror;
        this.maxRecords = maxRecords;
        this.ttl = ttl;
        this.mirrorKey = namespace + ":properties";
        this.nanoTime = nanoTime;
        this.clock = clock;

        if (mirror != null) {
            log.info("Cache mirror enabled (key={})", mirrorKey);
        } else {
            log.info("Cache mirror not configured; using memory cache only");
        }
    }

    /**
     * Return the current raw snapshot, reloading it when stale, missing or forced.
     * Within one TTL window every call returns the same list instance.
     *
     * @throws RuntimeException whatever the upstream source throws on a failed fetch
     */
    public List<Map<String, Object>> get(boolean forceRefresh) {
        CacheSnapshot current = snapshot;
        if (!forceRefresh && isFresh(current)) {
            return current.records();
        }

        lock.lock();
        try {
            current = snapshot;
            if (!forceRefresh && isFresh(current)) {
                return current.records();
            }

            if (!forceRefresh && mirror != null) {
                List<Map<String, Object>> mirrored = readMirror();
                if (mirrored != null) {
                    snapshot = stamp(mirrored);
                    log.debug("Loaded {} properties from cache mirror", mirrored.size());
                    return snapshot.records();
                }
            }

            List<Map<String, Object>> fetched = source.fetchAll(maxRecords);
            CacheSnapshot fresh = stamp(cap(fetched));
            snapshot = fresh;
            writeMirror(fresh.records());
            log.info("Fetched {} properties from upstream source", fresh.records().size());
            return fresh.records();
        } finally {
            lock.unlock();
        }
    }

    public List<Map<String, Object>> get() {
        return get(false);
    }

    /** Forced reload from the upstream source, bypassing the mirror. */
    public void refresh() {
        get(true);
    }

    public CacheStatus status() {
        CacheSnapshot current = snapshot;
        if (current == null) {
            return new CacheStatus(0, null, null, ttl.toSeconds(), false, mirror != null);
        }
        long ageSeconds = TimeUnit.NANOSECONDS.toSeconds(nanoTime.getAsLong() - current.fetchedAtNanos());
        return new CacheStatus(current.records().size(), current.fetchedAt(), ageSeconds,
                ttl.toSeconds(), isFresh(current), mirror != null);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private boolean isFresh(CacheSnapshot current) {
        return current != null && nanoTime.getAsLong() - current.fetchedAtNanos() < ttl.toNanos();
    }

    private CacheSnapshot stamp(List<Map<String, Object>> records) {
        return new CacheSnapshot(Collections.unmodifiableList(new ArrayList<>(records)),
                nanoTime.getAsLong(), clock.instant());
    }

    private List<Map<String, Object>> cap(List<Map<String, Object>> fetched) {
        if (fetched == null) return List.of();
        if (fetched.size() <= maxRecords) return fetched;
        log.warn("Upstream returned {} records, truncating to {}", fetched.size(), maxRecords);
        return fetched.subList(0, maxRecords);
    }

    private List<Map<String, Object>> readMirror() {
        try {
            Optional<String> payload = mirror.get(mirrorKey);
            if (payload.isEmpty() || payload.get().isBlank()) {
                return null;
            }
            JsonNode root = objectMapper.readTree(payload.get());
            if (!root.isArray()) {
                log.warn("Unexpected cache mirror payload type {}; ignoring", root.getNodeType());
                return null;
            }
            for (JsonNode element : root) {
                if (!element.isObject()) {
                    log.warn("Cache mirror payload holds a {} element; ignoring", element.getNodeType());
                    return null;
                }
            }
            return objectMapper.convertValue(root, RECORD_LIST);
        } catch (Exception e) {
            log.warn("Unable to read property cache from mirror: {}", e.getMessage(), e);
            return null;
        }
    }

    private void writeMirror(List<Map<String, Object>> records) {
        if (mirror == null) return;
        try {
            Duration mirrorTtl = Duration.ofSeconds(Math.max(1, ttl.toSeconds() * 2));
            mirror.set(mirrorKey, objectMapper.writeValueAsString(records), mirrorTtl);
        } catch (Exception e) {
            log.error("Failed to persist property cache to mirror: {}", e.getMessage(), e);
        }
    }
}
