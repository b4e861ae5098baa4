package com.propertyintel.leads.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Raw records from one upstream fetch (or mirror read). Replaced wholesale, never mutated.
 *
 * @param records        unmodifiable list of raw provider records
 * @param fetchedAtNanos monotonic stamp used for TTL checks
 * @param fetchedAt      wall-clock stamp for status reporting
 */
public record CacheSnapshot(List<Map<String, Object>> records, long fetchedAtNanos, Instant fetchedAt) {}
