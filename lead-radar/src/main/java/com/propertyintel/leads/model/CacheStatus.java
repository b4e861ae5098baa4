package com.propertyintel.leads.model;

import java.time.Instant;

public record CacheStatus(
        int recordCount,
        Instant fetchedAt,
        Long ageSeconds,
        long ttlSeconds,
        boolean fresh,
        boolean mirrorEnabled) {}
