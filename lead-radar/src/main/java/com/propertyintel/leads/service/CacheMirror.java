package com.propertyintel.leads.service;

import java.time.Duration;
import java.util.Optional;

/**
 * Optional shared cache that lets several instances reuse one upstream fetch.
 * Callers treat every failure as a cache miss.
 */
public interface CacheMirror {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);
}
