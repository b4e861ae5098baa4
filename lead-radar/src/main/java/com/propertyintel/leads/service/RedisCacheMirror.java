package com.propertyintel.leads.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed {@link CacheMirror}. Registered only when
 * {@code lead-radar.cache.backend=redis}; otherwise the cache is memory-only.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "lead-radar.cache", name = "backend", havingValue = "redis")
public class RedisCacheMirror implements CacheMirror {

    private final StringRedisTemplate redis;

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redis.opsForValue().get(key));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        redis.opsForValue().set(key, value, ttl);
        log.debug("Mirrored {} chars to redis key {} (ttl={}s)", value.length(), key, ttl.toSeconds());
    }
}
