package com.annograph.caching.store;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Set;

public class RedisCacheStore implements CacheStore {

    static final RedisScript<Long> DELETE_IF_VALUE = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class
    );

    private final StringRedisTemplate redisTemplate;
    private final MeterRegistry meterRegistry;
    private final boolean patternDeleteEnabled;

    public RedisCacheStore(StringRedisTemplate redisTemplate, MeterRegistry meterRegistry, boolean patternDeleteEnabled) {
        this.redisTemplate = redisTemplate;
        this.meterRegistry = meterRegistry;
        this.patternDeleteEnabled = patternDeleteEnabled;
    }

    @Override
    public String get(String key) {
        String value;
        try {
            value = redisTemplate.opsForValue().get(key);
        } catch (DataAccessException ex) {
            throw new CacheBackendException("redis get failed for " + key, ex);
        }
        if (value == null) {
            incrementCounter("cache_miss_count_total");
        } else {
            incrementCounter("cache_hit_count_total");
        }
        return value;
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(key, value, ttl);
        } catch (DataAccessException ex) {
            throw new CacheBackendException("redis set failed for " + key, ex);
        }
    }

    @Override
    public boolean putIfAbsent(String key, String value, Duration ttl) {
        try {
            return Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(key, value, ttl));
        } catch (DataAccessException ex) {
            throw new CacheBackendException("redis setIfAbsent failed for " + key, ex);
        }
    }

    @Override
    public long delete(Collection<String> keys) {
        if (keys == null || keys.isEmpty()) {
            return 0L;
        }
        try {
            Long deleted = redisTemplate.delete(keys);
            return deleted == null ? 0L : deleted;
        } catch (DataAccessException ex) {
            throw new CacheBackendException("redis delete failed for " + keys.size() + " keys", ex);
        }
    }

    @Override
    public boolean deleteIfValue(String key, String expected) {
        try {
            Long deleted = redisTemplate.execute(DELETE_IF_VALUE, List.of(key), expected);
            return deleted != null && deleted > 0;
        } catch (DataAccessException ex) {
            throw new CacheBackendException("redis compare-and-delete failed for " + key, ex);
        }
    }

    @Override
    public long increment(String counterKey) {
        try {
            Long value = redisTemplate.opsForValue().increment(counterKey);
            return value == null ? 0L : value;
        } catch (DataAccessException ex) {
            throw new CacheBackendException("redis incr failed for " + counterKey, ex);
        }
    }

    @Override
    public long counter(String counterKey) {
        String value;
        try {
            value = redisTemplate.opsForValue().get(counterKey);
        } catch (DataAccessException ex) {
            throw new CacheBackendException("redis get failed for " + counterKey, ex);
        }
        if (value == null) {
            return 0L;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException ex) {
            throw new CacheBackendException("counter " + counterKey + " holds a non-numeric value", ex);
        }
    }

    @Override
    public void addToSet(String setKey, String member, Duration ttl) {
        try {
            redisTemplate.opsForSet().add(setKey, member);
            redisTemplate.expire(setKey, ttl);
        } catch (DataAccessException ex) {
            throw new CacheBackendException("redis sadd failed for " + setKey, ex);
        }
    }

    @Override
    public Set<String> members(String setKey) {
        try {
            Set<String> members = redisTemplate.opsForSet().members(setKey);
            return members == null ? Set.of() : members;
        } catch (DataAccessException ex) {
            throw new CacheBackendException("redis smembers failed for " + setKey, ex);
        }
    }

    @Override
    public boolean supportsPatternDelete() {
        return patternDeleteEnabled;
    }

    @Override
    public long deleteByPattern(String pattern) {
        if (!patternDeleteEnabled) {
            throw new UnsupportedOperationException("pattern delete disabled for this redis deployment");
        }
        try {
            Set<String> keys = redisTemplate.keys(pattern);
            if (keys == null || keys.isEmpty()) {
                return 0L;
            }
            Long deleted = redisTemplate.delete(keys);
            return deleted == null ? 0L : deleted;
        } catch (DataAccessException ex) {
            throw new CacheBackendException("redis pattern delete failed for " + pattern, ex);
        }
    }

    private void incrementCounter(String metricName) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.counter(metricName).increment();
    }
}
