package com.annograph.caching.config;

import com.annograph.caching.lease.LeaseMutex;
import com.annograph.caching.store.CacheStore;
import com.annograph.caching.store.InMemoryCacheStore;
import com.annograph.caching.store.RedisCacheStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

@Configuration
public class CacheStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(CacheStoreConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "annograph.cache.backend", havingValue = "redis")
    public CacheStore redisCacheStore(
            RedisConnectionFactory connectionFactory,
            ObjectProvider<MeterRegistry> meterRegistry,
            @Value("${annograph.cache.redis.pattern-delete:true}") boolean patternDeleteEnabled
    ) {
        log.info("cache backend initialized backend=redis pattern_delete={}", patternDeleteEnabled);
        return new RedisCacheStore(
                new StringRedisTemplate(connectionFactory),
                meterRegistry.getIfAvailable(),
                patternDeleteEnabled
        );
    }

    @Bean
    @ConditionalOnProperty(name = "annograph.cache.backend", havingValue = "memory", matchIfMissing = true)
    public CacheStore inMemoryCacheStore(
            Clock clock,
            @Value("${annograph.cache.max-entries:50000}") int maxEntries
    ) {
        log.info("cache backend initialized backend=memory max_entries={}", maxEntries);
        return new InMemoryCacheStore(clock, maxEntries);
    }

    @Bean
    public LeaseMutex leaseMutex(CacheStore cacheStore, Clock clock) {
        return new LeaseMutex(cacheStore, clock);
    }
}
