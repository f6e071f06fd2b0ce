package com.o2o.analytics.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.o2o.analytics.infrastructure.cache.CacheStore;
import com.o2o.analytics.infrastructure.cache.LocalCacheStore;
import com.o2o.analytics.infrastructure.cache.RedisCacheStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Clock;

/**
 * Engine wiring: clock and the cache store selected by {@code o2o.engine.cache.store}.
 */
@Slf4j
@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Caffeine store, bounded by {@code o2o.engine.cache.max-entries}. Default.
     */
    @Bean
    @ConditionalOnProperty(prefix = "o2o.engine.cache", name = "store", havingValue = "local", matchIfMissing = true)
    public CacheStore localCacheStore(EngineProperties properties, Clock clock) {
        log.info("Query cache store: local (max {} entries)", properties.getCache().getMaxEntries());
        return new LocalCacheStore(properties.getCache().getMaxEntries(), clock);
    }

    /**
     * Redis store shared by every instance, guarded by the "redis" circuit breaker.
     */
    @Bean
    @ConditionalOnProperty(prefix = "o2o.engine.cache", name = "store", havingValue = "redis")
    public CacheStore redisCacheStore(RedisTemplate<String, String> redisTemplate, ObjectMapper objectMapper,
                                      EngineProperties properties, Clock clock) {
        log.info("Query cache store: redis");
        return new RedisCacheStore(redisTemplate, objectMapper, clock, properties.getCache().getKeyPrefix());
    }
}
