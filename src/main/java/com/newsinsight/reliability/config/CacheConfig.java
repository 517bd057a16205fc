package com.newsinsight.reliability.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.newsinsight.reliability.cache.TimeAwareCache;
import com.newsinsight.reliability.service.SourceRef;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Clock;
import java.util.List;
import java.util.Set;

/**
 * Cache backends for the time-aware cache.
 *
 * Caffeine by default; Redis when {@code reliability.cache.store=redis}. Redis values use JDK
 * serialization, so cached types are {@link java.io.Serializable}.
 */
@Configuration
@EnableCaching
@Slf4j
public class CacheConfig {

    public static final String SOURCE_LOOKUPS = "sourceLookups";

    @Value("${spring.application.name:reliability-service}")
    private String applicationName;

    @Bean
    @ConditionalOnProperty(name = "reliability.cache.store", havingValue = "caffeine", matchIfMissing = true)
    public CacheManager caffeineCacheManager(ReliabilityProperties properties) {
        ReliabilityProperties.Cache cache = properties.getCache();
        CaffeineCacheManager cacheManager = new CaffeineCacheManager();
        cacheManager.setCaffeine(Caffeine.newBuilder()
                .maximumSize(cache.getLocalMaxSize())
                .expireAfterWrite(cache.getSourceLookupTtl())
                .recordStats());
        cacheManager.setCacheNames(List.of(SOURCE_LOOKUPS));
        log.info("Caffeine cache manager initialized: maxSize={}, ttl={}",
                cache.getLocalMaxSize(), cache.getSourceLookupTtl());
        return cacheManager;
    }

    @Bean
    @ConditionalOnProperty(name = "reliability.cache.store", havingValue = "redis")
    public CacheManager redisCacheManager(RedisConnectionFactory connectionFactory, ReliabilityProperties properties) {
        String keyPrefix = applicationName + ":cache:";
        RedisCacheConfiguration defaultConfig = RedisCacheConfiguration.defaultCacheConfig()
                .entryTtl(properties.getCache().getSourceLookupTtl())
                .prefixCacheNameWith(keyPrefix)
                .serializeKeysWith(RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()))
                .disableCachingNullValues();

        RedisCacheManager cacheManager = RedisCacheManager.builder(connectionFactory)
                .cacheDefaults(defaultConfig)
                .initialCacheNames(Set.of(SOURCE_LOOKUPS))
                .enableStatistics()
                .build();
        log.info("Redis cache manager initialized with prefix: {}", keyPrefix);
        return cacheManager;
    }

    @Bean
    public TimeAwareCache<SourceRef> sourceLookupCache(CacheManager cacheManager, ReliabilityProperties properties,
                                                      Clock clock) {
        Cache store = cacheManager.getCache(SOURCE_LOOKUPS);
        if (store == null) {
            throw new IllegalStateException("Cache '" + SOURCE_LOOKUPS + "' is not configured");
        }
        return new TimeAwareCache<>(store, properties.getCache().getSourceLookupTtl(), clock);
    }
}
