package com.tapmap.fountains.infrastructure.cache;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;

/**
 * Redis cache for aggregated cluster rows, shared by every instance.
 *
 * Point pages are never cached: they are bounded by their limit and cheap to
 * fetch, while a world-level aggregate scans the whole table. A cached cluster
 * view can lag behind the store by at most the cluster TTL.
 */
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String CLUSTERS = "clusters";

    private static final String KEY_PREFIX = "tapmap:";

    @Value("${app.cache.cluster-ttl:${CACHE_TTL_SECONDS:600}s}")
    private Duration clusterTtl;

    @Bean
    public CacheManager cacheManager(RedisConnectionFactory redisConnectionFactory) {
        RedisCacheConfiguration defaults = RedisCacheConfiguration.defaultCacheConfig()
            .prefixCacheNameWith(KEY_PREFIX)
            .serializeKeysWith(RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()))
            .serializeValuesWith(RedisSerializationContext.SerializationPair.fromSerializer(new GenericJackson2JsonRedisSerializer()))
            .disableCachingNullValues();

        return RedisCacheManager.builder(redisConnectionFactory)
            .cacheDefaults(defaults)
            .withCacheConfiguration(CLUSTERS, defaults.entryTtl(clusterTtl))
            .disableCreateOnMissingCache()
            .build();
    }
}
