package com.loanorigination.config;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.jsontype.BasicPolymorphicTypeValidator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Redis configuration for caching and consumer idempotency.
 *
 * CACHE REGIONS:
 * ==============
 * - applications: CreditApplication by "{tenantId}:{applicationId}", evicted on
 *   every lifecycle change (lending.cache.applications-ttl, default 30 min)
 * - products: Product pricing and bounds by "{tenantId}:{productId}"
 *   (lending.cache.products-ttl, default 1 hour)
 *
 * Idempotency keys are written through {@link RedisTemplate} with their own
 * 7-day TTL (see IdempotencyService).
 *
 * The JSON mapper used here embeds type information so cached entities come
 * back as entities. It stays out of the context so Spring MVC keeps Boot's
 * own ObjectMapper.
 */
@Configuration
@EnableCaching
@Slf4j
public class RedisConfig {

    public static final String APPLICATIONS_CACHE = "applications";
    public static final String PRODUCTS_CACHE = "products";

    static ObjectMapper redisObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.activateDefaultTyping(
                BasicPolymorphicTypeValidator.builder()
                        .allowIfBaseType(Object.class)
                        .build(),
                ObjectMapper.DefaultTyping.NON_FINAL,
                JsonTypeInfo.As.PROPERTY);
        return mapper;
    }

    @Bean
    public RedisTemplate<String, Object> redisTemplate(RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, Object> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);

        StringRedisSerializer stringSerializer = new StringRedisSerializer();
        template.setKeySerializer(stringSerializer);
        template.setHashKeySerializer(stringSerializer);

        GenericJackson2JsonRedisSerializer jsonSerializer =
            new GenericJackson2JsonRedisSerializer(redisObjectMapper());
        template.setValueSerializer(jsonSerializer);
        template.setHashValueSerializer(jsonSerializer);

        template.afterPropertiesSet();
        return template;
    }

    @Bean
    public CacheManager cacheManager(
            RedisConnectionFactory connectionFactory,
            @Value("${lending.cache.applications-ttl:PT30M}") Duration applicationsTtl,
            @Value("${lending.cache.products-ttl:PT1H}") Duration productsTtl) {

        RedisCacheConfiguration defaults = region(applicationsTtl, "loan-origination:");

        Map<String, RedisCacheConfiguration> regions = new HashMap<>();
        regions.put(APPLICATIONS_CACHE, region(applicationsTtl, "app:"));
        regions.put(PRODUCTS_CACHE, region(productsTtl, "product:"));

        log.info("Cache regions: {} ({}), {} ({})",
                APPLICATIONS_CACHE, applicationsTtl, PRODUCTS_CACHE, productsTtl);

        return RedisCacheManager.builder(connectionFactory)
            .cacheDefaults(defaults)
            .withInitialCacheConfigurations(regions)
            .transactionAware()
            .build();
    }

    private static RedisCacheConfiguration region(Duration ttl, String prefix) {
        return RedisCacheConfiguration.defaultCacheConfig()
            .entryTtl(ttl)
            .prefixCacheNameWith(prefix)
            .disableCachingNullValues()
            .serializeKeysWith(
                RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()))
            .serializeValuesWith(
                RedisSerializationContext.SerializationPair.fromSerializer(
                    new GenericJackson2JsonRedisSerializer(redisObjectMapper())));
    }
}
