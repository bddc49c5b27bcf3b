package com.atomicswap.config;

import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis configuration. Redis only holds short-lived acknowledgement receipts; the order
 * book itself lives in the relational store.
 *
 * <p>Key schema:
 * <pre>
 *   swap:ack:seen:{sequence}   → outcome of an already-processed acknowledgement (TTL)
 * </pre>
 */
@Configuration
public class RedisConfig {

    /** Global prefix for all keys on a shared Redis server. */
    public static final String KEY_PREFIX = "swap:";

    public static final String KEY_PREFIX_ACK_SEEN = KEY_PREFIX + "ack:seen:";

    public static final Duration DEFAULT_TTL = Duration.ofHours(24);

    @Bean
    public RedisTemplate<String, Object> redisTemplate(RedisConnectionFactory redisConnectionFactory) {
        RedisTemplate<String, Object> redisTemplate = new RedisTemplate<>();
        redisTemplate.setConnectionFactory(redisConnectionFactory);

        StringRedisSerializer stringRedisSerializer = new StringRedisSerializer();
        GenericJackson2JsonRedisSerializer jsonRedisSerializer = new GenericJackson2JsonRedisSerializer();

        redisTemplate.setKeySerializer(stringRedisSerializer);
        redisTemplate.setValueSerializer(jsonRedisSerializer);
        redisTemplate.setHashKeySerializer(stringRedisSerializer);
        redisTemplate.setHashValueSerializer(jsonRedisSerializer);

        return redisTemplate;
    }
}
