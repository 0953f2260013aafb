package com.example.ttsgateway.service.cache;

import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Duration;
import java.util.Optional;

public class RedisKeyValueStore implements KeyValueStore {

    private final RedisTemplate<byte[], byte[]> redisTemplate;
    private final Duration ttl;

    /**
     * @param ttl entry lifetime, or {@code null} to leave eviction to the server policy
     */
    public RedisKeyValueStore(RedisTemplate<byte[], byte[]> redisTemplate, Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.ttl = ttl;
    }

    @Override
    public Optional<byte[]> get(byte[] key) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(key));
        } catch (DataAccessException ex) {
            throw new CacheUnavailableException("Redis read failed", ex);
        }
    }

    @Override
    public void set(byte[] key, byte[] value) {
        try {
            if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                redisTemplate.opsForValue().set(key, value);
            } else {
                redisTemplate.opsForValue().set(key, value, ttl);
            }
        } catch (DataAccessException ex) {
            throw new CacheUnavailableException("Redis write failed", ex);
        }
    }
}
