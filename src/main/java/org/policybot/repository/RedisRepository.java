package org.policybot.repository;

import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.List;

/**
 * Redis 上的会话锁和 webhook 去重标记
 */
@Repository
public class RedisRepository {

    private final RedisTemplate<String, Object> redisTemplate;
    private final DefaultRedisScript<Long> releaseLockScript;

    public RedisRepository(RedisTemplate<String, Object> redisTemplate, DefaultRedisScript<Long> releaseLockScript) {
        this.redisTemplate = redisTemplate;
        this.releaseLockScript = releaseLockScript;
    }

    public boolean tryLock(String key, String token, Duration ttl) {
        return Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(key, token, ttl));
    }

    public boolean releaseLock(String key, String token) {
        Long released = redisTemplate.execute(releaseLockScript, List.of(key), token);
        return released != null && released > 0;
    }

    /**
     * 首次写入返回 true，key 已存在返回 false
     */
    public boolean markIfAbsent(String key, String value, Duration ttl) {
        return Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(key, value, ttl));
    }

    public void delete(String key) {
        redisTemplate.delete(key);
    }

    public boolean ping() {
        String pong = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
        return "PONG".equalsIgnoreCase(pong);
    }
}
