package org.policybot.service;

import org.policybot.config.RagProperties;
import org.policybot.exception.CustomException;
import org.policybot.exception.ErrorKind;
import org.policybot.repository.RedisRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * 同一会话的请求串行执行，避免消息计数和摘要被并发覆盖
 */
@Service
public class SessionLockService {

    private static final Logger logger = LoggerFactory.getLogger(SessionLockService.class);

    private static final long RETRY_INTERVAL_MILLIS = 100;

    private final RedisRepository redisRepository;
    private final RagProperties ragProperties;

    public SessionLockService(RedisRepository redisRepository, RagProperties ragProperties) {
        this.redisRepository = redisRepository;
        this.ragProperties = ragProperties;
    }

    public static String lockKey(String chatId) {
        return "lock:chat:" + chatId;
    }

    /**
     * @throws CustomException SESSION，等待超时仍拿不到锁
     */
    public <T> T withLock(String chatId, Supplier<T> work) {
        String key = lockKey(chatId);
        String token = UUID.randomUUID().toString();
        acquire(key, token);
        try {
            return work.get();
        } finally {
            if (!redisRepository.releaseLock(key, token)) {
                logger.warn("会话锁已过期或被他人持有 => chatId: {}", chatId);
            }
        }
    }

    private void acquire(String key, String token) {
        Duration ttl = Duration.ofSeconds(ragProperties.getSessionLockTtlSeconds());
        long deadline = System.currentTimeMillis() + ragProperties.getSessionLockWaitMillis();
        while (!redisRepository.tryLock(key, token, ttl)) {
            if (System.currentTimeMillis() >= deadline) {
                throw new CustomException("会话正忙，请稍后再试", ErrorKind.SESSION, HttpStatus.CONFLICT);
            }
            try {
                Thread.sleep(RETRY_INTERVAL_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CustomException("等待会话锁被中断", ErrorKind.SESSION, HttpStatus.CONFLICT, e);
            }
        }
    }
}
