package com.flagship.debt_ledger.repayment;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Redis-backed repayment log storage.
 *
 * Enabled with {@code debt.repayment-log.storage=redis}. The document is a
 * plain string value without expiry. Connection failures surface as
 * {@code RedisConnectionFailureException} and are not retried here.
 */
@Component
@ConditionalOnProperty(name = "debt.repayment-log.storage", havingValue = "redis")
@Slf4j
public class RedisRepaymentLogStorage implements RepaymentLogStorage {

    private static final String REDIS_KEY_PREFIX = "debt-ledger:";

    private final StringRedisTemplate redisTemplate;

    public RedisRepaymentLogStorage(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Optional<String> read(String key) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(REDIS_KEY_PREFIX + key));
    }

    @Override
    public void write(String key, String document) {
        redisTemplate.opsForValue().set(REDIS_KEY_PREFIX + key, document);
        log.debug("Stored document in Redis under key {}", key);
    }

    @Override
    public void delete(String key) {
        redisTemplate.delete(REDIS_KEY_PREFIX + key);
    }
}
