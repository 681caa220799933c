package com.eventanalytics.pipeline.state;

import com.eventanalytics.pipeline.exception.TransientStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Minute bucket counter backed by Redis.
 * <p>
 * The whole increment runs as one Lua script, so Redis executes it atomically:
 * <ul>
 *   <li>{@code SET key 1 EX ttl NX} creates the bucket with its expiry, otherwise {@code INCR}
 *       bumps it and leaves the expiry alone</li>
 *   <li>{@code SADD key:users user} records the user; a user set without an expiry gets the
 *       bucket's remaining lifetime, so both keys disappear together</li>
 * </ul>
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "pipeline.counter.backend", havingValue = "redis", matchIfMissing = true)
public class RedisMinuteBucketCounter implements MinuteBucketCounter {

    static final RedisScript<Long> INCREMENT_SCRIPT = new DefaultRedisScript<>("""
            local count
            if redis.call('SET', KEYS[1], 1, 'EX', ARGV[2], 'NX') then
                count = 1
            else
                count = redis.call('INCR', KEYS[1])
            end
            local ttl = redis.call('PTTL', KEYS[1])
            if ttl < 0 then
                redis.call('EXPIRE', KEYS[1], ARGV[2])
                ttl = tonumber(ARGV[2]) * 1000
            end
            redis.call('SADD', KEYS[2], ARGV[1])
            if redis.call('PTTL', KEYS[2]) < 0 then
                redis.call('PEXPIRE', KEYS[2], ttl)
            end
            return count
            """, Long.class);

    private final StringRedisTemplate redisTemplate;
    private final long ttlSeconds;

    public RedisMinuteBucketCounter(
            StringRedisTemplate redisTemplate,
            @Value("${pipeline.counter.ttl-seconds:300}") long ttlSeconds
    ) {
        this.redisTemplate = redisTemplate;
        this.ttlSeconds = ttlSeconds;
    }

    @Override
    public long increment(String bucketKey, String userId) {
        try {
            Long count = redisTemplate.execute(
                    INCREMENT_SCRIPT,
                    List.of(bucketKey, MinuteBucketKey.usersKey(bucketKey)),
                    userId,
                    String.valueOf(ttlSeconds)
            );
            log.debug("Incremented minute bucket {} to count {}", bucketKey, count);
            return count != null ? count : 0L;
        } catch (DataAccessException e) {
            throw new TransientStoreException("Failed to update minute bucket " + bucketKey, e);
        }
    }

    @Override
    public long getCount(String bucketKey) {
        try {
            String value = redisTemplate.opsForValue().get(bucketKey);
            return value != null ? Long.parseLong(value) : 0L;
        } catch (DataAccessException e) {
            throw new TransientStoreException("Failed to read minute bucket " + bucketKey, e);
        }
    }

    @Override
    public Set<String> getUsers(String bucketKey) {
        try {
            Set<String> users = redisTemplate.opsForSet().members(MinuteBucketKey.usersKey(bucketKey));
            return users != null ? users : Set.of();
        } catch (DataAccessException e) {
            throw new TransientStoreException("Failed to read users of minute bucket " + bucketKey, e);
        }
    }
}
