package com.interfaceagent.orchestrator.event;

import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * {@link DedupStore} on Redis: {@code SET key 1 NX EX ttl}. Keys are namespaced
 * with {@code interface-agent:} so the instance can be shared.
 */
@Component
public class RedisDedupStore implements DedupStore {

    static final String NAMESPACE = "interface-agent:";

    private final StringRedisTemplate redis;

    public RedisDedupStore(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public boolean markIfAbsent(String key, Duration ttl) {
        try {
            return Boolean.TRUE.equals(redis.opsForValue().setIfAbsent(NAMESPACE + key, "1", ttl));
        } catch (DataAccessException e) {
            throw unavailable("SET NX " + key, e);
        }
    }

    @Override
    public boolean contains(String key) {
        try {
            return Boolean.TRUE.equals(redis.hasKey(NAMESPACE + key));
        } catch (DataAccessException e) {
            throw unavailable("EXISTS " + key, e);
        }
    }

    @Override
    public void remove(String key) {
        try {
            redis.delete(NAMESPACE + key);
        } catch (DataAccessException e) {
            throw unavailable("DEL " + key, e);
        }
    }

    private static EventBusException unavailable(String op, DataAccessException e) {
        return new EventBusException(EventBusException.Kind.DEDUP_STORE_UNAVAILABLE,
                "Redis " + op + " failed: " + e.getMessage(), e);
    }
}
