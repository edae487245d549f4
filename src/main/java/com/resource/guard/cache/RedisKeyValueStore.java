package com.resource.guard.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.UnifiedJedis;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.SetParams;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed {@link KeyValueStore} using Jedis. Entries expire through Redis {@code PX}.
 */
public class RedisKeyValueStore implements KeyValueStore {
    private static final Logger log = LoggerFactory.getLogger(RedisKeyValueStore.class);

    private final UnifiedJedis jedis;

    public RedisKeyValueStore(UnifiedJedis jedis) {
        this.jedis = jedis;
    }

    @Override
    public Optional<String> read(String key) {
        try {
            return Optional.ofNullable(jedis.get(key));
        } catch (JedisException e) {
            throw new StoreException("Failed to read key '" + key + "' from Redis", e);
        }
    }

    @Override
    public void write(String key, String value, Duration ttl) {
        try {
            if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                jedis.set(key, value);
            } else {
                jedis.set(key, value, SetParams.setParams().px(ttl.toMillis()));
            }
            log.debug("Stored key {} (ttl={})", key, ttl);
        } catch (JedisException e) {
            throw new StoreException("Failed to write key '" + key + "' to Redis", e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            jedis.del(key);
        } catch (JedisException e) {
            throw new StoreException("Failed to delete key '" + key + "' from Redis", e);
        }
    }
}
