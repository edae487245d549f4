package com.resource.guard.lock;

import redis.clients.jedis.UnifiedJedis;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.SetParams;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Redis {@link LeaseStore}: one key per lock holding the owner token, with a {@code PX} expiry.
 *
 * <p>Acquisition is {@code SET key token NX PX ttl}. Release and extension run as Lua scripts
 * that compare the stored token before touching the key, so an expired owner can never delete
 * or prolong a lease that has since been acquired by someone else.</p>
 */
public class RedisLeaseStore implements LeaseStore {

    static final String DELETE_IF_OWNER_SCRIPT =
            "if redis.call('get', KEYS[1]) == ARGV[1] then "
                    + "return redis.call('del', KEYS[1]) "
                    + "else return 0 end";

    static final String EXTEND_IF_OWNER_SCRIPT =
            "if redis.call('get', KEYS[1]) == ARGV[1] then "
                    + "return redis.call('pexpire', KEYS[1], ARGV[2]) "
                    + "else return 0 end";

    private final UnifiedJedis jedis;
    private final String keyPrefix;

    public RedisLeaseStore(UnifiedJedis jedis) {
        this(jedis, "lock:");
    }

    public RedisLeaseStore(UnifiedJedis jedis, String keyPrefix) {
        this.jedis = jedis;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public boolean tryCreate(String name, String ownerToken, Duration ttl) {
        try {
            String reply = jedis.set(key(name), ownerToken, SetParams.setParams().nx().px(ttl.toMillis()));
            return "OK".equals(reply);
        } catch (JedisException e) {
            throw new LeaseStoreException("Failed to create lease for '" + name + "'", e);
        }
    }

    @Override
    public boolean deleteIfOwner(String name, String ownerToken) {
        try {
            Object reply = jedis.eval(DELETE_IF_OWNER_SCRIPT, List.of(key(name)), List.of(ownerToken));
            return isOne(reply);
        } catch (JedisException e) {
            throw new LeaseStoreException("Failed to release lease for '" + name + "'", e);
        }
    }

    @Override
    public boolean extendIfOwner(String name, String ownerToken, Duration ttl) {
        try {
            Object reply = jedis.eval(EXTEND_IF_OWNER_SCRIPT, List.of(key(name)),
                    List.of(ownerToken, Long.toString(ttl.toMillis())));
            return isOne(reply);
        } catch (JedisException e) {
            throw new LeaseStoreException("Failed to extend lease for '" + name + "'", e);
        }
    }

    @Override
    public Optional<String> currentOwner(String name) {
        try {
            return Optional.ofNullable(jedis.get(key(name)));
        } catch (JedisException e) {
            throw new LeaseStoreException("Failed to read lease for '" + name + "'", e);
        }
    }

    private String key(String name) {
        return keyPrefix + name;
    }

    private static boolean isOne(Object reply) {
        return reply instanceof Long && (Long) reply == 1L;
    }
}
