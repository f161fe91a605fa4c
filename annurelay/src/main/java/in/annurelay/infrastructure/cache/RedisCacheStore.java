package in.annurelay.infrastructure.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.Protocol;
import redis.clients.jedis.Transaction;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Redis-backed cache. Each value is a hash written together with its expiry in one MULTI.
 */
public final class RedisCacheStore implements CacheStore {
    private static final Logger log = LoggerFactory.getLogger(RedisCacheStore.class);
    private static final int SCAN_BATCH = 500;

    private final JedisPool jedisPool;

    public RedisCacheStore(String host, int port, String password, int database) {
        JedisPoolConfig poolConfig = new JedisPoolConfig();
        poolConfig.setMaxTotal(16);
        poolConfig.setTestOnBorrow(true);
        this.jedisPool = new JedisPool(poolConfig, host, port, Protocol.DEFAULT_TIMEOUT, password, database);
        log.info("[CACHE] Redis pool created for {}:{} db={}", host, port, database);
    }

    /**
     * Fail fast at startup when Redis is unreachable.
     */
    public void ping() {
        try (Jedis jedis = jedisPool.getResource()) {
            String pong = jedis.ping();
            if (!"PONG".equals(pong)) {
                throw new CacheStoreException("PING", "Unexpected ping reply: " + pong, null);
            }
            log.info("[CACHE] ✓ Redis reachable");
        } catch (JedisException e) {
            throw new CacheStoreException("PING", "Redis unreachable", e);
        }
    }

    @Override
    public void setWithTtl(String key, Map<String, String> fields, long ttlSeconds) {
        try (Jedis jedis = jedisPool.getResource()) {
            Transaction tx = jedis.multi();
            tx.del(key);
            if (!fields.isEmpty()) {
                tx.hset(key, fields);
                tx.expire(key, ttlSeconds);
            }
            tx.exec();
        } catch (JedisException e) {
            throw new CacheStoreException(key, "Redis write failed", e);
        }
    }

    @Override
    public Optional<Map<String, String>> get(String key) {
        try (Jedis jedis = jedisPool.getResource()) {
            Map<String, String> value = jedis.hgetAll(key);
            return value == null || value.isEmpty() ? Optional.empty() : Optional.of(value);
        } catch (JedisException e) {
            throw new CacheStoreException(key, "Redis read failed", e);
        }
    }

    @Override
    public Set<String> scan(String pattern) {
        Set<String> keys = new LinkedHashSet<>();
        ScanParams params = new ScanParams().match(pattern).count(SCAN_BATCH);
        try (Jedis jedis = jedisPool.getResource()) {
            String cursor = ScanParams.SCAN_POINTER_START;
            do {
                ScanResult<String> page = jedis.scan(cursor, params);
                keys.addAll(page.getResult());
                cursor = page.getCursor();
            } while (!ScanParams.SCAN_POINTER_START.equals(cursor));
            return keys;
        } catch (JedisException e) {
            throw new CacheStoreException(pattern, "Redis scan failed", e);
        }
    }

    @Override
    public void close() {
        jedisPool.close();
        log.info("[CACHE] Redis pool closed");
    }
}
