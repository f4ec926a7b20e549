package fr.lapetina.llm.verifier.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.llm.verifier.infrastructure.config.VerifierConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Distributed tier backed by Redis.
 *
 * Values are stored as JSON under {@code keyPrefix + key} with a millisecond TTL.
 * Every Redis or serialization failure is logged and turned into a miss or a
 * dropped write, so an unavailable server never fails the caller.
 */
public final class RedisCacheTier<V> implements CacheTier<V> {

    private static final Logger log = LoggerFactory.getLogger(RedisCacheTier.class);
    private static final int SCAN_BATCH = 500;

    private final JedisPool pool;
    private final ObjectMapper objectMapper;
    private final Class<V> valueType;
    private final String keyPrefix;

    public RedisCacheTier(JedisPool pool, ObjectMapper objectMapper, Class<V> valueType, String keyPrefix) {
        this.pool = pool;
        this.objectMapper = objectMapper;
        this.valueType = valueType;
        this.keyPrefix = keyPrefix != null ? keyPrefix : "";
    }

    /**
     * Creates a tier with its own connection pool from configuration.
     */
    public static <V> RedisCacheTier<V> create(
            VerifierConfig.RedisConfig config,
            ObjectMapper objectMapper,
            Class<V> valueType,
            String namespace
    ) {
        String password = config.getPassword() == null || config.getPassword().isBlank()
                ? null
                : config.getPassword();
        JedisPool pool = new JedisPool(new JedisPoolConfig(), config.getHost(), config.getPort(),
                config.getTimeoutMs(), password, config.getDatabase());
        log.info("Redis cache tier configured: host={}, port={}, database={}, namespace={}",
                config.getHost(), config.getPort(), config.getDatabase(), namespace);
        return new RedisCacheTier<>(pool, objectMapper, valueType, config.getKeyPrefix() + namespace + ":");
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public Optional<V> get(String key) {
        try (Jedis jedis = pool.getResource()) {
            String json = jedis.get(keyPrefix + key);
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, valueType));
        } catch (JedisException e) {
            log.warn("Redis get failed, treating as miss: key={}, error={}", key, e.getMessage());
        } catch (JsonProcessingException e) {
            log.warn("Redis value not decodable, treating as miss: key={}, error={}", key, e.getOriginalMessage());
        }
        return Optional.empty();
    }

    @Override
    public void set(String key, V value, Duration ttl) {
        CacheTier.requirePositiveTtl(ttl);
        try (Jedis jedis = pool.getResource()) {
            jedis.psetex(keyPrefix + key, ttl.toMillis(), objectMapper.writeValueAsString(value));
        } catch (JedisException e) {
            log.warn("Redis set failed: key={}, error={}", key, e.getMessage());
        } catch (JsonProcessingException e) {
            log.warn("Redis value not encodable: key={}, error={}", key, e.getOriginalMessage());
        }
    }

    /**
     * Reads {@code PTTL}: -2 means the key is gone, -1 that it has no expiry.
     */
    @Override
    public Optional<Duration> remainingTtl(String key) {
        try (Jedis jedis = pool.getResource()) {
            long millis = jedis.pttl(keyPrefix + key);
            if (millis == -2) {
                return Optional.of(Duration.ZERO);
            }
            return millis < 0 ? Optional.empty() : Optional.of(Duration.ofMillis(millis));
        } catch (JedisException e) {
            log.warn("Redis pttl failed: key={}, error={}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void delete(String key) {
        try (Jedis jedis = pool.getResource()) {
            jedis.del(keyPrefix + key);
        } catch (JedisException e) {
            log.warn("Redis delete failed: key={}, error={}", key, e.getMessage());
        }
    }

    /**
     * Deletes every key under this tier's prefix.
     */
    @Override
    public void clear() {
        ScanParams params = new ScanParams().match(keyPrefix + "*").count(SCAN_BATCH);
        String cursor = ScanParams.SCAN_POINTER_START;
        int deleted = 0;
        try (Jedis jedis = pool.getResource()) {
            do {
                ScanResult<String> page = jedis.scan(cursor, params);
                List<String> keys = page.getResult();
                if (!keys.isEmpty()) {
                    deleted += (int) jedis.del(keys.toArray(new String[0]));
                }
                cursor = page.getCursor();
            } while (!ScanParams.SCAN_POINTER_START.equals(cursor));
            log.debug("Redis cache cleared: prefix={}, deleted={}", keyPrefix, deleted);
        } catch (JedisException e) {
            log.warn("Redis clear failed: prefix={}, error={}", keyPrefix, e.getMessage());
        }
    }

    @Override
    public void close() {
        try {
            pool.close();
        } catch (JedisException e) {
            log.warn("Error closing Redis pool", e);
        }
    }
}
