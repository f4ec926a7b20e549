package fr.lapetina.llm.verifier.infrastructure.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * One level of the multi-level cache.
 *
 * <p>Implementations must be thread-safe. A tier whose backend is unavailable
 * reports misses and ignores writes instead of throwing.
 *
 * @param <V> cached value type
 */
public interface CacheTier<V> extends AutoCloseable {

    String name();

    Optional<V> get(String key);

    /**
     * Stores a value.
     *
     * @throws IllegalArgumentException if {@code ttl} is not positive
     */
    void set(String key, V value, Duration ttl);

    /**
     * Remaining lifetime of a live entry. Empty when the tier cannot tell, or the
     * entry never expires; {@link Duration#ZERO} when it is gone.
     */
    default Optional<Duration> remainingTtl(String key) {
        return Optional.empty();
    }

    void delete(String key);

    void clear();

    /**
     * False only for {@link #none()}.
     */
    default boolean isPresent() {
        return true;
    }

    @Override
    default void close() {
    }

    /**
     * The tier used when no distributed cache is configured: every read misses,
     * every write is dropped.
     */
    @SuppressWarnings("unchecked")
    static <V> CacheTier<V> none() {
        return (CacheTier<V>) NoCacheTier.INSTANCE;
    }

    static void requirePositiveTtl(Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive: " + ttl);
        }
    }
}
