package fr.lapetina.llm.verifier.infrastructure.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Fast in-process tier.
 *
 * Guarded by a read/write lock: lookups share the read lock, writes and the
 * expiry sweep take the write lock. Expired entries are invisible to reads
 * and removed by {@link #sweepExpired()}.
 */
public final class InMemoryCacheTier<V> implements CacheTier<V> {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCacheTier.class);
    static final String LEVEL = "L1";

    private final Map<String, CacheItem<V>> items = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;

    public InMemoryCacheTier(Clock clock) {
        this.clock = clock;
    }

    public InMemoryCacheTier() {
        this(Clock.systemUTC());
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public Optional<V> get(String key) {
        return item(key).map(CacheItem::getValue);
    }

    /**
     * Returns the live entry with its access metadata, recording the access.
     */
    public Optional<CacheItem<V>> item(String key) {
        Instant now = clock.instant();
        lock.readLock().lock();
        try {
            CacheItem<V> item = items.get(key);
            if (item == null || item.isExpired(now)) {
                return Optional.empty();
            }
            item.touch(now);
            return Optional.of(item);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void set(String key, V value, Duration ttl) {
        CacheTier.requirePositiveTtl(ttl);
        Instant now = clock.instant();
        CacheItem<V> item = new CacheItem<>(key, value, LEVEL, now, now.plus(ttl));
        lock.writeLock().lock();
        try {
            items.put(key, item);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Duration> remainingTtl(String key) {
        Instant now = clock.instant();
        lock.readLock().lock();
        try {
            CacheItem<V> item = items.get(key);
            if (item == null || item.isExpired(now)) {
                return Optional.of(Duration.ZERO);
            }
            return Optional.of(Duration.between(now, item.getExpiresAt()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void delete(String key) {
        lock.writeLock().lock();
        try {
            items.remove(key);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            items.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes every expired entry.
     *
     * @return number of entries removed
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        int removed = 0;
        lock.writeLock().lock();
        try {
            Iterator<CacheItem<V>> iterator = items.values().iterator();
            while (iterator.hasNext()) {
                if (iterator.next().isExpired(now)) {
                    iterator.remove();
                    removed++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (removed > 0) {
            log.debug("Expired cache entries removed: count={}", removed);
        }
        return removed;
    }

    /**
     * Number of stored entries, expired ones included until the next sweep.
     */
    public int size() {
        lock.readLock().lock();
        try {
            return items.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
