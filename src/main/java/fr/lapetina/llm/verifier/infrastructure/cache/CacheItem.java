package fr.lapetina.llm.verifier.infrastructure.cache;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry of the in-process tier. Value and expiry are fixed at creation;
 * access metadata is updated atomically under the tier's read lock.
 */
public final class CacheItem<V> {

    private final String key;
    private final V value;
    private final String level;
    private final Instant createdAt;
    private final Instant expiresAt;
    private final AtomicLong accessCount = new AtomicLong();
    private volatile Instant lastAccess;

    CacheItem(String key, V value, String level, Instant createdAt, Instant expiresAt) {
        if (!expiresAt.isAfter(createdAt)) {
            throw new IllegalArgumentException("Cache item must expire in the future: key=" + key);
        }
        this.key = key;
        this.value = value;
        this.level = level;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        this.lastAccess = createdAt;
    }

    void touch(Instant now) {
        accessCount.incrementAndGet();
        lastAccess = now;
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public String getKey() {
        return key;
    }

    public V getValue() {
        return value;
    }

    public String getLevel() {
        return level;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public long getAccessCount() {
        return accessCount.get();
    }

    public Instant getLastAccess() {
        return lastAccess;
    }

    @Override
    public String toString() {
        return "CacheItem{key='" + key + "', level=" + level + ", expiresAt=" + expiresAt
                + ", accessCount=" + accessCount.get() + '}';
    }
}
