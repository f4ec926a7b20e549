package fr.lapetina.llm.verifier.infrastructure.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Two-tier cache: a fast in-process tier in front of an optional distributed tier.
 *
 * <ul>
 *   <li>Reads check the fast tier, then the distributed tier; a distributed hit is
 *       promoted into the fast tier for its remaining lifetime, capped at the default TTL</li>
 *   <li>Writes always go to the fast tier and best-effort to the distributed tier</li>
 *   <li>Delete and clear apply to both tiers</li>
 *   <li>A background sweep removes expired fast-tier entries</li>
 * </ul>
 *
 * Distributed tier failures are logged and never reach the caller.
 * When disabled, every read misses and writes are ignored.
 */
public final class MultiLevelCache<V> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MultiLevelCache.class);

    private final String name;
    private final InMemoryCacheTier<V> local;
    private final CacheTier<V> distributed;
    private final Duration defaultTtl;
    private final Duration cleanupInterval;
    private final boolean enabled;
    private final Clock clock;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private volatile Instant lastCleanup;

    private final ScheduledExecutorService sweeper;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private MultiLevelCache(Builder<V> builder) {
        this.name = builder.name;
        this.clock = builder.clock;
        this.local = new InMemoryCacheTier<>(builder.clock);
        this.distributed = builder.distributed;
        this.defaultTtl = builder.defaultTtl;
        this.cleanupInterval = builder.cleanupInterval;
        this.enabled = builder.enabled;
        this.sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cache-sweeper-" + builder.name);
            t.setDaemon(true);
            return t;
        });
        log.info("MultiLevelCache created: name={}, enabled={}, distributedTier={}, defaultTtl={}",
                name, enabled, distributed.name(), defaultTtl);
    }

    /**
     * Starts the periodic expiry sweep.
     */
    public MultiLevelCache<V> start() {
        if (enabled && running.compareAndSet(false, true)) {
            sweeper.scheduleWithFixedDelay(
                    this::sweep,
                    cleanupInterval.toMillis(),
                    cleanupInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Cache sweep started: name={}, interval={}", name, cleanupInterval);
        }
        return this;
    }

    public CacheLookup<V> get(String key) {
        if (!enabled) {
            misses.incrementAndGet();
            return CacheLookup.miss();
        }

        Optional<V> fast = local.get(key);
        if (fast.isPresent()) {
            hits.incrementAndGet();
            return CacheLookup.hit(fast.get());
        }

        Optional<V> slow = readDistributed(key);
        if (slow.isPresent()) {
            Duration ttl = promotionTtl(key);
            if (ttl.isZero()) {
                log.debug("Cache entry expired during read, not promoted: name={}, key={}", name, key);
            } else {
                local.set(key, slow.get(), ttl);
                log.debug("Cache entry promoted: name={}, key={}, from={}, ttl={}", name, key, distributed.name(), ttl);
            }
            hits.incrementAndGet();
            return CacheLookup.hit(slow.get());
        }

        misses.incrementAndGet();
        return CacheLookup.miss();
    }

    public void set(String key, V value) {
        set(key, value, defaultTtl);
    }

    /**
     * @throws IllegalArgumentException if {@code ttl} is not positive
     */
    public void set(String key, V value, Duration ttl) {
        CacheTier.requirePositiveTtl(ttl);
        if (!enabled) {
            return;
        }
        local.set(key, value, ttl);
        if (distributed.isPresent()) {
            try {
                distributed.set(key, value, ttl);
            } catch (RuntimeException e) {
                log.warn("Distributed cache write failed: name={}, key={}, tier={}, error={}",
                        name, key, distributed.name(), e.getMessage());
            }
        }
    }

    public void delete(String key) {
        local.delete(key);
        if (distributed.isPresent()) {
            try {
                distributed.delete(key);
            } catch (RuntimeException e) {
                log.warn("Distributed cache delete failed: name={}, key={}, error={}", name, key, e.getMessage());
            }
        }
    }

    public void clear() {
        local.clear();
        if (distributed.isPresent()) {
            try {
                distributed.clear();
            } catch (RuntimeException e) {
                log.warn("Distributed cache clear failed: name={}, error={}", name, e.getMessage());
            }
        }
        log.info("Cache cleared: name={}", name);
    }

    /**
     * Runs one expiry sweep over the fast tier.
     */
    public int sweep() {
        int removed = local.sweepExpired();
        lastCleanup = clock.instant();
        return removed;
    }

    public CacheStats stats() {
        return CacheStats.of(hits.get(), misses.get(), local.size(), lastCleanup);
    }

    /**
     * Fast-tier entry with access metadata, if live.
     */
    public Optional<CacheItem<V>> localItem(String key) {
        return local.item(key);
    }

    public boolean hasDistributedTier() {
        return distributed.isPresent();
    }

    public String getName() {
        return name;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    private Optional<V> readDistributed(String key) {
        if (!distributed.isPresent()) {
            return Optional.empty();
        }
        try {
            return distributed.get(key);
        } catch (RuntimeException e) {
            log.warn("Distributed cache read failed, treating as miss: name={}, key={}, error={}",
                    name, key, e.getMessage());
            return Optional.empty();
        }
    }

    private Duration promotionTtl(String key) {
        Optional<Duration> remaining;
        try {
            remaining = distributed.remainingTtl(key);
        } catch (RuntimeException e) {
            log.warn("Distributed cache TTL read failed, using default: name={}, key={}, error={}",
                    name, key, e.getMessage());
            remaining = Optional.empty();
        }
        if (remaining == null || remaining.isEmpty()) {
            return defaultTtl;
        }
        Duration ttl = remaining.get();
        if (ttl.isNegative() || ttl.isZero()) {
            return Duration.ZERO;
        }
        return ttl.compareTo(defaultTtl) < 0 ? ttl : defaultTtl;
    }

    @Override
    public void close() {
        running.set(false);
        sweeper.shutdown();
        try {
            if (!sweeper.awaitTermination(5, TimeUnit.SECONDS)) {
                sweeper.shutdownNow();
            }
        } catch (InterruptedException e) {
            sweeper.shutdownNow();
            Thread.currentThread().interrupt();
        }

        try {
            distributed.close();
        } catch (Exception e) {
            log.warn("Error closing distributed cache tier", e);
        }
        log.info("Cache closed: name={}, stats={}", name, stats());
    }

    public static <V> Builder<V> builder(String name) {
        return new Builder<>(name);
    }

    /**
     * Builder for MultiLevelCache.
     */
    public static final class Builder<V> {
        private final String name;
        private CacheTier<V> distributed = CacheTier.none();
        private Duration defaultTtl = Duration.ofHours(1);
        private Duration cleanupInterval = Duration.ofMinutes(1);
        private boolean enabled = true;
        private Clock clock = Clock.systemUTC();

        private Builder(String name) {
            this.name = name;
        }

        public Builder<V> distributed(CacheTier<V> distributed) {
            this.distributed = distributed != null ? distributed : CacheTier.none();
            return this;
        }

        public Builder<V> defaultTtl(Duration defaultTtl) {
            CacheTier.requirePositiveTtl(defaultTtl);
            this.defaultTtl = defaultTtl;
            return this;
        }

        public Builder<V> cleanupInterval(Duration cleanupInterval) {
            if (cleanupInterval == null || cleanupInterval.isNegative() || cleanupInterval.isZero()) {
                throw new IllegalArgumentException("Cleanup interval must be positive");
            }
            this.cleanupInterval = cleanupInterval;
            return this;
        }

        public Builder<V> enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder<V> clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public MultiLevelCache<V> build() {
            return new MultiLevelCache<>(this);
        }
    }
}
