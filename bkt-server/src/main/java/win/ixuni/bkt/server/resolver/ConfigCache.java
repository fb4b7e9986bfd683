package win.ixuni.bkt.server.resolver;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Decrypted S3 configuration cache
 * <p>
 * Keyed by configuration id or {@link #DEFAULT_KEY}. Entries expire {@code ttl} after they were
 * stored; any configuration write clears the whole cache. Memory only.
 */
@Slf4j
public class ConfigCache {

    public static final String DEFAULT_KEY = "default";

    private final Duration ttl;
    private final Clock clock;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Entry> entries = new HashMap<>();

    public ConfigCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    public Optional<ResolvedS3Config> get(String key) {
        Instant now = clock.instant();
        lock.readLock().lock();
        try {
            Entry entry = entries.get(key);
            if (entry == null || !now.isBefore(entry.expiresAt())) {
                return Optional.empty();
            }
            return Optional.of(entry.config());
        } finally {
            lock.readLock().unlock();
        }
    }

    public void put(String key, ResolvedS3Config config) {
        Instant expiresAt = clock.instant().plus(ttl);
        lock.writeLock().lock();
        try {
            entries.put(key, new Entry(config, expiresAt));
            entries.values().removeIf(entry -> !entry.expiresAt().isAfter(clock.instant()));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void invalidateAll() {
        lock.writeLock().lock();
        try {
            if (!entries.isEmpty()) {
                log.debug("Invalidating {} cached S3 configuration(s)", entries.size());
            }
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private record Entry(ResolvedS3Config config, Instant expiresAt) {
    }
}
