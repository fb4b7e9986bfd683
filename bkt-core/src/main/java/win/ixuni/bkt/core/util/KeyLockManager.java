package win.ixuni.bkt.core.util;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import win.ixuni.bkt.core.exception.ResourceInUseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-key lock manager
 * <p>
 * Serializes operations that touch the same object key (move, rename) while operations on
 * different keys still run in parallel. One binary semaphore per key, dropped once no caller
 * holds or waits for it.
 * <p>
 * Multi-key acquisition sorts the keys first so two moves over the same pair of keys cannot
 * deadlock.
 */
@Slf4j
public class KeyLockManager {

    private final Map<String, LockEntry> locks = new ConcurrentHashMap<>();
    private final Duration timeout;

    private static class LockEntry {
        final Semaphore semaphore = new Semaphore(1);
        final AtomicInteger refCount = new AtomicInteger(0);
    }

    public KeyLockManager(Duration timeout) {
        this.timeout = timeout;
    }

    /**
     * Run {@code operation} while holding the lock of {@code key}
     */
    public <T> Mono<T> withLock(String key, Mono<T> operation) {
        return Mono.defer(() -> {
            LockEntry entry = locks.computeIfAbsent(key, k -> new LockEntry());
            entry.refCount.incrementAndGet();

            return Mono.fromCallable(() -> {
                        boolean acquired = entry.semaphore.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS);
                        if (!acquired) {
                            throw new LockTimeout(key);
                        }
                        log.debug("[KEY_LOCK] Acquired lock for key={}", key);
                        return true;
                    })
                    .subscribeOn(Schedulers.boundedElastic())
                    .onErrorMap(LockTimeout.class, e -> new ResourceInUseException(
                            "Another operation on " + key + " is still running"))
                    .doOnError(e -> release(key, entry, false))
                    .flatMap(acquired -> operation
                            .doFinally(signal -> release(key, entry, true)));
        });
    }

    /**
     * Run {@code operation} while holding the locks of all {@code keys}
     */
    public <T> Mono<T> withLocks(Collection<String> keys, Mono<T> operation) {
        List<String> ordered = new ArrayList<>(new TreeSet<>(keys));
        Mono<T> chained = operation;
        for (int i = ordered.size() - 1; i >= 0; i--) {
            chained = withLock(ordered.get(i), chained);
        }
        return chained;
    }

    public int getActiveLockCount() {
        return locks.size();
    }

    private void release(String key, LockEntry entry, boolean held) {
        if (held) {
            entry.semaphore.release();
            log.debug("[KEY_LOCK] Released lock for key={}", key);
        }
        if (entry.refCount.decrementAndGet() == 0) {
            locks.remove(key, entry);
        }
    }

    private static final class LockTimeout extends RuntimeException {
        LockTimeout(String key) {
            super("Lock wait timed out for " + key, null, false, false);
        }
    }
}
