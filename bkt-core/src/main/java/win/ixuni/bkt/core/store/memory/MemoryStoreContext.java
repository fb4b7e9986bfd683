package win.ixuni.bkt.core.store.memory;

import lombok.Getter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.model.Bucket;
import win.ixuni.bkt.core.model.BucketPolicy;
import win.ixuni.bkt.core.model.Policy;
import win.ixuni.bkt.core.model.S3Configuration;
import win.ixuni.bkt.core.model.StoredObject;
import win.ixuni.bkt.core.model.Upload;
import win.ixuni.bkt.core.model.User;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 内存存储上下文
 * <p>
 * Shared tables of every in-memory store. One lock guards all of them, so a callback passed to
 * {@link #tx(Callable)} sees and changes the tables atomically, the way a database transaction
 * would.
 */
@Getter
public class MemoryStoreContext {

    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();

    /**
     * bucketId -> Bucket
     */
    private final Map<String, Bucket> buckets = new HashMap<>();

    /**
     * bucketId -> (key -> StoredObject), keys kept sorted
     */
    private final Map<String, NavigableMap<String, StoredObject>> objects = new HashMap<>();

    private final Map<String, Policy> policies = new HashMap<>();

    /**
     * userId -> attached policy ids
     */
    private final Map<String, Set<String>> userPolicies = new HashMap<>();

    /**
     * bucketId -> BucketPolicy
     */
    private final Map<String, BucketPolicy> bucketPolicies = new HashMap<>();

    private final Map<String, User> users = new HashMap<>();

    private final Map<String, S3Configuration> s3Configurations = new HashMap<>();

    private final Map<String, Upload> uploads = new HashMap<>();

    public MemoryStoreContext() {
        this(Clock.systemUTC());
    }

    public MemoryStoreContext(Clock clock) {
        this.clock = clock;
    }

    public Instant now() {
        return clock.instant();
    }

    /**
     * Run {@code work} under the table lock
     */
    public <T> Mono<T> tx(Callable<T> work) {
        return Mono.fromCallable(() -> {
            lock.lock();
            try {
                return work.call();
            } finally {
                lock.unlock();
            }
        });
    }

    /**
     * Run {@code work} under the table lock and emit the returned snapshot
     */
    public <T> Flux<T> txMany(Callable<List<T>> work) {
        return tx(work).flatMapIterable(list -> list);
    }
}
