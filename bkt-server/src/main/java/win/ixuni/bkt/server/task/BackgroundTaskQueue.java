package win.ixuni.bkt.server.task;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 后台任务队列
 * <p>
 * Bounded worker pool for work that outlives the request: async uploads, reconciliation
 * writes. A full queue rejects the task instead of blocking the caller. {@link #close()} stops
 * accepting work and drains what is already queued.
 */
@Slf4j
public class BackgroundTaskQueue implements AutoCloseable {

    public static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(30);

    private final String name;
    private final ThreadPoolExecutor executor;

    public BackgroundTaskQueue(String name, int workers, int capacity) {
        this.name = name;
        this.executor = new ThreadPoolExecutor(
                workers, workers,
                0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(capacity),
                namedThreads(name),
                new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Queue a task
     *
     * @return false when the queue is full or shut down
     */
    public boolean submit(String description, Runnable task) {
        try {
            executor.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("[{}] Task '{}' failed", name, description, e);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("[{}] Task '{}' rejected, backlog={}", name, description, getBacklog());
            return false;
        }
    }

    /**
     * Tasks waiting for a worker
     */
    public int getBacklog() {
        return executor.getQueue().size();
    }

    public int getActiveCount() {
        return executor.getActiveCount();
    }

    public long getCompletedCount() {
        return executor.getCompletedTaskCount();
    }

    public boolean isIdle() {
        return getBacklog() == 0 && getActiveCount() == 0;
    }

    /**
     * Stop accepting tasks and wait for queued ones
     *
     * @return true when everything finished within {@code timeout}
     */
    public boolean shutdown(Duration timeout) {
        executor.shutdown();
        try {
            if (executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.info("[{}] Drained, {} tasks completed", name, executor.getCompletedTaskCount());
                return true;
            }
            log.warn("[{}] Drain timed out after {}, {} tasks dropped", name, timeout,
                    executor.shutdownNow().size());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
            return false;
        }
    }

    @Override
    public void close() {
        shutdown(DEFAULT_DRAIN_TIMEOUT);
    }

    private static ThreadFactory namedThreads(String name) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "bkt-" + name + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
