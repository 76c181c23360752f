package com.tilestream.world.stream;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Runs generation tasks on worker threads. The scheduler bounds how many
 * tasks are in flight; the pool only supplies the threads.
 *
 * Either owns a fixed daemon thread pool sized to the concurrency bound, or
 * wraps a caller-supplied executor (which it never shuts down).
 */
public class GenerationPool {

    private static final Logger LOG = Logger.getLogger(GenerationPool.class.getName());
    private static final AtomicInteger THREAD_IDS = new AtomicInteger();

    private final boolean owned;
    private Executor executor;
    private int threadCount;

    /** Create a pool owning {@code threadCount} daemon worker threads. */
    public GenerationPool(int threadCount) {
        this.owned = true;
        this.threadCount = threadCount;
        this.executor = newThreadPool(threadCount);
        LOG.info("Started chunk generation pool with " + threadCount + " threads");
    }

    /** Wrap an externally managed executor. */
    public GenerationPool(Executor executor) {
        this.owned = false;
        this.executor = executor;
    }

    private static ExecutorService newThreadPool(int threadCount) {
        if (threadCount <= 0) {
            throw new IllegalArgumentException("threadCount must be > 0, got " + threadCount);
        }
        return Executors.newFixedThreadPool(threadCount, r -> {
            Thread t = new Thread(r, "ChunkGen-Pool-" + THREAD_IDS.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public void submit(Runnable task) {
        executor.execute(task);
    }

    /**
     * Match an owned pool's thread count to a new concurrency bound. The old
     * pool is shut down gracefully so tasks already running still finish.
     * No-op for wrapped executors.
     */
    public void resize(int newThreadCount) {
        if (!owned || newThreadCount == threadCount) return;
        ExecutorService replacement = newThreadPool(newThreadCount);
        ((ExecutorService) executor).shutdown();
        executor = replacement;
        LOG.info("Resized chunk generation pool from " + threadCount + " to " + newThreadCount + " threads");
        threadCount = newThreadCount;
    }

    public boolean isOwned() {
        return owned;
    }

    public void shutdown() {
        if (!owned) return;
        ExecutorService pool = (ExecutorService) executor;
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(2, TimeUnit.SECONDS)) {
                LOG.warning("Chunk generation pool did not terminate within 2s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
