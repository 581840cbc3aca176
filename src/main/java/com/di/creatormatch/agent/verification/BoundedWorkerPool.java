package com.di.creatormatch.agent.verification;

import com.di.creatormatch.util.MdcPropagation;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-size worker pool whose tasks additionally hold a permit from a semaphore of the same size
 * while they run. Tracks the highest number of tasks observed in flight. MDC of the submitting thread
 * is propagated to workers.
 * <p>One pool per verification run; {@link #close()} interrupts anything still running.
 */
public final class BoundedWorkerPool implements AutoCloseable {

    private final int maxConcurrency;
    private final Semaphore permits;
    private final ExecutorService executor;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();

    public BoundedWorkerPool(int maxConcurrency, String threadNamePrefix) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be >= 1, was " + maxConcurrency);
        }
        this.maxConcurrency = maxConcurrency;
        this.permits = new Semaphore(maxConcurrency);
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, threadNamePrefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        this.executor = MdcPropagation.wrapExecutor(Executors.newFixedThreadPool(maxConcurrency, tf));
    }

    public <T> Future<T> submit(Callable<T> task) {
        return executor.submit(() -> {
            permits.acquire();
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            try {
                return task.call();
            } finally {
                inFlight.decrementAndGet();
                permits.release();
            }
        });
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    /** Highest number of tasks that were running at the same time. */
    public int getMaxInFlight() {
        return maxInFlight.get();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
