package com.di.creatormatch.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Carries the MDC of the thread running a search ({@code searchId}, {@code requestId}) into the
 * verification workers.
 * <p>The snapshot is taken when a task is wrapped, not when it runs. The worker's own MDC is put
 * back after the task, so pooled threads never leak one search's ids into the next.
 */
public final class MdcPropagation {

    private MdcPropagation() {
    }

    public static Runnable wrapRunnable(Runnable task) {
        Map<String, String> captured = copyMdc();
        return () -> {
            Map<String, String> previous = install(captured);
            try {
                task.run();
            } finally {
                restore(previous);
            }
        };
    }

    public static <T> Callable<T> wrapCallable(Callable<T> task) {
        Map<String, String> captured = copyMdc();
        return () -> {
            Map<String, String> previous = install(captured);
            try {
                return task.call();
            } finally {
                restore(previous);
            }
        };
    }

    /** Every task handed to the returned executor sees the submitter's MDC. */
    public static ExecutorService wrapExecutor(ExecutorService workers) {
        return new CorrelatedExecutor(workers);
    }

    /** Never null. */
    public static Map<String, String> copyMdc() {
        Map<String, String> current = MDC.getCopyOfContextMap();
        return current == null ? Collections.emptyMap() : current;
    }

    private static Map<String, String> install(Map<String, String> captured) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (captured.isEmpty()) {
            MDC.clear();
        } else {
            MDC.setContextMap(captured);
        }
        return previous;
    }

    private static void restore(Map<String, String> previous) {
        if (previous == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(previous);
        }
    }

    private static final class CorrelatedExecutor extends AbstractExecutorService {
        private final ExecutorService workers;

        CorrelatedExecutor(ExecutorService workers) {
            this.workers = workers;
        }

        @Override
        public void execute(Runnable command) {
            workers.execute(wrapRunnable(command));
        }

        @Override
        public void shutdown() {
            workers.shutdown();
        }

        @Override
        public List<Runnable> shutdownNow() {
            return workers.shutdownNow();
        }

        @Override
        public boolean isShutdown() {
            return workers.isShutdown();
        }

        @Override
        public boolean isTerminated() {
            return workers.isTerminated();
        }

        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
            return workers.awaitTermination(timeout, unit);
        }
    }
}
