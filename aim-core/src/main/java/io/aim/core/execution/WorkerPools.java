package io.aim.core.execution;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/// Thread pools used by the dispatcher.
final class WorkerPools {

    private WorkerPools() {}

    /// Creates the bounded worker pool.
    ///
    /// Queued work is kept in a priority queue, so the pool only accepts
    /// {@link Comparable} runnables submitted with `execute` (never `submit`,
    /// which would wrap them in non-comparable futures).
    ///
    /// @param size number of worker threads, positive
    /// @param onTerminated run once after the last queued task has finished following shutdown, not null
    /// @return the pool, never null
    static ThreadPoolExecutor newWorkerPool(int size, Runnable onTerminated) {
        return new ThreadPoolExecutor(
                size,
                size,
                0L,
                TimeUnit.MILLISECONDS,
                new PriorityBlockingQueue<>(),
                namedThreads("aim-worker-", false)) {
            @Override
            protected void terminated() {
                super.terminated();
                onTerminated.run();
            }
        };
    }

    /// Creates the unbounded pool that runs evaluator calls.
    ///
    /// Threads are daemons: an evaluator that overruns its timeout must not
    /// keep the JVM alive.
    ///
    /// @return the pool, never null
    static ExecutorService newEvaluatorPool() {
        return Executors.newCachedThreadPool(namedThreads("aim-evaluator-", true));
    }

    private static ThreadFactory namedThreads(String prefix, boolean daemon) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(daemon);
            return thread;
        };
    }
}
