package org.carball.tuner.tuning;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Runs one task per replica, either inline or on a fixed pool. Each task must touch only its own
 * replica; the replica serialises its configuration changes and cost reads.
 */
@Slf4j
public class ReplicaWorkers implements AutoCloseable {

    private final ExecutorService pool;

    public ReplicaWorkers(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be at least 1, got " + parallelism);
        }
        if (parallelism == 1) {
            this.pool = null;
        } else {
            AtomicInteger counter = new AtomicInteger();
            this.pool = Executors.newFixedThreadPool(parallelism, runnable -> {
                Thread thread = new Thread(runnable, "replica-worker-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
        }
    }

    public static ReplicaWorkers sequential() {
        return new ReplicaWorkers(1);
    }

    /**
     * Applies {@code task} to every element, returning results in input order. The first failure, in
     * input order, is rethrown once every task has finished.
     */
    public <S, T> List<T> map(List<S> perReplica, Function<S, T> task) {
        List<T> results = new ArrayList<>(perReplica.size());
        if (pool == null || perReplica.size() < 2) {
            for (S item : perReplica) {
                results.add(task.apply(item));
            }
            return results;
        }

        List<Future<T>> futures = new ArrayList<>(perReplica.size());
        for (S item : perReplica) {
            futures.add(pool.submit(() -> task.apply(item)));
        }

        RuntimeException failure = null;
        for (Future<T> future : futures) {
            try {
                results.add(future.get());
            } catch (ExecutionException e) {
                if (failure == null) {
                    failure = unwrap(e);
                }
                results.add(null);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new IllegalStateException("Interrupted while waiting for replica tasks", e);
            }
        }
        if (failure != null) {
            throw failure;
        }
        return results;
    }

    private static RuntimeException unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IllegalStateException("Replica task failed", cause);
    }

    @Override
    public void close() {
        if (pool != null) {
            pool.shutdownNow();
        }
    }
}
