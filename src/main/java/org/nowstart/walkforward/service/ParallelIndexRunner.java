package org.nowstart.walkforward.service;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.function.IntConsumer;
import java.util.stream.IntStream;

/**
 * Runs {@code task} for every index in {@code [0, total)}, on a dedicated {@link ForkJoinPool} when
 * {@code parallelism > 1}. Callers write results into per-index slots.
 */
final class ParallelIndexRunner {

    private ParallelIndexRunner() {
    }

    static void run(int total, int parallelism, IntConsumer task, String label) {
        if (parallelism <= 1) {
            IntStream.range(0, total).forEach(task);
            return;
        }

        ForkJoinPool pool = new ForkJoinPool(parallelism);
        try {
            pool.submit(() -> IntStream.range(0, total).parallel().forEach(task)).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(label + " interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException(label + " failed", e.getCause());
        } finally {
            pool.shutdown();
        }
    }
}
