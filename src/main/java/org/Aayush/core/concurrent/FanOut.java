package org.Aayush.core.concurrent;

import lombok.experimental.StandardException;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Order-preserving parallel map over contiguous slices of an input list.
 *
 * <p>Each worker maps its own slice into a private result list; slices are concatenated
 * in input order after all workers finish. No accumulator is shared between workers.</p>
 */
@UtilityClass
public final class FanOut {

    /**
     * Maps every item, using up to {@code parallelism} worker threads.
     *
     * @param items input items.
     * @param mapper pure mapping function.
     * @param parallelism worker count; {@code <= 1} maps on the calling thread.
     * @return mapped results in input order.
     * @throws FanOutException when a worker fails with a checked cause or the caller is interrupted.
     */
    public static <T, R> List<R> map(List<T> items, Function<? super T, ? extends R> mapper, int parallelism) {
        int size = items.size();
        int workers = Math.min(Math.max(1, parallelism), Math.max(1, size));
        if (workers == 1) {
            return mapSlice(items, mapper);
        }

        int sliceSize = (size + workers - 1) / workers;
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        try {
            List<Future<List<R>>> futures = new ArrayList<>(workers);
            for (int start = 0; start < size; start += sliceSize) {
                List<T> slice = items.subList(start, Math.min(size, start + sliceSize));
                futures.add(executor.submit(() -> mapSlice(slice, mapper)));
            }

            List<R> merged = new ArrayList<>(size);
            for (Future<List<R>> future : futures) {
                merged.addAll(await(future));
            }
            return merged;
        } finally {
            executor.shutdownNow();
        }
    }

    private static <T, R> List<R> mapSlice(List<T> slice, Function<? super T, ? extends R> mapper) {
        List<R> results = new ArrayList<>(slice.size());
        for (T item : slice) {
            results.add(mapper.apply(item));
        }
        return results;
    }

    private static <R> List<R> await(Future<List<R>> future) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new FanOutException("interrupted while waiting for worker results", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new FanOutException("worker failed", cause);
        }
    }

    /**
     * Raised when parallel work cannot complete normally.
     */
    @StandardException
    public static class FanOutException extends RuntimeException {
    }
}
