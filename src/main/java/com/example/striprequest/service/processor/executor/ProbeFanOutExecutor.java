package com.example.striprequest.service.processor.executor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.Function;
import org.slf4j.Logger;

import static java.util.concurrent.Executors.newFixedThreadPool;

/**
 * Runs one unit of work per item, all at once, on a dedicated pool sized to the batch, and waits for every
 * unit before returning. Results keep the order of {@code items}. A unit that throws is turned into a
 * result by {@code onFailure}, so one bad unit never aborts the batch.
 */
public final class ProbeFanOutExecutor {

    private static final AtomicInteger BATCH_SEQUENCE = new AtomicInteger();

    private ProbeFanOutExecutor() {
    }

    public static <T, R> List<R> execute(List<T> items,
                                         Function<T, R> unit,
                                         BiFunction<T, Throwable, R> onFailure,
                                         Logger logger) {
        Objects.requireNonNull(items, "items");
        Objects.requireNonNull(unit, "unit");
        Objects.requireNonNull(onFailure, "onFailure");
        Objects.requireNonNull(logger, "logger");

        if (items.isEmpty()) {
            return List.of();
        }

        int batch = BATCH_SEQUENCE.incrementAndGet();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("probe-batch-" + batch + "-" + thread.getId());
            thread.setDaemon(true);
            return thread;
        };

        ExecutorService executor = newFixedThreadPool(items.size(), threadFactory);
        List<Future<R>> futures = new ArrayList<>(items.size());
        try {
            for (T item : items) {
                futures.add(executor.submit(() -> unit.apply(item)));
            }
            logger.debug("Probe batch {} dispatched {} units", batch, items.size());
            return awaitAll(items, futures, onFailure, logger);
        } finally {
            executor.shutdownNow();
        }
    }

    private static <T, R> List<R> awaitAll(List<T> items,
                                           List<Future<R>> futures,
                                           BiFunction<T, Throwable, R> onFailure,
                                           Logger logger) {
        List<R> results = new ArrayList<>(items.size());
        boolean interrupted = false;
        for (int i = 0; i < futures.size(); i++) {
            T item = items.get(i);
            if (interrupted) {
                futures.get(i).cancel(true);
                results.add(onFailure.apply(item, new InterruptedException("Probe batch interrupted")));
                continue;
            }
            try {
                results.add(futures.get(i).get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                logger.error("Probe unit for {} failed: {}", item, cause.getMessage(), cause);
                results.add(onFailure.apply(item, cause));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                futures.get(i).cancel(true);
                results.add(onFailure.apply(item, e));
            }
        }
        return results;
    }
}
