package com.marketdata.jobs.service.scan;

import com.marketdata.jobs.exception.ProviderException;
import com.marketdata.jobs.infrastructure.SlidingWindowRateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Fans one batch of symbols out over a worker pool.
 * Every task takes a slot from the shared limiter before doing any work.
 * Once a task holds its slot it has {@code taskTimeout} to finish; past that it is
 * cancelled and reported as a failure without an HTTP status.
 * Outcomes are handed to the sink on the dispatching thread, in completion order.
 */
@Slf4j
class SymbolBatchDispatcher {

    private static final long POLL_MILLIS = 200;

    private final ExecutorService pool;
    private final SlidingWindowRateLimiter limiter;
    private final Duration taskTimeout;
    private final Function<String, SymbolFetchOutcome> work;

    SymbolBatchDispatcher(ExecutorService pool, SlidingWindowRateLimiter limiter, Duration taskTimeout,
            Function<String, SymbolFetchOutcome> work) {
        this.pool = pool;
        this.limiter = limiter;
        this.taskTimeout = taskTimeout;
        this.work = work;
    }

    /**
     * Process one batch and return when every symbol has produced an outcome.
     *
     * @throws InterruptedException if the dispatching thread is interrupted; pending tasks are cancelled
     */
    void dispatch(List<String> symbols, Consumer<SymbolFetchOutcome> sink) throws InterruptedException {
        CompletionService<SymbolFetchOutcome> completion = new ExecutorCompletionService<>(pool);
        Map<Future<SymbolFetchOutcome>, PendingTask> pending = new HashMap<>();

        for (String symbol : symbols) {
            PendingTask task = new PendingTask(symbol);
            Future<SymbolFetchOutcome> future = completion.submit(() -> {
                limiter.acquire();
                task.startedAtNanos = System.nanoTime();
                return work.apply(symbol);
            });
            pending.put(future, task);
        }

        long timeoutNanos = taskTimeout.toNanos();
        try {
            while (!pending.isEmpty()) {
                Future<SymbolFetchOutcome> done = completion.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (done != null) {
                    // cancelled futures are queued too, but were already reported
                    PendingTask task = pending.remove(done);
                    if (task != null) {
                        sink.accept(collect(done, task.symbol));
                    }
                }
                expireOverdue(pending, timeoutNanos, sink);
            }
        } catch (InterruptedException e) {
            pending.keySet().forEach(f -> f.cancel(true));
            throw e;
        }
    }

    private void expireOverdue(Map<Future<SymbolFetchOutcome>, PendingTask> pending, long timeoutNanos,
            Consumer<SymbolFetchOutcome> sink) {
        long now = System.nanoTime();
        Iterator<Map.Entry<Future<SymbolFetchOutcome>, PendingTask>> it = pending.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Future<SymbolFetchOutcome>, PendingTask> entry = it.next();
            long startedAt = entry.getValue().startedAtNanos;
            if (startedAt != 0L && now - startedAt > timeoutNanos && !entry.getKey().isDone()) {
                entry.getKey().cancel(true);
                it.remove();
                String symbol = entry.getValue().symbol;
                log.warn("Fetch for {} exceeded {}s, cancelled", symbol, taskTimeout.toSeconds());
                sink.accept(SymbolFetchOutcome.failed(symbol,
                        "Timed out after " + taskTimeout.toSeconds() + "s", null));
            }
        }
    }

    private static SymbolFetchOutcome collect(Future<SymbolFetchOutcome> future, String symbol)
            throws InterruptedException {
        try {
            SymbolFetchOutcome outcome = future.get();
            return outcome != null ? outcome : SymbolFetchOutcome.failed(symbol, "No outcome", null);
        } catch (CancellationException e) {
            return SymbolFetchOutcome.failed(symbol, "Cancelled", null);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            Integer status = cause instanceof ProviderException ? ((ProviderException) cause).getStatusCode() : null;
            return SymbolFetchOutcome.failed(symbol, cause.getClass().getSimpleName() + ": " + cause.getMessage(),
                    status);
        }
    }

    private static final class PendingTask {
        private final String symbol;
        private volatile long startedAtNanos;

        private PendingTask(String symbol) {
            this.symbol = symbol;
        }
    }
}
