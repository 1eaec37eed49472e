package com.marketdata.jobs.infrastructure;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Sliding-window admission limiter shared by concurrent workers.
 * At most {@code maxPerSecond} grants are handed out in any trailing
 * one-second window. Callers over capacity wait on the monitor until the
 * oldest grant leaves the window, then re-check.
 */
public class SlidingWindowRateLimiter {

    private static final long WINDOW_NANOS = TimeUnit.SECONDS.toNanos(1);

    private final int maxPerSecond;
    private final LongSupplier nanoClock;
    private final Deque<Long> grants = new ArrayDeque<>();

    public SlidingWindowRateLimiter(int maxPerSecond) {
        this(maxPerSecond, System::nanoTime);
    }

    SlidingWindowRateLimiter(int maxPerSecond, LongSupplier nanoClock) {
        if (maxPerSecond <= 0) {
            throw new IllegalArgumentException("maxPerSecond must be positive: " + maxPerSecond);
        }
        this.maxPerSecond = maxPerSecond;
        this.nanoClock = nanoClock;
    }

    /**
     * Block until a slot is available in the current window, then take it.
     *
     * @throws InterruptedException if the calling worker is interrupted while waiting
     */
    public void acquire() throws InterruptedException {
        synchronized (grants) {
            while (true) {
                long now = nanoClock.getAsLong();
                expire(now);
                if (grants.size() < maxPerSecond) {
                    grants.addLast(now);
                    return;
                }
                long waitNanos = WINDOW_NANOS - (now - grants.peekFirst());
                // wait() releases the monitor so other callers can expire and re-check
                TimeUnit.NANOSECONDS.timedWait(grants, Math.max(waitNanos, 1L));
            }
        }
    }

    /**
     * Number of grants still inside the trailing window.
     */
    public int inFlightWindowSize() {
        synchronized (grants) {
            expire(nanoClock.getAsLong());
            return grants.size();
        }
    }

    private void expire(long now) {
        while (!grants.isEmpty() && now - grants.peekFirst() >= WINDOW_NANOS) {
            grants.pollFirst();
        }
    }
}
