package org.nostrtv.core.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs at most {@code maxPermits} tasks per sliding window. Work over the limit waits in FIFO order
 * and runs as soon as the oldest start falls out of the window; nothing is dropped.
 */
public class SlidingWindowRateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    private final int maxPermits;
    private final long windowMs;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;

    private final Object lock = new Object();
    private final Deque<Long> recentStarts = new ArrayDeque<>();
    private final Deque<Runnable> waiting = new ArrayDeque<>();
    private ScheduledFuture<?> scheduledDrain;

    public SlidingWindowRateLimiter(int maxPermits, long windowMs, Clock clock, ScheduledExecutorService scheduler) {
        if (maxPermits <= 0 || windowMs <= 0) {
            throw new IllegalArgumentException("Rate limit must be positive");
        }
        this.maxPermits = maxPermits;
        this.windowMs = windowMs;
        this.clock = clock;
        this.scheduler = scheduler;
    }

    /**
     * Run the task now if a permit is free, otherwise queue it.
     */
    public void submit(Runnable task) {
        synchronized (lock) {
            waiting.addLast(task);
        }
        drain();
    }

    public int getWaitingCount() {
        synchronized (lock) {
            return waiting.size();
        }
    }

    /**
     * Drop queued tasks; tasks already running are unaffected.
     */
    public void clear() {
        synchronized (lock) {
            waiting.clear();
            if (scheduledDrain != null) {
                scheduledDrain.cancel(false);
                scheduledDrain = null;
            }
        }
    }

    private void drain() {
        while (true) {
            Runnable next;
            synchronized (lock) {
                long now = clock.millis();
                while (!recentStarts.isEmpty() && now - recentStarts.peekFirst() >= windowMs) {
                    recentStarts.pollFirst();
                }
                if (waiting.isEmpty()) {
                    return;
                }
                if (recentStarts.size() >= maxPermits) {
                    scheduleDrain(recentStarts.peekFirst() + windowMs - now);
                    return;
                }
                next = waiting.pollFirst();
                recentStarts.addLast(now);
            }
            // Run outside the lock; the task may submit more work.
            try {
                next.run();
            } catch (RuntimeException e) {
                logger.warn("Rate-limited task failed", e);
            }
        }
    }

    private void scheduleDrain(long delayMs) {
        if (scheduledDrain != null) {
            return;
        }
        logger.debug("Rate limit reached, deferring {} task(s) by {}ms", waiting.size(), delayMs);
        scheduledDrain = scheduler.schedule(this::deferredDrain, Math.max(1, delayMs), TimeUnit.MILLISECONDS);
    }

    private void deferredDrain() {
        synchronized (lock) {
            scheduledDrain = null;
        }
        drain();
    }
}
