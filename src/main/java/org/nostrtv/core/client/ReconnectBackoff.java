package org.nostrtv.core.client;

/**
 * Exponential reconnect delay: starts at the initial value, doubles per attempt, stops at the cap,
 * and returns to the initial value on {@link #reset()}.
 */
public class ReconnectBackoff {

    public static final long DEFAULT_INITIAL_DELAY_MS = 1000;
    public static final long DEFAULT_MAX_DELAY_MS = 30000;

    private final long initialDelayMs;
    private final long maxDelayMs;
    private long currentDelayMs;
    private int attempts;

    public ReconnectBackoff() {
        this(DEFAULT_INITIAL_DELAY_MS, DEFAULT_MAX_DELAY_MS);
    }

    public ReconnectBackoff(long initialDelayMs, long maxDelayMs) {
        if (initialDelayMs <= 0 || maxDelayMs < initialDelayMs) {
            throw new IllegalArgumentException("Invalid backoff bounds: " + initialDelayMs + "/" + maxDelayMs);
        }
        this.initialDelayMs = initialDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.currentDelayMs = initialDelayMs;
    }

    /**
     * Delay for the next attempt; advances the schedule.
     */
    public synchronized long nextDelayMs() {
        long delay = currentDelayMs;
        currentDelayMs = Math.min(currentDelayMs * 2, maxDelayMs);
        attempts++;
        return delay;
    }

    /**
     * Delay the next call to {@link #nextDelayMs()} would return.
     */
    public synchronized long peekDelayMs() {
        return currentDelayMs;
    }

    public synchronized int getAttempts() {
        return attempts;
    }

    public synchronized void reset() {
        currentDelayMs = initialDelayMs;
        attempts = 0;
    }
}
