package org.nostrtv.core.testing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Delayed;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Deterministic scheduler driven by a {@link MutableClock}. {@code execute} runs the task on the
 * calling thread; delayed tasks run when {@link #advance(long)} moves the clock past them.
 */
public class ManualScheduler extends AbstractExecutorService implements ScheduledExecutorService {

    private final MutableClock clock;
    private final List<Task<?>> tasks = new ArrayList<>();
    private long sequence;
    private boolean shutdown;

    public ManualScheduler(MutableClock clock) {
        this.clock = clock;
    }

    public MutableClock getClock() {
        return clock;
    }

    /**
     * Move the clock forward, running every task that falls due on the way, in time order.
     */
    public void advance(long deltaMs) {
        long target = clock.millis() + deltaMs;
        while (true) {
            Task<?> next = null;
            synchronized (tasks) {
                for (Task<?> task : tasks) {
                    if (task.at <= target && (next == null || task.compareOrder(next) < 0)) {
                        next = task;
                    }
                }
                if (next == null) {
                    break;
                }
                tasks.remove(next);
            }
            if (next.at > clock.millis()) {
                clock.setMillis(next.at);
            }
            next.run();
        }
        clock.setMillis(target);
    }

    /**
     * Run tasks already due without moving the clock.
     */
    public void runDue() {
        advance(0);
    }

    public int getScheduledCount() {
        synchronized (tasks) {
            return tasks.size();
        }
    }

    @Override
    public void execute(Runnable command) {
        if (shutdown) {
            throw new RejectedExecutionException("Scheduler is shut down");
        }
        command.run();
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable command, long delay, TimeUnit unit) {
        return add(Executors.callable(command), unit.toMillis(delay), 0);
    }

    @Override
    public <V> ScheduledFuture<V> schedule(Callable<V> callable, long delay, TimeUnit unit) {
        return add(callable, unit.toMillis(delay), 0);
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable command, long initialDelay, long period, TimeUnit unit) {
        return add(Executors.callable(command), unit.toMillis(initialDelay), unit.toMillis(period));
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable command, long initialDelay, long delay, TimeUnit unit) {
        return add(Executors.callable(command), unit.toMillis(initialDelay), unit.toMillis(delay));
    }

    private <V> Task<V> add(Callable<V> callable, long delayMs, long periodMs) {
        if (shutdown) {
            throw new RejectedExecutionException("Scheduler is shut down");
        }
        synchronized (tasks) {
            Task<V> task = new Task<>(callable, clock.millis() + Math.max(0, delayMs), periodMs, sequence++);
            tasks.add(task);
            return task;
        }
    }

    @Override
    public void shutdown() {
        shutdown = true;
        synchronized (tasks) {
            tasks.clear();
        }
    }

    @Override
    public List<Runnable> shutdownNow() {
        shutdown();
        return Collections.emptyList();
    }

    @Override
    public boolean isShutdown() {
        return shutdown;
    }

    @Override
    public boolean isTerminated() {
        return shutdown;
    }

    @Override
    public boolean awaitTermination(long timeout, TimeUnit unit) {
        return shutdown;
    }

    private final class Task<V> implements ScheduledFuture<V> {
        private final Callable<V> callable;
        private final long periodMs;
        private final CompletableFuture<V> result = new CompletableFuture<>();
        private long at;
        private long order;

        Task(Callable<V> callable, long at, long periodMs, long order) {
            this.callable = callable;
            this.at = at;
            this.periodMs = periodMs;
            this.order = order;
        }

        int compareOrder(Task<?> other) {
            if (at != other.at) {
                return Long.compare(at, other.at);
            }
            return Long.compare(order, other.order);
        }

        void run() {
            if (result.isDone()) {
                return;
            }
            try {
                V value = callable.call();
                if (periodMs > 0) {
                    synchronized (tasks) {
                        at = clock.millis() + periodMs;
                        order = sequence++;
                        if (!shutdown && !result.isDone()) {
                            tasks.add(this);
                        }
                    }
                } else {
                    result.complete(value);
                }
            } catch (Exception e) {
                result.completeExceptionally(e);
            }
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(at - clock.millis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            return Long.compare(getDelay(TimeUnit.MILLISECONDS), other.getDelay(TimeUnit.MILLISECONDS));
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            synchronized (tasks) {
                tasks.remove(this);
            }
            return result.cancel(mayInterruptIfRunning);
        }

        @Override
        public boolean isCancelled() {
            return result.isCancelled();
        }

        @Override
        public boolean isDone() {
            return result.isDone();
        }

        @Override
        public V get() throws InterruptedException, ExecutionException {
            return result.get();
        }

        @Override
        public V get(long timeout, TimeUnit unit) throws InterruptedException, ExecutionException, TimeoutException {
            if (!result.isDone()) {
                throw new TimeoutException();
            }
            return result.get();
        }
    }
}
