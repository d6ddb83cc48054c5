package org.nostrtv.core.activity;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle for one stream's activity registration. Closing it more than once is harmless; only
 * the first close unsubscribes. Use with try-with-resources or close it explicitly.
 */
public class ActivitySubscription implements AutoCloseable {

    private final ActivityRouter router;
    private final ActivityRouter.Registration registration;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    ActivitySubscription(ActivityRouter router, ActivityRouter.Registration registration) {
        this.router = router;
        this.registration = registration;
    }

    /** Normalized coordinate of the stream */
    public String getCoordinate() {
        return registration.getCoordinate();
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            router.release(registration);
        }
    }
}
