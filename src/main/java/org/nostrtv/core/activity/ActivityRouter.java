package org.nostrtv.core.activity;

import org.nostrtv.core.client.ReconnectBackoff;
import org.nostrtv.core.client.RelayPool;
import org.nostrtv.core.client.ResubscribePolicy;
import org.nostrtv.core.model.ChatMessage;
import org.nostrtv.core.model.ZapReceipt;
import org.nostrtv.core.protocol.Coordinate;
import org.nostrtv.core.protocol.EventKinds;
import org.nostrtv.core.protocol.Filter;
import org.nostrtv.core.router.RoutedEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Live chat and zap receipts per stream, keyed by normalized stream coordinate.
 * <p>
 * Each coordinate has at most one registration: subscribing again replaces the handler and closes
 * the previous relay subscription. A heartbeat watches for silence while streams are open and
 * reissues every stream's filter with exponential backoff until traffic resumes.
 * <p>
 * Registrations are guarded by one lock; relay pool calls are made after releasing it.
 */
public class ActivityRouter implements RoutedEventListener, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ActivityRouter.class);

    public static final int HISTORY_LIMIT = 50;
    public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 5_000;
    public static final long DEFAULT_SILENCE_THRESHOLD_MS = 15_000;

    static final String PURPOSE = "stream-activity";

    private final RelayPool pool;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    private final Object lock = new Object();
    private final Map<String, Registration> registrations = new HashMap<>();

    private final AtomicLong lastMessageAt = new AtomicLong();
    private final ReconnectBackoff backoff;
    private volatile boolean healthy = true;
    private volatile boolean closed = false;
    private volatile ScheduledFuture<?> heartbeat;
    private volatile ScheduledFuture<?> reconnectTask;

    private long heartbeatIntervalMs = DEFAULT_HEARTBEAT_INTERVAL_MS;
    private long silenceThresholdMs = DEFAULT_SILENCE_THRESHOLD_MS;

    public ActivityRouter(RelayPool pool, ScheduledExecutorService scheduler) {
        this(pool, scheduler, Clock.systemUTC(), new ReconnectBackoff());
    }

    public ActivityRouter(RelayPool pool, ScheduledExecutorService scheduler, Clock clock, ReconnectBackoff backoff) {
        this.pool = pool;
        this.scheduler = scheduler;
        this.clock = clock;
        this.backoff = backoff;
        this.lastMessageAt.set(clock.millis());
    }

    public void setHeartbeatIntervalMs(long heartbeatIntervalMs) { this.heartbeatIntervalMs = heartbeatIntervalMs; }
    public void setSilenceThresholdMs(long silenceThresholdMs) { this.silenceThresholdMs = silenceThresholdMs; }

    /**
     * Start the heartbeat.
     */
    public void start() {
        if (heartbeat != null) {
            return;
        }
        lastMessageAt.set(clock.millis());
        heartbeat = scheduler.scheduleWithFixedDelay(() -> {
            try {
                checkHealth();
            } catch (RuntimeException e) {
                logger.error("Activity heartbeat failed", e);
            }
        }, heartbeatIntervalMs, heartbeatIntervalMs, TimeUnit.MILLISECONDS);
    }

    // Registrations

    /**
     * Receive chat and zaps for a stream. Replaces any earlier registration for the same stream.
     *
     * @param coordinate stream coordinate {@code 30311:<pubkey>:<d>}, any pubkey case
     */
    public ActivitySubscription subscribe(String coordinate, ActivityHandler handler) {
        String key = Coordinate.normalize(coordinate);
        String subscriptionId = pool.subscribe(filterFor(key), PURPOSE);
        Registration registration = new Registration(key, handler, subscriptionId);

        Registration previous;
        synchronized (lock) {
            previous = registrations.put(key, registration);
        }
        if (previous != null) {
            logger.debug("Replacing activity subscription for {}", key);
            pool.unsubscribe(previous.getSubscriptionId());
        }
        logger.info("Listening for activity on {}", key);
        return new ActivitySubscription(this, registration);
    }

    /**
     * Drop a registration if it is still the current one for its coordinate.
     */
    void release(Registration registration) {
        boolean current;
        synchronized (lock) {
            current = registrations.remove(registration.getCoordinate(), registration);
        }
        if (current) {
            pool.unsubscribe(registration.getSubscriptionId());
            logger.info("Stopped activity on {}", registration.getCoordinate());
        }
    }

    public int getActiveSubscriptionCount() {
        synchronized (lock) {
            return registrations.size();
        }
    }

    public boolean isSubscribed(String coordinate) {
        synchronized (lock) {
            return registrations.containsKey(Coordinate.normalize(coordinate));
        }
    }

    static Filter filterFor(String coordinate) {
        return Filter.builder()
            .kinds(EventKinds.LIVE_CHAT_MESSAGE, EventKinds.ZAP_RECEIPT)
            .aTags(coordinate)
            .limit(HISTORY_LIMIT)
            .build();
    }

    // Delivery

    @Override
    public void onChatMessage(ChatMessage message) {
        Registration registration = received(message.getCoordinate());
        if (registration != null) {
            try {
                registration.getHandler().onChatMessage(message);
            } catch (RuntimeException e) {
                logger.error("Activity handler failed on chat message {}", message.getId(), e);
            }
        }
    }

    @Override
    public void onZapReceipt(ZapReceipt zap) {
        if (zap.getCoordinate() == null) {
            return;
        }
        Registration registration = received(zap.getCoordinate());
        if (registration != null) {
            try {
                registration.getHandler().onZapReceipt(zap);
            } catch (RuntimeException e) {
                logger.error("Activity handler failed on zap {}", zap.getId(), e);
            }
        }
    }

    private Registration received(String coordinate) {
        lastMessageAt.set(clock.millis());
        if (!healthy) {
            healthy = true;
            backoff.reset();
            ScheduledFuture<?> pending = reconnectTask;
            if (pending != null) {
                pending.cancel(false);
            }
            logger.info("Stream activity resumed");
        }
        if (coordinate == null) {
            return null;
        }
        String key = Coordinate.normalize(coordinate);
        Registration registration;
        synchronized (lock) {
            registration = registrations.get(key);
        }
        if (registration == null) {
            logger.debug("No activity handler for {}", key);
        }
        return registration;
    }

    // Health

    public boolean isHealthy() {
        return healthy;
    }

    /**
     * One heartbeat: go unhealthy and start reconnecting if streams are open and nothing has
     * arrived for the silence threshold.
     */
    void checkHealth() {
        if (closed || !healthy || getActiveSubscriptionCount() == 0) {
            return;
        }
        long silence = clock.millis() - lastMessageAt.get();
        if (silence > silenceThresholdMs) {
            logger.warn("No stream activity for {}ms, reissuing subscriptions", silence);
            healthy = false;
            reconnectAttempt();
        }
    }

    private void reconnectAttempt() {
        if (closed || healthy) {
            return;
        }
        if (!pool.isRunning()) {
            pool.connect();
        }
        reissueAll();
        long delay = backoff.nextDelayMs();
        logger.debug("Next activity reconnect attempt in {}ms", delay);
        reconnectTask = scheduler.schedule(this::reconnectAttempt, delay, TimeUnit.MILLISECONDS);
    }

    private void reissueAll() {
        List<Registration> current;
        synchronized (lock) {
            current = new ArrayList<>(registrations.values());
        }
        for (Registration registration : current) {
            pool.subscribe(registration.getSubscriptionId(), filterFor(registration.getCoordinate()), PURPOSE,
                ResubscribePolicy.AUTOMATIC);
            boolean stillCurrent;
            synchronized (lock) {
                stillCurrent = registrations.get(registration.getCoordinate()) == registration;
            }
            if (!stillCurrent) {
                // Closed or replaced while reissuing
                pool.unsubscribe(registration.getSubscriptionId());
            }
        }
    }

    ReconnectBackoff getBackoff() {
        return backoff;
    }

    /**
     * Close every registration and stop the heartbeat.
     */
    @Override
    public void close() {
        closed = true;
        ScheduledFuture<?> current = heartbeat;
        if (current != null) {
            current.cancel(false);
            heartbeat = null;
        }
        ScheduledFuture<?> pending = reconnectTask;
        if (pending != null) {
            pending.cancel(false);
        }
        List<Registration> all;
        synchronized (lock) {
            all = new ArrayList<>(registrations.values());
            registrations.clear();
        }
        for (Registration registration : all) {
            pool.unsubscribe(registration.getSubscriptionId());
        }
    }

    static final class Registration {
        private final String coordinate;
        private final ActivityHandler handler;
        private final String subscriptionId;

        Registration(String coordinate, ActivityHandler handler, String subscriptionId) {
            this.coordinate = coordinate;
            this.handler = handler;
            this.subscriptionId = subscriptionId;
        }

        String getCoordinate() { return coordinate; }
        ActivityHandler getHandler() { return handler; }
        String getSubscriptionId() { return subscriptionId; }
    }
}
