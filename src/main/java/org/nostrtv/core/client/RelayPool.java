package org.nostrtv.core.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.nostrtv.core.protocol.Event;
import org.nostrtv.core.protocol.Filter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Connections to a set of relays behind one subscribe/publish API and one merged inbound stream.
 * <p>
 * Subscriptions are recorded and replayed when a relay (re)opens. Two recovery loops run:
 * each relay reconnects on its own with exponential backoff after a socket failure, and a
 * pool-wide watchdog restarts every connection when no frame has arrived for the silence
 * threshold while subscriptions are active (relays that stop sending without dropping the socket).
 * Transport problems are logged and recovered here; they never fail an API call.
 */
public class RelayPool implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(RelayPool.class);

    public static final long DEFAULT_HEALTH_CHECK_INTERVAL_MS = 10_000;
    public static final long DEFAULT_SILENCE_THRESHOLD_MS = 60_000;

    private final RelayTransportFactory transportFactory;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final ObjectMapper jsonMapper = new ObjectMapper();

    private final Set<String> relayUrls = new CopyOnWriteArraySet<>();
    private final Map<String, RelayConnection> relayConnections = new ConcurrentHashMap<>();
    private final Map<String, SubscriptionInfo> subscriptions = new ConcurrentHashMap<>();
    private final List<Event> messageQueue = new CopyOnWriteArrayList<>();
    private final List<NostrEventListener> eventListeners = new CopyOnWriteArrayList<>();
    private final List<ConnectionEventListener> connectionListeners = new CopyOnWriteArrayList<>();

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.HEALTHY);
    private final AtomicLong lastMessageAt = new AtomicLong();
    private volatile boolean running = false;
    private volatile ScheduledFuture<?> healthCheck;

    private long healthCheckIntervalMs = DEFAULT_HEALTH_CHECK_INTERVAL_MS;
    private long silenceThresholdMs = DEFAULT_SILENCE_THRESHOLD_MS;
    private long reconnectIntervalMs = ReconnectBackoff.DEFAULT_INITIAL_DELAY_MS;
    private long maxReconnectIntervalMs = ReconnectBackoff.DEFAULT_MAX_DELAY_MS;
    private boolean autoReconnect = true;
    private volatile ReconnectBackoff recoveryBackoff = new ReconnectBackoff();

    public RelayPool(List<String> relayUrls, RelayTransportFactory transportFactory) {
        this(relayUrls, transportFactory, Clock.systemUTC(), null);
    }

    /**
     * @param scheduler scheduler for health checks and reconnects; null to create a private one
     */
    public RelayPool(List<String> relayUrls, RelayTransportFactory transportFactory,
                     Clock clock, ScheduledExecutorService scheduler) {
        this.relayUrls.addAll(relayUrls);
        this.transportFactory = transportFactory;
        this.clock = clock;
        if (scheduler != null) {
            this.scheduler = scheduler;
            this.ownsScheduler = false;
        } else {
            this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "relay-pool");
                thread.setDaemon(true);
                return thread;
            });
            this.ownsScheduler = true;
        }
    }

    // Configuration

    public void setAutoReconnect(boolean autoReconnect) { this.autoReconnect = autoReconnect; }
    public void setHealthCheckIntervalMs(long intervalMs) { this.healthCheckIntervalMs = intervalMs; }
    public void setSilenceThresholdMs(long thresholdMs) { this.silenceThresholdMs = thresholdMs; }

    /**
     * Initial and maximum reconnect delays, used by both recovery loops.
     */
    public void setReconnectIntervals(long initialMs, long maxMs) {
        this.reconnectIntervalMs = initialMs;
        this.maxReconnectIntervalMs = maxMs;
        this.recoveryBackoff = new ReconnectBackoff(initialMs, maxMs);
    }

    public void addEventListener(NostrEventListener listener) { eventListeners.add(listener); }
    public void removeEventListener(NostrEventListener listener) { eventListeners.remove(listener); }
    public void addConnectionListener(ConnectionEventListener listener) { connectionListeners.add(listener); }
    public void removeConnectionListener(ConnectionEventListener listener) { connectionListeners.remove(listener); }

    // Lifecycle

    /**
     * Open every configured relay and start the health check.
     *
     * @return future completing when every relay has opened; it fails if any relay fails its
     *         first attempt, while that relay keeps retrying in the background
     */
    public CompletableFuture<Void> connect() {
        running = true;
        lastMessageAt.set(clock.millis());
        startHealthCheck();

        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (String url : relayUrls) {
            futures.add(openRelay(url));
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
    }

    /**
     * Add a relay at runtime; opened immediately if the pool is running. Adding a known relay is a no-op.
     */
    public CompletableFuture<Void> addRelay(String relayUrl) {
        relayUrls.add(relayUrl);
        if (!running) {
            return CompletableFuture.completedFuture(null);
        }
        return openRelay(relayUrl);
    }

    /**
     * Close every connection and forget all subscriptions and queued events.
     */
    public void disconnect() {
        logger.info("Disconnecting from all relays");
        running = false;
        stopHealthCheck();

        for (RelayConnection connection : relayConnections.values()) {
            connection.close();
        }
        relayConnections.clear();
        subscriptions.clear();
        messageQueue.clear();
        setState(ConnectionState.HEALTHY);
    }

    /**
     * Disconnect and release the scheduler if this pool created it.
     */
    @Override
    public void close() {
        disconnect();
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isConnected() {
        return relayConnections.values().stream().anyMatch(RelayConnection::isConnected);
    }

    public Set<String> getConnectedRelays() {
        Set<String> connected = new HashSet<>();
        for (Map.Entry<String, RelayConnection> entry : relayConnections.entrySet()) {
            if (entry.getValue().isConnected()) {
                connected.add(entry.getKey());
            }
        }
        return connected;
    }

    public Set<String> getRelayUrls() {
        return new HashSet<>(relayUrls);
    }

    public ConnectionState getState() {
        return state.get();
    }

    public long getLastMessageAt() {
        return lastMessageAt.get();
    }

    // Subscriptions

    /**
     * Subscribe on every open relay; relays that open later receive it too.
     *
     * @param purpose short label used in logs and resubscription callbacks
     * @return the subscription id
     */
    public String subscribe(Filter filter, String purpose) {
        return subscribe(filter, purpose, ResubscribePolicy.AUTOMATIC);
    }

    public String subscribe(Filter filter, String purpose, ResubscribePolicy policy) {
        String subscriptionId = UUID.randomUUID().toString().replace("-", "").substring(0, 16);
        return subscribe(subscriptionId, filter, purpose, policy);
    }

    /**
     * Subscribe with a caller-chosen id. An existing subscription with the same id is replaced.
     */
    public String subscribe(String subscriptionId, Filter filter, String purpose, ResubscribePolicy policy) {
        subscriptions.put(subscriptionId, new SubscriptionInfo(subscriptionId, filter, purpose, policy));
        String json = requestFrame(subscriptionId, filter);
        if (json != null) {
            sendToConnected(json);
        }
        logger.debug("Subscribed {} ({}): {}", subscriptionId, purpose, filter);
        return subscriptionId;
    }

    /**
     * Close a subscription on all relays. Unknown ids are ignored.
     */
    public void unsubscribe(String subscriptionId) {
        if (subscriptions.remove(subscriptionId) == null) {
            return;
        }
        try {
            sendToConnected(jsonMapper.writeValueAsString(Arrays.asList("CLOSE", subscriptionId)));
            logger.debug("Unsubscribed: {}", subscriptionId);
        } catch (Exception e) {
            logger.error("Failed to unsubscribe {}", subscriptionId, e);
        }
    }

    public boolean hasSubscription(String subscriptionId) {
        return subscriptions.containsKey(subscriptionId);
    }

    public int getSubscriptionCount() {
        return subscriptions.size();
    }

    public List<SubscriptionInfo> getSubscriptions() {
        return new ArrayList<>(subscriptions.values());
    }

    // Publishing

    /**
     * Publish a signed event to every open relay. With no relay open the event is queued and sent
     * on the next open, and the returned future fails with {@link IllegalStateException}.
     */
    public CompletableFuture<String> publish(Event event) {
        CompletableFuture<String> future = new CompletableFuture<>();
        try {
            String json = jsonMapper.writeValueAsString(Arrays.asList("EVENT", event));
            if (sendToConnected(json) == 0) {
                logger.info("No connected relays, queued event {}", event.getId());
                messageQueue.add(event);
                future.completeExceptionally(new IllegalStateException("No connected relays, event queued"));
                return future;
            }
            future.complete(event.getId());
        } catch (Exception e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    // Health check

    private void startHealthCheck() {
        stopHealthCheck();
        healthCheck = scheduler.scheduleWithFixedDelay(() -> {
            try {
                checkHealth();
            } catch (RuntimeException e) {
                logger.error("Health check failed", e);
            }
        }, healthCheckIntervalMs, healthCheckIntervalMs, TimeUnit.MILLISECONDS);
    }

    private void stopHealthCheck() {
        ScheduledFuture<?> current = healthCheck;
        if (current != null) {
            current.cancel(false);
            healthCheck = null;
        }
    }

    /**
     * One watchdog pass: enter RECONNECTING if the pool has gone silent with subscriptions active.
     */
    void checkHealth() {
        if (!running || !autoReconnect || state.get() != ConnectionState.HEALTHY) {
            return;
        }
        long silence = clock.millis() - lastMessageAt.get();
        if (silence <= silenceThresholdMs || subscriptions.isEmpty()) {
            return;
        }
        if (state.compareAndSet(ConnectionState.HEALTHY, ConnectionState.RECONNECTING)) {
            logger.warn("No relay traffic for {}ms with {} subscriptions, restarting connections",
                silence, subscriptions.size());
            emitStateChanged(ConnectionState.RECONNECTING);
            for (RelayConnection connection : relayConnections.values()) {
                connection.close();
            }
            scheduleRecoveryAttempt();
        }
    }

    private void scheduleRecoveryAttempt() {
        long delay = recoveryBackoff.nextDelayMs();
        logger.info("Reopening relay connections in {}ms", delay);
        scheduler.schedule(this::recoveryAttempt, delay, TimeUnit.MILLISECONDS);
    }

    private void recoveryAttempt() {
        if (!running || state.get() != ConnectionState.RECONNECTING) {
            return;
        }
        for (String url : relayUrls) {
            RelayConnection connection = relayConnections.get(url);
            if (connection != null) {
                connection.close();
            }
            openRelay(url);
        }
        // Still RECONNECTING when this fires means nothing arrived; go around again with a longer delay.
        scheduleRecoveryAttempt();
    }

    private void markMessageReceived() {
        lastMessageAt.set(clock.millis());
        recoveryBackoff.reset();
        if (state.compareAndSet(ConnectionState.RECONNECTING, ConnectionState.HEALTHY)) {
            logger.info("Relay traffic resumed, pool healthy");
            emitStateChanged(ConnectionState.HEALTHY);
            // Relays that dropped while recovering had their own reconnect suppressed.
            for (String url : relayUrls) {
                RelayConnection connection = relayConnections.get(url);
                if (connection == null) {
                    openRelay(url);
                } else {
                    connection.retryIfIdle();
                }
            }
        }
    }

    private void setState(ConnectionState newState) {
        if (state.getAndSet(newState) != newState) {
            emitStateChanged(newState);
        }
    }

    // Inbound frames

    void handleRelayMessage(String relayUrl, String message) {
        markMessageReceived();
        try {
            @SuppressWarnings("unchecked")
            List<Object> json = jsonMapper.readValue(message, List.class);
            if (json.isEmpty() || !(json.get(0) instanceof String)) {
                logger.debug("Malformed frame from {}: {}", relayUrl, message);
                return;
            }

            String messageType = (String) json.get(0);
            switch (messageType) {
                case "EVENT":
                    handleEventMessage(relayUrl, json);
                    break;
                case "EOSE":
                    handleEoseMessage(relayUrl, json);
                    break;
                case "OK":
                    handleOkMessage(relayUrl, json);
                    break;
                case "NOTICE":
                    handleNoticeMessage(relayUrl, json);
                    break;
                default:
                    logger.debug("Unknown message type from {}: {}", relayUrl, messageType);
            }
        } catch (Exception e) {
            logger.warn("Dropping unparseable frame from {}: {}", relayUrl, e.getMessage());
        }
    }

    private void handleEventMessage(String relayUrl, List<Object> json) {
        if (json.size() < 3 || !(json.get(2) instanceof Map)) {
            logger.debug("EVENT frame without event object from {}", relayUrl);
            return;
        }
        String subscriptionId = String.valueOf(json.get(1));
        Event event = jsonMapper.convertValue(json.get(2), Event.class);
        for (NostrEventListener listener : eventListeners) {
            try {
                listener.onEvent(relayUrl, subscriptionId, event);
            } catch (Exception e) {
                logger.warn("Error in event listener", e);
            }
        }
    }

    private void handleEoseMessage(String relayUrl, List<Object> json) {
        String subscriptionId = json.size() > 1 ? String.valueOf(json.get(1)) : "";
        logger.debug("EOSE from {} for subscription: {}", relayUrl, subscriptionId);
        for (NostrEventListener listener : eventListeners) {
            try {
                listener.onEndOfStoredEvents(relayUrl, subscriptionId);
            } catch (Exception e) {
                logger.warn("Error in event listener", e);
            }
        }
    }

    private void handleOkMessage(String relayUrl, List<Object> json) {
        String eventId = json.size() > 1 ? String.valueOf(json.get(1)) : "unknown";
        boolean accepted = json.size() > 2 && Boolean.TRUE.equals(json.get(2));
        String statusMessage = json.size() > 3 ? String.valueOf(json.get(3)) : "";

        if (accepted) {
            logger.debug("Event accepted by {}: {}", relayUrl, eventId);
        } else {
            logger.warn("Event rejected by {}: {} - {}", relayUrl, eventId, statusMessage);
        }
        for (NostrEventListener listener : eventListeners) {
            try {
                listener.onOk(relayUrl, eventId, accepted, statusMessage);
            } catch (Exception e) {
                logger.warn("Error in event listener", e);
            }
        }
    }

    private void handleNoticeMessage(String relayUrl, List<Object> json) {
        String notice = json.size() > 1 ? String.valueOf(json.get(1)) : "";
        logger.info("Relay notice from {}: {}", relayUrl, notice);
        for (NostrEventListener listener : eventListeners) {
            try {
                listener.onNotice(relayUrl, notice);
            } catch (Exception e) {
                logger.warn("Error in event listener", e);
            }
        }
    }

    // Helpers

    private CompletableFuture<Void> openRelay(String relayUrl) {
        RelayConnection connection = relayConnections.computeIfAbsent(relayUrl, RelayConnection::new);
        return connection.open();
    }

    private int sendToConnected(String json) {
        int sent = 0;
        for (RelayConnection connection : relayConnections.values()) {
            if (connection.isConnected() && connection.send(json)) {
                sent++;
            }
        }
        return sent;
    }

    private String requestFrame(String subscriptionId, Filter filter) {
        try {
            return jsonMapper.writeValueAsString(Arrays.asList("REQ", subscriptionId, filter));
        } catch (Exception e) {
            logger.error("Failed to serialize filter for {}", subscriptionId, e);
            return null;
        }
    }

    /**
     * Close and report every EXTERNAL subscription; the caller re-issues them with fresh parameters.
     */
    private void releaseExternalSubscriptions() {
        for (SubscriptionInfo info : new ArrayList<>(subscriptions.values())) {
            if (info.getPolicy() == ResubscribePolicy.EXTERNAL && subscriptions.containsKey(info.getId())) {
                unsubscribe(info.getId());
                logger.info("Subscription {} ({}) needs to be re-issued by its owner", info.getId(), info.getPurpose());
                for (ConnectionEventListener listener : connectionListeners) {
                    try {
                        listener.onResubscribeRequired(info.getId(), info.getPurpose());
                    } catch (Exception e) {
                        logger.warn("Error in connection listener", e);
                    }
                }
            }
        }
    }

    private void emitStateChanged(ConnectionState newState) {
        for (ConnectionEventListener listener : connectionListeners) {
            try {
                listener.onStateChanged(newState);
            } catch (Exception e) {
                logger.warn("Error in connection listener", e);
            }
        }
    }

    private void emitConnectionEvent(String eventType, String relayUrl, Object extra) {
        for (ConnectionEventListener listener : connectionListeners) {
            try {
                switch (eventType) {
                    case "connect":
                        listener.onConnect(relayUrl);
                        break;
                    case "disconnect":
                        listener.onDisconnect(relayUrl, (String) extra);
                        break;
                    case "reconnecting":
                        listener.onReconnecting(relayUrl, (Integer) extra);
                        break;
                    case "reconnected":
                        listener.onReconnected(relayUrl);
                        break;
                    default:
                        break;
                }
            } catch (Exception e) {
                logger.warn("Error in connection listener", e);
            }
        }
    }

    /**
     * One relay. Each open creates a new transport; callbacks from a replaced transport are ignored.
     */
    private class RelayConnection {
        private final String url;
        private final ReconnectBackoff backoff = new ReconnectBackoff(reconnectIntervalMs, maxReconnectIntervalMs);
        private RelayTransport transport;
        private CompletableFuture<Void> connectFuture;
        private volatile boolean connected = false;
        private boolean wasConnected = false;

        RelayConnection(String url) {
            this.url = url;
        }

        boolean isConnected() {
            return connected;
        }

        synchronized CompletableFuture<Void> open() {
            if (transport != null) {
                return connectFuture;
            }
            logger.info("Connecting to relay: {}", url);
            connectFuture = new CompletableFuture<>();
            RelayTransport newTransport = transportFactory.create(url);
            transport = newTransport;
            newTransport.open(new TransportCallbacks(newTransport));
            return connectFuture;
        }

        synchronized void close() {
            RelayTransport current = transport;
            transport = null;
            connected = false;
            if (current != null) {
                current.close();
            }
        }

        boolean send(String message) {
            RelayTransport current;
            synchronized (this) {
                current = transport;
            }
            if (current == null || !current.send(message)) {
                logger.warn("Failed to send to {}", url);
                return false;
            }
            return true;
        }

        private synchronized boolean isCurrent(RelayTransport candidate) {
            return transport == candidate;
        }

        private void handleOpen(RelayTransport source) {
            boolean reconnect;
            CompletableFuture<Void> future;
            synchronized (this) {
                if (transport != source) {
                    return;
                }
                connected = true;
                reconnect = wasConnected;
                wasConnected = true;
                future = connectFuture;
            }
            backoff.reset();

            if (reconnect) {
                logger.info("Reconnected to relay: {}", url);
                emitConnectionEvent("reconnected", url, null);
                releaseExternalSubscriptions();
            } else {
                logger.info("Connected to relay: {}", url);
                emitConnectionEvent("connect", url, null);
            }
            if (future != null && !future.isDone()) {
                future.complete(null);
            }

            for (Event queued : messageQueue) {
                try {
                    if (send(jsonMapper.writeValueAsString(Arrays.asList("EVENT", queued)))) {
                        messageQueue.remove(queued);
                    }
                } catch (Exception e) {
                    logger.error("Failed to send queued event", e);
                }
            }

            for (SubscriptionInfo info : subscriptions.values()) {
                String json = requestFrame(info.getId(), info.getFilter());
                if (json != null) {
                    send(json);
                }
            }
        }

        private void handleDisconnect(RelayTransport source, Throwable error, String reason) {
            boolean wasOpen;
            CompletableFuture<Void> future;
            synchronized (this) {
                if (transport != source) {
                    return;
                }
                transport = null;
                wasOpen = connected;
                connected = false;
                future = connectFuture;
            }

            if (error instanceof EOFException) {
                logger.warn("Relay closed connection unexpectedly: {}", url);
            } else if (error != null) {
                logger.error("Relay connection failed: {} ({})", url, error.toString());
            } else {
                logger.info("Relay closed: {} - {}", url, reason);
            }

            if (wasOpen) {
                emitConnectionEvent("disconnect", url, reason);
            }
            if (future != null && !future.isDone()) {
                future.completeExceptionally(error != null ? error : new IllegalStateException(reason));
            }
            scheduleReconnect();
        }

        void retryIfIdle() {
            synchronized (this) {
                if (transport != null) {
                    return;
                }
            }
            scheduleReconnect();
        }

        private void scheduleReconnect() {
            if (!running || !autoReconnect || state.get() == ConnectionState.RECONNECTING) {
                return;
            }
            long delay = backoff.nextDelayMs();
            int attempt = backoff.getAttempts();
            logger.info("Scheduling reconnect to {} in {}ms (attempt {})", url, delay, attempt);
            emitConnectionEvent("reconnecting", url, attempt);

            scheduler.schedule(() -> {
                if (running && autoReconnect && relayConnections.get(url) == this) {
                    open();
                }
            }, delay, TimeUnit.MILLISECONDS);
        }

        private final class TransportCallbacks implements RelayTransport.Listener {
            private final RelayTransport source;

            TransportCallbacks(RelayTransport source) {
                this.source = source;
            }

            @Override
            public void onOpen() {
                handleOpen(source);
            }

            @Override
            public void onMessage(String text) {
                if (isCurrent(source)) {
                    handleRelayMessage(url, text);
                }
            }

            @Override
            public void onFailure(Throwable error) {
                handleDisconnect(source, error, error != null ? error.getMessage() : "Unknown error");
            }

            @Override
            public void onClosed(int code, String reason) {
                handleDisconnect(source, null, reason != null && !reason.isEmpty() ? reason : "Connection closed");
            }
        }
    }
}
