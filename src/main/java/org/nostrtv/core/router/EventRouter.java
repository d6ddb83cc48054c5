package org.nostrtv.core.router;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.nostrtv.core.cache.ProfileCache;
import org.nostrtv.core.client.NostrEventListener;
import org.nostrtv.core.model.FollowList;
import org.nostrtv.core.model.RelayList;
import org.nostrtv.core.protocol.Event;
import org.nostrtv.core.protocol.EventKinds;
import org.nostrtv.core.validation.EventValidationException;
import org.nostrtv.core.validation.EventValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Validates inbound events and dispatches them by kind.
 * <p>
 * Relay threads only enqueue; validation, parsing and listener callbacks run on one dispatch
 * executor, so events are handled one at a time in the order the pool delivered them. The same
 * event arriving from several relays is handled once.
 */
public class EventRouter implements NostrEventListener, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(EventRouter.class);

    static final int SEEN_CAPACITY = 4096;

    private final EventValidator validator;
    private final ProfileCache profileCache;
    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final Executor dispatchExecutor;
    private final ExecutorService ownedExecutor;

    private final Map<Integer, EventHandler> handlers = new ConcurrentHashMap<>();
    private final List<RoutedEventListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, Boolean> seenIds = new LinkedHashMap<String, Boolean>(256, 0.75f, false) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
            return size() > SEEN_CAPACITY;
        }
    };

    private final FollowListEventHandler followListHandler;
    private final RelayListEventHandler relayListHandler;

    private volatile ValidationMode validationMode = ValidationMode.FULL;

    public EventRouter(EventValidator validator, ProfileCache profileCache) {
        this(validator, profileCache, null);
    }

    /**
     * @param dispatchExecutor executor for validation and callbacks; it must run tasks one at a
     *                         time in submission order. Null creates a private single thread.
     */
    public EventRouter(EventValidator validator, ProfileCache profileCache, Executor dispatchExecutor) {
        this.validator = validator;
        this.profileCache = profileCache;
        if (dispatchExecutor != null) {
            this.dispatchExecutor = dispatchExecutor;
            this.ownedExecutor = null;
        } else {
            this.ownedExecutor = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable, "event-router");
                thread.setDaemon(true);
                return thread;
            });
            this.dispatchExecutor = ownedExecutor;
        }

        this.followListHandler = new FollowListEventHandler(this);
        this.relayListHandler = new RelayListEventHandler(this);
        registerHandler(EventKinds.METADATA, new ProfileEventHandler(this));
        registerHandler(EventKinds.FOLLOW_LIST, followListHandler);
        registerHandler(EventKinds.RELAY_LIST, relayListHandler);
        registerHandler(EventKinds.LIVE_CHAT_MESSAGE, new LiveChatEventHandler(this));
        registerHandler(EventKinds.ZAP_RECEIPT, new ZapReceiptEventHandler(this));
        registerHandler(EventKinds.LIVE_EVENT, new LiveStreamEventHandler(this));
        registerHandler(EventKinds.NOSTR_CONNECT, new RemoteSignerEventHandler(this));
    }

    // Configuration

    public void setValidationMode(ValidationMode validationMode) { this.validationMode = validationMode; }
    public ValidationMode getValidationMode() { return validationMode; }

    public void addListener(RoutedEventListener listener) { listeners.add(listener); }
    public void removeListener(RoutedEventListener listener) { listeners.remove(listener); }

    /**
     * Route a kind to the given handler, replacing any existing one.
     */
    public void registerHandler(int kind, EventHandler handler) {
        handlers.put(kind, handler);
    }

    public void unregisterHandler(int kind) {
        handlers.remove(kind);
    }

    public boolean hasHandler(int kind) {
        return handlers.containsKey(kind);
    }

    // Inbound

    @Override
    public void onEvent(String relayUrl, String subscriptionId, Event event) {
        try {
            dispatchExecutor.execute(() -> route(event));
        } catch (RejectedExecutionException e) {
            logger.debug("Router closed, dropping event {} from {}", event.getId(), relayUrl);
        }
    }

    @Override
    public void onNotice(String relayUrl, String message) {
        logger.info("Notice from {}: {}", relayUrl, message);
    }

    /**
     * Validate and dispatch one event on the calling thread.
     *
     * @return true if a handler ran
     */
    boolean route(Event event) {
        EventHandler handler = handlers.get(event.getKind());
        if (handler == null) {
            logger.debug("No handler for kind {}", event.getKind());
            return false;
        }
        String id = event.getId();
        if (id != null && isSeen(id)) {
            return false;
        }

        try {
            if (validationMode == ValidationMode.FULL || event.getKind() == EventKinds.NOSTR_CONNECT) {
                validator.validate(event);
            } else {
                validator.validateWithoutSignature(event);
            }
        } catch (EventValidationException e) {
            logger.debug("Dropping invalid {} event {}: {}", EventKinds.getName(event.getKind()), id, e.getMessage());
            return false;
        }
        // Marked only once valid, so a forged copy cannot shadow the genuine event.
        markSeen(id);

        try {
            handler.handle(event);
        } catch (Exception e) {
            logger.warn("Handler for kind {} failed on event {}", event.getKind(), id, e);
        }
        return true;
    }

    private boolean isSeen(String id) {
        synchronized (seenIds) {
            return seenIds.containsKey(id);
        }
    }

    private void markSeen(String id) {
        synchronized (seenIds) {
            seenIds.put(id, Boolean.TRUE);
        }
    }

    // Handler support

    ObjectMapper getJsonMapper() {
        return jsonMapper;
    }

    ProfileCache getProfileCache() {
        return profileCache;
    }

    /**
     * Cached display name for a pubkey; on a miss, queue a lookup and return null.
     */
    String resolveName(String pubkey) {
        if (pubkey == null) {
            return null;
        }
        String name = profileCache.getDisplayName(pubkey);
        if (name == null) {
            profileCache.requestLookup(pubkey);
        }
        return name;
    }

    void notifyListeners(Consumer<RoutedEventListener> callback) {
        for (RoutedEventListener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (RuntimeException e) {
                logger.error("Routed event listener failed", e);
            }
        }
    }

    // Queries

    /**
     * Newest follow list seen for an author, or null.
     */
    public FollowList getFollowList(String pubkey) {
        return followListHandler.get(pubkey);
    }

    /**
     * Newest relay list seen for an author, or null.
     */
    public RelayList getRelayList(String pubkey) {
        return relayListHandler.get(pubkey);
    }

    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
        listeners.clear();
    }
}
