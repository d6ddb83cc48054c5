package org.nostrtv.core.client;

import org.nostrtv.core.activity.ActivityRouter;
import org.nostrtv.core.activity.LiveActivityPublisher;
import org.nostrtv.core.cache.ProfileCache;
import org.nostrtv.core.cache.RelayProfileFetcher;
import org.nostrtv.core.cache.SlidingWindowRateLimiter;
import org.nostrtv.core.crypto.EventSigner;
import org.nostrtv.core.protocol.EventKinds;
import org.nostrtv.core.protocol.Filter;
import org.nostrtv.core.router.EventRouter;
import org.nostrtv.core.signer.RemoteSignerClient;
import org.nostrtv.core.validation.EventValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Wires the client components together: one relay pool feeding one event router, which feeds
 * the profile cache, the remote signer and the stream activity router.
 * <p>
 * Create one per application and pass its components to whatever needs them.
 *
 * <pre>{@code
 * NostrTvClient client = new NostrTvClient(NostrTvConfig.defaults());
 * client.getEventRouter().addListener(myListener);
 * client.start();
 * client.subscribeLiveStreams(100);
 * }</pre>
 */
public class NostrTvClient implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(NostrTvClient.class);

    private final NostrTvConfig config;
    private final ScheduledExecutorService scheduler;
    private final RelayPool relayPool;
    private final EventRouter eventRouter;
    private final ProfileCache profileCache;
    private final RemoteSignerClient remoteSigner;
    private final ActivityRouter activityRouter;

    public NostrTvClient(NostrTvConfig config) {
        this(config, OkHttpRelayTransport.factory(OkHttpRelayTransport.createHttpClient(config.getPingIntervalMs())),
            Clock.systemUTC());
    }

    public NostrTvClient(NostrTvConfig config, RelayTransportFactory transportFactory, Clock clock) {
        this.config = config;
        this.scheduler = Executors.newScheduledThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, "nostrtv-scheduler");
            thread.setDaemon(true);
            return thread;
        });

        this.relayPool = new RelayPool(config.getRelays(), transportFactory, clock, scheduler);
        relayPool.setHealthCheckIntervalMs(config.getHealthCheckIntervalMs());
        relayPool.setSilenceThresholdMs(config.getSilenceThresholdMs());
        relayPool.setReconnectIntervals(config.getReconnectInitialDelayMs(), config.getReconnectMaxDelayMs());

        SlidingWindowRateLimiter lookupLimiter =
            new SlidingWindowRateLimiter(config.getProfileLookupsPerSecond(), 1000, clock, scheduler);
        this.profileCache = new ProfileCache(
            new RelayProfileFetcher(relayPool, scheduler, config.getProfileLookupWindowMs()),
            scheduler, clock, config.getProfileTtlMs(), config.getProfileCacheCapacity(), lookupLimiter);
        profileCache.setPendingWindowMs(config.getProfileLookupWindowMs());

        EventValidator validator = new EventValidator(clock, config.getFutureToleranceSeconds());
        this.eventRouter = new EventRouter(validator, profileCache);
        eventRouter.setValidationMode(config.getValidationMode());

        this.remoteSigner = new RemoteSignerClient(relayPool, scheduler, clock);
        remoteSigner.setRequestTimeoutMs(config.getSignerRequestTimeoutMs());
        remoteSigner.setScanTimeoutMs(config.getSignerScanTimeoutMs());

        this.activityRouter = new ActivityRouter(relayPool, scheduler, clock,
            new ReconnectBackoff(config.getReconnectInitialDelayMs(), config.getReconnectMaxDelayMs()));
        activityRouter.setHeartbeatIntervalMs(config.getActivityHeartbeatIntervalMs());
        activityRouter.setSilenceThresholdMs(config.getActivitySilenceThresholdMs());

        relayPool.addEventListener(eventRouter);
        eventRouter.addListener(remoteSigner);
        eventRouter.addListener(activityRouter);
    }

    /**
     * Connect to the configured relays and start health monitoring.
     */
    public CompletableFuture<Void> start() {
        logger.info("Starting with {} relays", config.getRelays().size());
        activityRouter.start();
        return relayPool.connect();
    }

    /**
     * Subscribe to live stream announcements (kind 30311).
     *
     * @return subscription id
     */
    public String subscribeLiveStreams(int limit) {
        return relayPool.subscribe(Filter.builder().kinds(EventKinds.LIVE_EVENT).limit(limit).build(), "live-streams");
    }

    /**
     * Subscribe to a user's profile, follow list and relay list.
     *
     * @return subscription id
     */
    public String subscribeUserData(String pubkey) {
        Filter filter = Filter.builder()
            .kinds(EventKinds.METADATA, EventKinds.FOLLOW_LIST, EventKinds.RELAY_LIST)
            .authors(pubkey)
            .build();
        return relayPool.subscribe(filter, "user-data");
    }

    /**
     * Publisher signing with the given identity, e.g. {@link #getRemoteSigner()} or a local key.
     */
    public LiveActivityPublisher createPublisher(EventSigner signer) {
        return new LiveActivityPublisher(relayPool, signer);
    }

    public NostrTvConfig getConfig() { return config; }
    public RelayPool getRelayPool() { return relayPool; }
    public EventRouter getEventRouter() { return eventRouter; }
    public ProfileCache getProfileCache() { return profileCache; }
    public RemoteSignerClient getRemoteSigner() { return remoteSigner; }
    public ActivityRouter getActivityRouter() { return activityRouter; }

    @Override
    public void close() {
        logger.info("Shutting down");
        activityRouter.close();
        remoteSigner.disconnect();
        eventRouter.close();
        relayPool.close();
        scheduler.shutdownNow();
    }
}
