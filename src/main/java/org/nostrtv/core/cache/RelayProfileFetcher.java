package org.nostrtv.core.cache;

import org.nostrtv.core.client.RelayPool;
import org.nostrtv.core.client.ResubscribePolicy;
import org.nostrtv.core.protocol.EventKinds;
import org.nostrtv.core.protocol.Filter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Fetches metadata events through the relay pool. Each lookup is a short-lived subscription
 * closed once the lookup window has passed; replies reach the cache through the event router.
 */
public class RelayProfileFetcher implements ProfileFetcher {

    private static final Logger logger = LoggerFactory.getLogger(RelayProfileFetcher.class);

    static final String PURPOSE = "profile-lookup";

    private final RelayPool pool;
    private final ScheduledExecutorService scheduler;
    private final long subscriptionLifetimeMs;

    public RelayProfileFetcher(RelayPool pool, ScheduledExecutorService scheduler, long subscriptionLifetimeMs) {
        this.pool = pool;
        this.scheduler = scheduler;
        this.subscriptionLifetimeMs = subscriptionLifetimeMs;
    }

    @Override
    public void fetchProfiles(List<String> pubkeys) {
        if (pubkeys.isEmpty()) {
            return;
        }
        Filter filter = Filter.builder()
            .kinds(EventKinds.METADATA)
            .authors(pubkeys)
            .limit(pubkeys.size())
            .build();
        // The author list is a one-off; after a reconnect the cache's pending window decides on retries.
        String subscriptionId = pool.subscribe(filter, PURPOSE, ResubscribePolicy.EXTERNAL);
        logger.debug("Profile lookup {} for {} pubkey(s)", subscriptionId, pubkeys.size());
        scheduler.schedule(() -> pool.unsubscribe(subscriptionId), subscriptionLifetimeMs, TimeUnit.MILLISECONDS);
    }
}
