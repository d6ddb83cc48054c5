package org.nostrtv.core.cache;

import org.nostrtv.core.model.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Profile metadata by pubkey with time-to-live expiry and least-recently-accessed eviction,
 * plus deduplicated, rate-limited outbound lookups.
 * <p>
 * Entries live under one lock; the pending-lookup set is a concurrent set of its own and the
 * rate limiter has its own lock. No method holds two of them at once.
 */
public class ProfileCache {

    private static final Logger logger = LoggerFactory.getLogger(ProfileCache.class);

    public static final long DEFAULT_TTL_MS = TimeUnit.HOURS.toMillis(24);
    public static final int DEFAULT_CAPACITY = 500;
    public static final double EVICTION_FRACTION = 0.2;
    public static final long DEFAULT_PENDING_WINDOW_MS = 30_000;
    public static final int DEFAULT_LOOKUPS_PER_SECOND = 10;
    public static final int DEFAULT_BATCH_SIZE = 30;
    public static final long DEFAULT_BATCH_DELAY_MS = 100;

    private final Object entriesLock = new Object();
    private final Map<String, ProfileCacheEntry> entries = new HashMap<>();
    private final Set<String> pendingLookups = ConcurrentHashMap.newKeySet();

    private final ProfileFetcher fetcher;
    private final SlidingWindowRateLimiter rateLimiter;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    private final long ttlMs;
    private final int capacity;
    private long pendingWindowMs = DEFAULT_PENDING_WINDOW_MS;
    private int batchSize = DEFAULT_BATCH_SIZE;
    private long batchDelayMs = DEFAULT_BATCH_DELAY_MS;

    public ProfileCache(ProfileFetcher fetcher, ScheduledExecutorService scheduler) {
        this(fetcher, scheduler, Clock.systemUTC(), DEFAULT_TTL_MS, DEFAULT_CAPACITY,
            new SlidingWindowRateLimiter(DEFAULT_LOOKUPS_PER_SECOND, 1000, Clock.systemUTC(), scheduler));
    }

    public ProfileCache(ProfileFetcher fetcher, ScheduledExecutorService scheduler, Clock clock,
                        long ttlMs, int capacity, SlidingWindowRateLimiter rateLimiter) {
        this.fetcher = fetcher;
        this.scheduler = scheduler;
        this.clock = clock;
        this.ttlMs = ttlMs;
        this.capacity = capacity;
        this.rateLimiter = rateLimiter;
    }

    public void setPendingWindowMs(long pendingWindowMs) { this.pendingWindowMs = pendingWindowMs; }
    public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
    public void setBatchDelayMs(long batchDelayMs) { this.batchDelayMs = batchDelayMs; }

    public long getPendingWindowMs() { return pendingWindowMs; }

    // Entries

    /**
     * The cached profile, or null if absent or expired. A hit counts as an access for eviction.
     */
    public Profile get(String pubkey) {
        String key = key(pubkey);
        long now = clock.millis();
        synchronized (entriesLock) {
            ProfileCacheEntry entry = entries.get(key);
            if (entry == null) {
                return null;
            }
            if (entry.isExpired(now, ttlMs)) {
                entries.remove(key);
                return null;
            }
            entry.touch(now);
            return entry.getProfile();
        }
    }

    /**
     * Insert or replace, then evict expired entries and, if still over capacity, the least
     * recently accessed fifth of the capacity. A profile older than the cached one for the same
     * pubkey is dropped.
     *
     * @return false if the profile was older than the cached one
     */
    public boolean put(Profile profile) {
        String key = key(profile.getPubkey());
        long now = clock.millis();
        int evicted;
        synchronized (entriesLock) {
            ProfileCacheEntry existing = entries.get(key);
            if (existing != null && !existing.isExpired(now, ttlMs)
                    && existing.getProfile().getCreatedAt() > profile.getCreatedAt()) {
                logger.debug("Ignoring stale profile for {}", profile.getPubkey());
                return false;
            }
            entries.put(key, new ProfileCacheEntry(profile, now));
            evicted = evict(now);
        }
        pendingLookups.remove(key);
        if (evicted > 0) {
            logger.debug("Evicted {} profile(s), {} cached", evicted, size());
        }
        return true;
    }

    public boolean contains(String pubkey) {
        return get(pubkey) != null;
    }

    /**
     * Best display name for a pubkey if its profile is cached, else null.
     */
    public String getDisplayName(String pubkey) {
        Profile profile = get(pubkey);
        return profile != null ? profile.getBestName() : null;
    }

    public void remove(String pubkey) {
        synchronized (entriesLock) {
            entries.remove(key(pubkey));
        }
    }

    public int size() {
        synchronized (entriesLock) {
            return entries.size();
        }
    }

    public void clear() {
        synchronized (entriesLock) {
            entries.clear();
        }
        pendingLookups.clear();
        rateLimiter.clear();
    }

    private int evict(long now) {
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(now, ttlMs));
        if (entries.size() > capacity) {
            int toRemove = (int) Math.ceil(capacity * EVICTION_FRACTION);
            List<Map.Entry<String, ProfileCacheEntry>> byAccess = new ArrayList<>(entries.entrySet());
            byAccess.sort(Comparator.comparingLong(e -> e.getValue().getLastAccessedAt()));
            Iterator<Map.Entry<String, ProfileCacheEntry>> oldest = byAccess.iterator();
            for (int i = 0; i < toRemove && oldest.hasNext(); i++) {
                entries.remove(oldest.next().getKey());
            }
        }
        return before - entries.size();
    }

    // Lookups

    /**
     * Ask relays for a profile unless it is cached or already being fetched.
     *
     * @return true if a fetch was scheduled
     */
    public boolean requestLookup(String pubkey) {
        if (pubkey == null || pubkey.isEmpty()) {
            return false;
        }
        String key = key(pubkey);
        if (contains(key) || !markPending(key)) {
            return false;
        }
        logger.debug("Requesting profile for {}", key);
        rateLimiter.submit(() -> fetcher.fetchProfiles(List.of(key)));
        return true;
    }

    /**
     * Batched lookup: drops cached and pending pubkeys, then fetches the rest in chunks spaced by
     * the batch delay.
     *
     * @return number of pubkeys scheduled
     */
    public int requestLookups(Collection<String> pubkeys) {
        List<String> needed = new ArrayList<>();
        for (String pubkey : new LinkedHashSet<>(pubkeys)) {
            if (pubkey == null || pubkey.isEmpty()) {
                continue;
            }
            String key = key(pubkey);
            if (!contains(key) && markPending(key)) {
                needed.add(key);
            }
        }
        for (int start = 0, chunkIndex = 0; start < needed.size(); start += batchSize, chunkIndex++) {
            List<String> chunk = new ArrayList<>(needed.subList(start, Math.min(start + batchSize, needed.size())));
            Runnable fetch = () -> rateLimiter.submit(() -> fetcher.fetchProfiles(chunk));
            if (chunkIndex == 0) {
                fetch.run();
            } else {
                scheduler.schedule(fetch, chunkIndex * batchDelayMs, TimeUnit.MILLISECONDS);
            }
        }
        if (!needed.isEmpty()) {
            logger.debug("Requesting {} profile(s) in {} chunk(s)", needed.size(),
                (needed.size() + batchSize - 1) / batchSize);
        }
        return needed.size();
    }

    public boolean isPending(String pubkey) {
        return pendingLookups.contains(key(pubkey));
    }

    private boolean markPending(String key) {
        if (!pendingLookups.add(key)) {
            return false;
        }
        // Cleared after the window whether or not a profile arrived, so a lost reply can be retried.
        scheduler.schedule(() -> pendingLookups.remove(key), pendingWindowMs, TimeUnit.MILLISECONDS);
        return true;
    }

    private static String key(String pubkey) {
        return pubkey.toLowerCase(Locale.ROOT);
    }
}
