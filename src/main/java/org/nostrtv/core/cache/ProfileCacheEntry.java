package org.nostrtv.core.cache;

import org.nostrtv.core.model.Profile;

/**
 * A cached profile with its bookkeeping timestamps (epoch millis). Mutated only under the
 * owning cache's lock.
 */
public class ProfileCacheEntry {

    private final Profile profile;
    private final long insertedAt;
    private long lastAccessedAt;

    ProfileCacheEntry(Profile profile, long insertedAt) {
        this.profile = profile;
        this.insertedAt = insertedAt;
        this.lastAccessedAt = insertedAt;
    }

    public Profile getProfile() { return profile; }
    public long getInsertedAt() { return insertedAt; }
    public long getLastAccessedAt() { return lastAccessedAt; }

    void touch(long now) {
        this.lastAccessedAt = now;
    }

    boolean isExpired(long now, long ttlMs) {
        return now - insertedAt > ttlMs;
    }
}
