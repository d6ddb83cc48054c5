package org.nostrtv.core.client;

import org.nostrtv.core.cache.ProfileCache;
import org.nostrtv.core.router.ValidationMode;
import org.nostrtv.core.signer.RemoteSignerClient;
import org.nostrtv.core.validation.EventValidator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Settings for {@link NostrTvClient}. Every value has a default; use {@link #builder()} to
 * override some, or {@link #fromSystemProperties()} to read overrides from {@code nostrtv.*}
 * system properties.
 */
public class NostrTvConfig {

    public static final List<String> DEFAULT_RELAYS = Collections.unmodifiableList(Arrays.asList(
        "wss://relay.snort.social",
        "wss://relay.tunestr.io",
        "wss://relay.damus.io",
        "wss://relay.primal.net",
        "wss://purplepag.es"
    ));

    public static final long DEFAULT_PING_INTERVAL_MS = 30_000;

    private final List<String> relays;
    private final long pingIntervalMs;
    private final long healthCheckIntervalMs;
    private final long silenceThresholdMs;
    private final long reconnectInitialDelayMs;
    private final long reconnectMaxDelayMs;
    private final ValidationMode validationMode;
    private final long futureToleranceSeconds;
    private final int profileCacheCapacity;
    private final long profileTtlMs;
    private final int profileLookupsPerSecond;
    private final long profileLookupWindowMs;
    private final long signerRequestTimeoutMs;
    private final long signerScanTimeoutMs;
    private final long activityHeartbeatIntervalMs;
    private final long activitySilenceThresholdMs;

    private NostrTvConfig(Builder builder) {
        this.relays = Collections.unmodifiableList(new ArrayList<>(builder.relays));
        this.pingIntervalMs = builder.pingIntervalMs;
        this.healthCheckIntervalMs = builder.healthCheckIntervalMs;
        this.silenceThresholdMs = builder.silenceThresholdMs;
        this.reconnectInitialDelayMs = builder.reconnectInitialDelayMs;
        this.reconnectMaxDelayMs = builder.reconnectMaxDelayMs;
        this.validationMode = builder.validationMode;
        this.futureToleranceSeconds = builder.futureToleranceSeconds;
        this.profileCacheCapacity = builder.profileCacheCapacity;
        this.profileTtlMs = builder.profileTtlMs;
        this.profileLookupsPerSecond = builder.profileLookupsPerSecond;
        this.profileLookupWindowMs = builder.profileLookupWindowMs;
        this.signerRequestTimeoutMs = builder.signerRequestTimeoutMs;
        this.signerScanTimeoutMs = builder.signerScanTimeoutMs;
        this.activityHeartbeatIntervalMs = builder.activityHeartbeatIntervalMs;
        this.activitySilenceThresholdMs = builder.activitySilenceThresholdMs;
    }

    public static NostrTvConfig defaults() {
        return builder().build();
    }

    /**
     * Defaults overridden by any of these system properties:
     * {@code nostrtv.relays} (comma separated), {@code nostrtv.validation} ({@code full} or
     * {@code skip-signature}), {@code nostrtv.pingIntervalMs}, {@code nostrtv.silenceThresholdMs},
     * {@code nostrtv.signer.timeoutMs}, {@code nostrtv.profile.capacity}.
     */
    public static NostrTvConfig fromSystemProperties() {
        Builder builder = builder();
        String relays = System.getProperty("nostrtv.relays");
        if (relays != null && !relays.trim().isEmpty()) {
            List<String> urls = new ArrayList<>();
            for (String url : relays.split(",")) {
                if (!url.trim().isEmpty()) {
                    urls.add(url.trim());
                }
            }
            builder.relays(urls);
        }
        String validation = System.getProperty("nostrtv.validation");
        if (validation != null) {
            builder.validationMode("skip-signature".equals(validation.trim().toLowerCase(Locale.ROOT))
                ? ValidationMode.SKIP_SIGNATURE : ValidationMode.FULL);
        }
        builder.pingIntervalMs(Long.getLong("nostrtv.pingIntervalMs", builder.pingIntervalMs));
        builder.silenceThresholdMs(Long.getLong("nostrtv.silenceThresholdMs", builder.silenceThresholdMs));
        builder.signerRequestTimeoutMs(Long.getLong("nostrtv.signer.timeoutMs", builder.signerRequestTimeoutMs));
        builder.profileCacheCapacity(Integer.getInteger("nostrtv.profile.capacity", builder.profileCacheCapacity));
        return builder.build();
    }

    public List<String> getRelays() { return relays; }
    public long getPingIntervalMs() { return pingIntervalMs; }
    public long getHealthCheckIntervalMs() { return healthCheckIntervalMs; }
    public long getSilenceThresholdMs() { return silenceThresholdMs; }
    public long getReconnectInitialDelayMs() { return reconnectInitialDelayMs; }
    public long getReconnectMaxDelayMs() { return reconnectMaxDelayMs; }
    public ValidationMode getValidationMode() { return validationMode; }
    public long getFutureToleranceSeconds() { return futureToleranceSeconds; }
    public int getProfileCacheCapacity() { return profileCacheCapacity; }
    public long getProfileTtlMs() { return profileTtlMs; }
    public int getProfileLookupsPerSecond() { return profileLookupsPerSecond; }
    public long getProfileLookupWindowMs() { return profileLookupWindowMs; }
    public long getSignerRequestTimeoutMs() { return signerRequestTimeoutMs; }
    public long getSignerScanTimeoutMs() { return signerScanTimeoutMs; }
    public long getActivityHeartbeatIntervalMs() { return activityHeartbeatIntervalMs; }
    public long getActivitySilenceThresholdMs() { return activitySilenceThresholdMs; }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private List<String> relays = new ArrayList<>(DEFAULT_RELAYS);
        private long pingIntervalMs = DEFAULT_PING_INTERVAL_MS;
        private long healthCheckIntervalMs = RelayPool.DEFAULT_HEALTH_CHECK_INTERVAL_MS;
        private long silenceThresholdMs = RelayPool.DEFAULT_SILENCE_THRESHOLD_MS;
        private long reconnectInitialDelayMs = ReconnectBackoff.DEFAULT_INITIAL_DELAY_MS;
        private long reconnectMaxDelayMs = ReconnectBackoff.DEFAULT_MAX_DELAY_MS;
        private ValidationMode validationMode = ValidationMode.FULL;
        private long futureToleranceSeconds = EventValidator.DEFAULT_FUTURE_TOLERANCE_SECONDS;
        private int profileCacheCapacity = ProfileCache.DEFAULT_CAPACITY;
        private long profileTtlMs = ProfileCache.DEFAULT_TTL_MS;
        private int profileLookupsPerSecond = ProfileCache.DEFAULT_LOOKUPS_PER_SECOND;
        private long profileLookupWindowMs = ProfileCache.DEFAULT_PENDING_WINDOW_MS;
        private long signerRequestTimeoutMs = RemoteSignerClient.DEFAULT_REQUEST_TIMEOUT_MS;
        private long signerScanTimeoutMs = RemoteSignerClient.DEFAULT_SCAN_TIMEOUT_MS;
        private long activityHeartbeatIntervalMs = 5_000;
        private long activitySilenceThresholdMs = 15_000;

        public Builder relays(List<String> relays) { this.relays = new ArrayList<>(relays); return this; }
        public Builder pingIntervalMs(long pingIntervalMs) { this.pingIntervalMs = pingIntervalMs; return this; }
        public Builder healthCheckIntervalMs(long intervalMs) { this.healthCheckIntervalMs = intervalMs; return this; }
        public Builder silenceThresholdMs(long thresholdMs) { this.silenceThresholdMs = thresholdMs; return this; }
        public Builder reconnectDelays(long initialMs, long maxMs) {
            this.reconnectInitialDelayMs = initialMs;
            this.reconnectMaxDelayMs = maxMs;
            return this;
        }
        public Builder validationMode(ValidationMode validationMode) { this.validationMode = validationMode; return this; }
        public Builder futureToleranceSeconds(long seconds) { this.futureToleranceSeconds = seconds; return this; }
        public Builder profileCacheCapacity(int capacity) { this.profileCacheCapacity = capacity; return this; }
        public Builder profileTtlMs(long ttlMs) { this.profileTtlMs = ttlMs; return this; }
        public Builder profileLookupsPerSecond(int lookups) { this.profileLookupsPerSecond = lookups; return this; }
        public Builder profileLookupWindowMs(long windowMs) { this.profileLookupWindowMs = windowMs; return this; }
        public Builder signerRequestTimeoutMs(long timeoutMs) { this.signerRequestTimeoutMs = timeoutMs; return this; }
        public Builder signerScanTimeoutMs(long timeoutMs) { this.signerScanTimeoutMs = timeoutMs; return this; }
        public Builder activityHeartbeatIntervalMs(long intervalMs) { this.activityHeartbeatIntervalMs = intervalMs; return this; }
        public Builder activitySilenceThresholdMs(long thresholdMs) { this.activitySilenceThresholdMs = thresholdMs; return this; }

        public NostrTvConfig build() {
            if (relays.isEmpty()) {
                throw new IllegalArgumentException("At least one relay is required");
            }
            if (profileCacheCapacity <= 0 || profileLookupsPerSecond <= 0) {
                throw new IllegalArgumentException("Profile cache limits must be positive");
            }
            return new NostrTvConfig(this);
        }
    }
}
