package org.nostrtv.core.client;

import org.junit.After;
import org.junit.Test;
import org.nostrtv.core.router.ValidationMode;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.*;

/**
 * Unit tests for client configuration.
 */
public class NostrTvConfigTest {

    @After
    public void tearDown() {
        System.clearProperty("nostrtv.relays");
        System.clearProperty("nostrtv.validation");
        System.clearProperty("nostrtv.signer.timeoutMs");
        System.clearProperty("nostrtv.profile.capacity");
    }

    @Test
    public void testDefaults() {
        NostrTvConfig config = NostrTvConfig.defaults();

        assertEquals(NostrTvConfig.DEFAULT_RELAYS, config.getRelays());
        assertEquals(ValidationMode.FULL, config.getValidationMode());
        assertEquals(500, config.getProfileCacheCapacity());
        assertEquals(30_000, config.getSignerRequestTimeoutMs());
        assertEquals(1000, config.getReconnectInitialDelayMs());
        assertEquals(30_000, config.getReconnectMaxDelayMs());
    }

    @Test
    public void testBuilderOverrides() {
        NostrTvConfig config = NostrTvConfig.builder()
            .relays(Collections.singletonList("wss://relay.test"))
            .validationMode(ValidationMode.SKIP_SIGNATURE)
            .reconnectDelays(500, 5000)
            .profileCacheCapacity(10)
            .build();

        assertEquals(Collections.singletonList("wss://relay.test"), config.getRelays());
        assertEquals(ValidationMode.SKIP_SIGNATURE, config.getValidationMode());
        assertEquals(500, config.getReconnectInitialDelayMs());
        assertEquals(10, config.getProfileCacheCapacity());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNoRelaysRejected() {
        NostrTvConfig.builder().relays(Collections.emptyList()).build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveCapacityRejected() {
        NostrTvConfig.builder().profileCacheCapacity(0).build();
    }

    @Test
    public void testFromSystemProperties() {
        System.setProperty("nostrtv.relays", "wss://one.test, wss://two.test,");
        System.setProperty("nostrtv.validation", "Skip-Signature");
        System.setProperty("nostrtv.signer.timeoutMs", "5000");
        System.setProperty("nostrtv.profile.capacity", "42");

        NostrTvConfig config = NostrTvConfig.fromSystemProperties();

        assertEquals(Arrays.asList("wss://one.test", "wss://two.test"), config.getRelays());
        assertEquals(ValidationMode.SKIP_SIGNATURE, config.getValidationMode());
        assertEquals(5000, config.getSignerRequestTimeoutMs());
        assertEquals(42, config.getProfileCacheCapacity());
    }
}
