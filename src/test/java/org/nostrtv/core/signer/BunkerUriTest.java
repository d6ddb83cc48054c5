package org.nostrtv.core.signer;

import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.*;

public class BunkerUriTest {

    private static final String SIGNER = "79be667ef9dcbbac55a06295ce870b07029bfcdb2dce28d959f2815b16f81798";

    @Test
    public void testParseBunkerUri() throws Exception {
        BunkerUri uri = BunkerUri.parse("bunker://" + SIGNER.toUpperCase()
            + "?relay=wss%3A%2F%2Frelay.nsec.app&relay=wss://second.test&secret=abc123");

        assertEquals(SIGNER, uri.getSignerPubkey());
        assertEquals("wss://relay.nsec.app", uri.getRelay());
        assertEquals(Arrays.asList("wss://relay.nsec.app", "wss://second.test"), uri.getRelays());
        assertEquals("abc123", uri.getSecret());
    }

    @Test
    public void testSecretIsOptional() throws Exception {
        BunkerUri uri = BunkerUri.parse("bunker://" + SIGNER + "?relay=wss://relay.test&secret=");

        assertNull(uri.getSecret());
    }

    @Test
    public void testBunkerUriToStringParsesBack() throws Exception {
        BunkerUri uri = BunkerUri.parse("bunker://" + SIGNER + "?relay=wss://relay.test&secret=a%20b");

        String text = uri.toString();
        assertEquals("bunker://" + SIGNER + "?relay=wss%3A%2F%2Frelay.test&secret=a%20b", text);
        assertEquals("a b", BunkerUri.parse(text).getSecret());
    }

    @Test
    public void testRejectsInvalidBunkerUris() {
        assertInvalid(null);
        assertInvalid("nostrconnect://" + SIGNER + "?relay=wss://relay.test");
        assertInvalid("bunker://" + SIGNER);
        assertInvalid("bunker://abc?relay=wss://relay.test");
        assertInvalid("bunker://" + SIGNER + "?secret=x");
    }

    private static void assertInvalid(String text) {
        try {
            BunkerUri.parse(text);
            fail("Expected INVALID_URI for " + text);
        } catch (RemoteSignerException e) {
            assertEquals(RemoteSignerException.Reason.INVALID_URI, e.getReason());
        }
    }

    @Test
    public void testNostrConnectUriRoundTrip() throws Exception {
        NostrConnectUri uri = new NostrConnectUri(SIGNER, "wss://relay.test", "s3cret", "nostr TV", "https://tv.example");

        String text = uri.toString();
        assertTrue(text.startsWith("nostrconnect://" + SIGNER + "?relay=wss%3A%2F%2Frelay.test"));
        assertTrue(text.contains("&name=nostr%20TV"));

        NostrConnectUri parsed = NostrConnectUri.parse(text);
        assertEquals(SIGNER, parsed.getClientPubkey());
        assertEquals("wss://relay.test", parsed.getRelay());
        assertEquals("s3cret", parsed.getSecret());
        assertEquals("nostr TV", parsed.getAppName());
        assertEquals("https://tv.example", parsed.getAppUrl());
    }

    @Test
    public void testNostrConnectUriRequiresRelay() {
        try {
            NostrConnectUri.parse("nostrconnect://" + SIGNER + "?secret=x");
            fail("Expected INVALID_URI");
        } catch (RemoteSignerException e) {
            assertEquals(RemoteSignerException.Reason.INVALID_URI, e.getReason());
        }
    }
}
