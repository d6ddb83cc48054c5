package org.nostrtv.core.client;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.nostrtv.core.activity.ActivityHandler;
import org.nostrtv.core.activity.ActivitySubscription;
import org.nostrtv.core.crypto.NostrKeyManager;
import org.nostrtv.core.model.ChatMessage;
import org.nostrtv.core.protocol.Event;
import org.nostrtv.core.protocol.EventKinds;
import org.nostrtv.core.protocol.UnsignedEvent;
import org.nostrtv.core.testing.FakeRelayTransport;
import org.nostrtv.core.testing.FakeRelayTransportFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

/**
 * End-to-end wiring: a frame on a relay socket reaches a stream activity handler.
 */
public class NostrTvClientTest {

    private static final String RELAY = "wss://relay.test";

    private FakeRelayTransportFactory factory;
    private NostrTvClient client;

    @Before
    public void setUp() {
        factory = new FakeRelayTransportFactory(true);
        NostrTvConfig config = NostrTvConfig.builder().relays(Collections.singletonList(RELAY)).build();
        client = new NostrTvClient(config, factory, Clock.systemUTC());
    }

    @After
    public void tearDown() {
        client.close();
    }

    @Test
    public void testChatMessageReachesActivityHandler() throws Exception {
        client.start().get(5, TimeUnit.SECONDS);
        NostrKeyManager host = NostrKeyManager.generate();
        NostrKeyManager viewer = NostrKeyManager.generate();
        String coordinate = "30311:" + host.getPublicKeyHex().toUpperCase() + ":show";

        BlockingQueue<ChatMessage> received = new LinkedBlockingQueue<>();
        ActivitySubscription subscription = client.getActivityRouter().subscribe(coordinate, new ActivityHandler() {
            @Override
            public void onChatMessage(ChatMessage message) {
                received.add(message);
            }
        });

        List<List<String>> tags = new ArrayList<>();
        tags.add(UnsignedEvent.tag("a", "30311:" + host.getPublicKeyHex() + ":show", "", "root"));
        Event chat = viewer.signEvent(UnsignedEvent.now(EventKinds.LIVE_CHAT_MESSAGE, tags, "hello stream"));
        FakeRelayTransport transport = factory.latest(RELAY);
        transport.simulateEvent("any", chat);
        // Same event from a second delivery is dropped
        transport.simulateEvent("any", chat);

        ChatMessage message = received.poll(5, TimeUnit.SECONDS);
        assertNotNull(message);
        assertEquals("hello stream", message.getContent());
        assertEquals(subscription.getCoordinate(), message.getCoordinate());
        assertNull(received.poll(200, TimeUnit.MILLISECONDS));

        subscription.close();
        assertFalse(client.getActivityRouter().isSubscribed(coordinate));
    }

    @Test
    public void testSubscribeUserData() throws Exception {
        client.start().get(5, TimeUnit.SECONDS);
        String pubkey = NostrKeyManager.generate().getPublicKeyHex();

        String id = client.subscribeUserData(pubkey);

        assertTrue(client.getRelayPool().hasSubscription(id));
        List<List<Object>> requests = factory.latest(RELAY).getSentFrames("REQ");
        assertEquals(id, requests.get(requests.size() - 1).get(1));
    }
}
