package org.nostrtv.core.client;

import org.junit.Before;
import org.junit.Test;
import org.nostrtv.core.crypto.NostrKeyManager;
import org.nostrtv.core.protocol.Event;
import org.nostrtv.core.protocol.EventKinds;
import org.nostrtv.core.protocol.Filter;
import org.nostrtv.core.protocol.UnsignedEvent;
import org.nostrtv.core.testing.FakeRelayTransport;
import org.nostrtv.core.testing.FakeRelayTransportFactory;
import org.nostrtv.core.testing.ManualScheduler;
import org.nostrtv.core.testing.MutableClock;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;

import static org.junit.Assert.*;

/**
 * Unit tests for the relay pool: subscriptions, publishing and both recovery loops.
 */
public class RelayPoolTest {

    private static final String RELAY_A = "wss://relay-a.test";
    private static final String RELAY_B = "wss://relay-b.test";

    private MutableClock clock;
    private ManualScheduler scheduler;
    private final List<String> connectionEvents = new CopyOnWriteArrayList<>();
    private final List<ConnectionState> states = new CopyOnWriteArrayList<>();
    private final List<String> resubscribeRequests = new CopyOnWriteArrayList<>();

    @Before
    public void setUp() {
        clock = new MutableClock(1_700_000_000_000L);
        scheduler = new ManualScheduler(clock);
    }

    private RelayPool createPool(FakeRelayTransportFactory factory, String... relays) {
        RelayPool pool = new RelayPool(Arrays.asList(relays), factory, clock, scheduler);
        pool.addConnectionListener(new ConnectionEventListener() {
            @Override
            public void onConnect(String relayUrl) { connectionEvents.add("connect " + relayUrl); }

            @Override
            public void onDisconnect(String relayUrl, String reason) { connectionEvents.add("disconnect " + relayUrl); }

            @Override
            public void onReconnecting(String relayUrl, int attempt) { connectionEvents.add("reconnecting " + attempt); }

            @Override
            public void onReconnected(String relayUrl) { connectionEvents.add("reconnected " + relayUrl); }

            @Override
            public void onStateChanged(ConnectionState state) { states.add(state); }

            @Override
            public void onResubscribeRequired(String subscriptionId, String purpose) {
                resubscribeRequests.add(subscriptionId + "/" + purpose);
            }
        });
        return pool;
    }

    private static List<String> subscriptionIds(List<List<Object>> frames) {
        List<String> ids = new ArrayList<>();
        for (List<Object> frame : frames) {
            ids.add((String) frame.get(1));
        }
        return ids;
    }

    @Test
    public void testConnectOpensEveryRelay() {
        FakeRelayTransportFactory factory = new FakeRelayTransportFactory(true);
        RelayPool pool = createPool(factory, RELAY_A, RELAY_B);

        CompletableFuture<Void> connected = pool.connect();

        assertTrue(connected.isDone());
        assertFalse(connected.isCompletedExceptionally());
        assertTrue(pool.isRunning());
        assertEquals(2, pool.getConnectedRelays().size());
        assertTrue(connectionEvents.contains("connect " + RELAY_A));
        assertTrue(connectionEvents.contains("connect " + RELAY_B));
    }

    @Test
    public void testSubscriptionsSentOnOpenAndAfterwards() throws Exception {
        FakeRelayTransportFactory factory = new FakeRelayTransportFactory(true);
        RelayPool pool = createPool(factory, RELAY_A);
        String early = pool.subscribe(Filter.builder().kinds(EventKinds.LIVE_EVENT).build(), "live-streams");

        pool.connect();
        String late = pool.subscribe(Filter.builder().kinds(EventKinds.METADATA).build(), "profiles");

        FakeRelayTransport transport = factory.latest(RELAY_A);
        assertEquals(Arrays.asList(early, late), subscriptionIds(transport.getSentFrames("REQ")));
        assertEquals(2, pool.getSubscriptionCount());
    }

    @Test
    public void testUnsubscribe() throws Exception {
        FakeRelayTransportFactory factory = new FakeRelayTransportFactory(true);
        RelayPool pool = createPool(factory, RELAY_A);
        pool.connect();
        String id = pool.subscribe(Filter.builder().kinds(1).build(), "notes");

        pool.unsubscribe(id);
        pool.unsubscribe("unknown");
        pool.unsubscribe(id);

        assertEquals(Collections.singletonList(id), subscriptionIds(factory.latest(RELAY_A).getSentFrames("CLOSE")));
        assertFalse(pool.hasSubscription(id));
    }

    @Test
    public void testSubscribeWithSameIdReplaces() {
        RelayPool pool = createPool(new FakeRelayTransportFactory(true), RELAY_A);

        pool.subscribe("fixed", Filter.builder().kinds(1).build(), "first", ResubscribePolicy.AUTOMATIC);
        pool.subscribe("fixed", Filter.builder().kinds(2).build(), "second", ResubscribePolicy.AUTOMATIC);

        assertEquals(1, pool.getSubscriptionCount());
        assertEquals("second", pool.getSubscriptions().get(0).getPurpose());
    }

    @Test
    public void testPublishQueuedUntilRelayOpens() throws Exception {
        FakeRelayTransportFactory factory = new FakeRelayTransportFactory(false);
        RelayPool pool = createPool(factory, RELAY_A);
        pool.connect();
        Event event = NostrKeyManager.generate().signEvent(
            new UnsignedEvent(EventKinds.TEXT_NOTE, 1_700_000_000L, new ArrayList<>(), "queued"));

        CompletableFuture<String> published = pool.publish(event);

        assertTrue(published.isCompletedExceptionally());
        try {
            published.get();
            fail("Expected queued publish to fail");
        } catch (ExecutionException e) {
            assertTrue(e.getCause() instanceof IllegalStateException);
            assertEquals("No connected relays, event queued", e.getCause().getMessage());
        }
        FakeRelayTransport transport = factory.latest(RELAY_A);
        assertTrue(transport.getSentFrames("EVENT").isEmpty());

        transport.simulateOpen();

        List<Event> sent = transport.getPublishedEvents();
        assertEquals(1, sent.size());
        assertEquals(event.getId(), sent.get(0).getId());
    }

    @Test
    public void testInboundFramesReachListeners() throws Exception {
        FakeRelayTransportFactory factory = new FakeRelayTransportFactory(true);
        RelayPool pool = createPool(factory, RELAY_A);
        List<String> received = new CopyOnWriteArrayList<>();
        pool.addEventListener(new NostrEventListener() {
            @Override
            public void onEvent(String relayUrl, String subscriptionId, Event event) {
                received.add("event " + subscriptionId + " " + event.getContent());
            }

            @Override
            public void onEndOfStoredEvents(String relayUrl, String subscriptionId) {
                received.add("eose " + subscriptionId);
            }

            @Override
            public void onOk(String relayUrl, String eventId, boolean accepted, String message) {
                received.add("ok " + eventId + " " + accepted);
            }

            @Override
            public void onNotice(String relayUrl, String message) {
                received.add("notice " + message);
            }
        });
        pool.connect();
        FakeRelayTransport transport = factory.latest(RELAY_A);
        Event event = new UnsignedEvent(EventKinds.TEXT_NOTE, 1_700_000_000L, new ArrayList<>(), "hello")
            .toEvent("79be667ef9dcbbac55a06295ce870b07029bfcdb2dce28d959f2815b16f81798");

        transport.simulateEvent("sub1", event);
        transport.simulateMessage("[\"EOSE\",\"sub1\"]");
        transport.simulateMessage("[\"OK\",\"abc\",true,\"\"]");
        transport.simulateMessage("[\"NOTICE\",\"slow down\"]");
        transport.simulateMessage("not json");
        transport.simulateMessage("[\"EVENT\",\"sub1\"]");

        assertEquals(Arrays.asList("event sub1 hello", "eose sub1", "ok abc true", "notice slow down"), received);
    }

    @Test
    public void testReconnectWithBackoffAfterSocketFailure() {
        FakeRelayTransportFactory factory = new FakeRelayTransportFactory(false);
        RelayPool pool = createPool(factory, RELAY_A);
        pool.connect();
        factory.latest(RELAY_A).simulateOpen();

        factory.latest(RELAY_A).simulateFailure(new IOException("reset"));

        assertFalse(pool.isConnected());
        assertTrue(connectionEvents.contains("disconnect " + RELAY_A));
        assertTrue(connectionEvents.contains("reconnecting 1"));

        scheduler.advance(999);
        assertEquals(1, factory.getCreated(RELAY_A).size());
        scheduler.advance(1);
        assertEquals(2, factory.getCreated(RELAY_A).size());

        // Second attempt fails before opening: the delay doubles
        factory.latest(RELAY_A).simulateFailure(new IOException("refused"));
        assertTrue(connectionEvents.contains("reconnecting 2"));
        scheduler.advance(1999);
        assertEquals(2, factory.getCreated(RELAY_A).size());
        scheduler.advance(1);
        assertEquals(3, factory.getCreated(RELAY_A).size());

        factory.latest(RELAY_A).simulateOpen();
        assertTrue(pool.isConnected());
        assertTrue(connectionEvents.contains("reconnected " + RELAY_A));
    }

    @Test
    public void testReopenReplaysAutomaticAndReleasesExternal() throws Exception {
        FakeRelayTransportFactory factory = new FakeRelayTransportFactory(false);
        RelayPool pool = createPool(factory, RELAY_A);
        pool.connect();
        factory.latest(RELAY_A).simulateOpen();
        String automatic = pool.subscribe(Filter.builder().kinds(EventKinds.LIVE_EVENT).build(), "live-streams");
        String external = pool.subscribe(Filter.builder().kinds(EventKinds.METADATA).authors("ab").build(),
            "profile-lookup", ResubscribePolicy.EXTERNAL);

        factory.latest(RELAY_A).simulateClose(1001, "going away");
        scheduler.advance(1000);
        FakeRelayTransport reopened = factory.latest(RELAY_A);
        reopened.simulateOpen();

        assertEquals(Collections.singletonList(automatic), subscriptionIds(reopened.getSentFrames("REQ")));
        assertEquals(Collections.singletonList(external), subscriptionIds(reopened.getSentFrames("CLOSE")));
        assertEquals(Collections.singletonList(external + "/profile-lookup"), resubscribeRequests);
        assertTrue(pool.hasSubscription(automatic));
        assertFalse(pool.hasSubscription(external));
    }

    @Test
    public void testExternalSubscriptionKeptOnFirstOpen() throws Exception {
        FakeRelayTransportFactory factory = new FakeRelayTransportFactory(true);
        RelayPool pool = createPool(factory, RELAY_A);
        String external = pool.subscribe(Filter.builder().kinds(EventKinds.METADATA).build(),
            "profile-lookup", ResubscribePolicy.EXTERNAL);

        pool.connect();

        assertEquals(Collections.singletonList(external), subscriptionIds(factory.latest(RELAY_A).getSentFrames("REQ")));
        assertTrue(resubscribeRequests.isEmpty());
    }

    @Test
    public void testSilenceWatchdogRestartsConnections() throws Exception {
        FakeRelayTransportFactory factory = new FakeRelayTransportFactory(true);
        RelayPool pool = createPool(factory, RELAY_A);
        pool.connect();
        pool.subscribe(Filter.builder().kinds(EventKinds.LIVE_CHAT_MESSAGE).build(), "chat");

        scheduler.advance(RelayPool.DEFAULT_SILENCE_THRESHOLD_MS);
        assertEquals(ConnectionState.HEALTHY, pool.getState());

        scheduler.advance(RelayPool.DEFAULT_HEALTH_CHECK_INTERVAL_MS);
        assertEquals(ConnectionState.RECONNECTING, pool.getState());
        assertEquals(Collections.singletonList(ConnectionState.RECONNECTING), states);
        assertTrue(factory.getCreated(RELAY_A).get(0).isClosed());

        scheduler.advance(1000);
        assertEquals(2, factory.getCreated(RELAY_A).size());
        assertEquals(ConnectionState.RECONNECTING, pool.getState());

        factory.latest(RELAY_A).simulateMessage("[\"EOSE\",\"x\"]");
        assertEquals(ConnectionState.HEALTHY, pool.getState());
        assertEquals(Arrays.asList(ConnectionState.RECONNECTING, ConnectionState.HEALTHY), states);

        // The pending recovery attempt sees a healthy pool and does nothing
        scheduler.advance(2000);
        assertEquals(2, factory.getCreated(RELAY_A).size());
    }

    @Test
    public void testRelayFailingDuringRecoveryIsRetried() throws Exception {
        FakeRelayTransportFactory factory = new FakeRelayTransportFactory(false);
        RelayPool pool = createPool(factory, RELAY_A, RELAY_B);
        pool.connect();
        factory.latest(RELAY_A).simulateOpen();
        factory.latest(RELAY_B).simulateOpen();
        pool.subscribe(Filter.builder().kinds(EventKinds.LIVE_CHAT_MESSAGE).build(), "chat");

        scheduler.advance(RelayPool.DEFAULT_SILENCE_THRESHOLD_MS + RelayPool.DEFAULT_HEALTH_CHECK_INTERVAL_MS);
        assertEquals(ConnectionState.RECONNECTING, pool.getState());

        scheduler.advance(1000);
        assertEquals(2, factory.getCreated(RELAY_A).size());
        assertEquals(2, factory.getCreated(RELAY_B).size());

        factory.latest(RELAY_A).simulateOpen();
        factory.latest(RELAY_B).simulateFailure(new IOException("refused"));
        factory.latest(RELAY_A).simulateMessage("[\"EOSE\",\"x\"]");
        assertEquals(ConnectionState.HEALTHY, pool.getState());
        assertEquals(Collections.singleton(RELAY_A), pool.getConnectedRelays());

        scheduler.advance(1000);
        assertEquals(3, factory.getCreated(RELAY_B).size());

        factory.latest(RELAY_B).simulateOpen();
        assertTrue(pool.getConnectedRelays().contains(RELAY_A));
        assertTrue(pool.getConnectedRelays().contains(RELAY_B));
        assertEquals(1, factory.latest(RELAY_B).getSentFrames("REQ").size());
    }

    @Test
    public void testWatchdogIdleWithoutSubscriptions() {
        FakeRelayTransportFactory factory = new FakeRelayTransportFactory(true);
        RelayPool pool = createPool(factory, RELAY_A);
        pool.connect();

        scheduler.advance(5 * RelayPool.DEFAULT_SILENCE_THRESHOLD_MS);

        assertEquals(ConnectionState.HEALTHY, pool.getState());
        assertEquals(1, factory.getCreated(RELAY_A).size());
    }

    @Test
    public void testAddRelay() {
        FakeRelayTransportFactory factory = new FakeRelayTransportFactory(true);
        RelayPool pool = createPool(factory, RELAY_A);

        pool.addRelay(RELAY_B);
        assertTrue(factory.getCreated(RELAY_B).isEmpty());

        pool.connect();
        assertEquals(1, factory.getCreated(RELAY_B).size());

        pool.addRelay("wss://relay-c.test");
        assertTrue(pool.getConnectedRelays().contains("wss://relay-c.test"));
    }

    @Test
    public void testDisconnectForgetsState() throws Exception {
        FakeRelayTransportFactory factory = new FakeRelayTransportFactory(true);
        RelayPool pool = createPool(factory, RELAY_A);
        pool.connect();
        pool.subscribe(Filter.builder().kinds(1).build(), "notes");

        pool.disconnect();

        assertFalse(pool.isRunning());
        assertFalse(pool.isConnected());
        assertEquals(0, pool.getSubscriptionCount());
        assertTrue(factory.latest(RELAY_A).isClosed());
    }
}
