package org.nostrtv.core.model;

import org.junit.Test;
import org.nostrtv.core.protocol.Event;
import org.nostrtv.core.protocol.EventKinds;
import org.nostrtv.core.protocol.UnsignedEvent;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

/**
 * Unit tests for live event parsing.
 */
public class LiveStreamTest {

    private static final String AUTHOR = "79be667ef9dcbbac55a06295ce870b07029bfcdb2dce28d959f2815b16f81798";
    private static final String HOST = "f9308a019258c31049344f85f89d5229b531c845836f99b08601f113bce036f9";

    @SafeVarargs
    private static Event liveEvent(List<String>... tags) {
        return new UnsignedEvent(EventKinds.LIVE_EVENT, 1700000000L, new ArrayList<>(Arrays.asList(tags)), "")
            .toEvent(AUTHOR);
    }

    @Test
    public void testFullEvent() {
        LiveStream stream = LiveStream.fromEvent(liveEvent(
            UnsignedEvent.tag("d", "stream-1"),
            UnsignedEvent.tag("title", "Morning show"),
            UnsignedEvent.tag("summary", "coffee"),
            UnsignedEvent.tag("streaming", "https://cdn.example/live.m3u8"),
            UnsignedEvent.tag("status", "live"),
            UnsignedEvent.tag("p", HOST, "", "host"),
            UnsignedEvent.tag("current_participants", "42"),
            UnsignedEvent.tag("t", "music"),
            UnsignedEvent.tag("t", "talk")));

        assertEquals("stream-1", stream.getStreamId());
        assertEquals("Morning show - coffee", stream.getTitle());
        assertEquals("https://cdn.example/live.m3u8", stream.getStreamingUrl());
        assertTrue(stream.isLive());
        assertEquals(HOST, stream.getHostPubkey());
        assertEquals(Integer.valueOf(42), stream.getViewerCount());
        assertEquals(Arrays.asList("music", "talk"), stream.getTopics());
        assertEquals("30311:" + AUTHOR + ":stream-1", stream.getCoordinate());
    }

    @Test
    public void testDefaults() {
        LiveStream stream = LiveStream.fromEvent(liveEvent(
            UnsignedEvent.tag("d", "old"),
            UnsignedEvent.tag("current_participants", "many")));

        assertEquals("(No title)", stream.getTitle());
        assertEquals("ended://old", stream.getStreamingUrl());
        assertEquals(LiveStream.STATUS_UNKNOWN, stream.getStatus());
        assertFalse(stream.isLive());
        assertEquals(AUTHOR, stream.getHostPubkey());
        assertNull(stream.getViewerCount());
    }

    @Test
    public void testStatusNormalizedToLowerCase() {
        LiveStream stream = LiveStream.fromEvent(liveEvent(
            UnsignedEvent.tag("d", "stream-2"),
            UnsignedEvent.tag("status", "LIVE")));

        assertEquals(LiveStream.STATUS_LIVE, stream.getStatus());
        assertTrue(stream.isLive());
    }
}
