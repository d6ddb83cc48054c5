package org.nostrtv.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Test;
import org.nostrtv.core.protocol.Event;
import org.nostrtv.core.protocol.EventKinds;
import org.nostrtv.core.protocol.UnsignedEvent;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

/**
 * Unit tests for zap receipt parsing.
 */
public class ZapReceiptTest {

    private static final String SENDER = "79be667ef9dcbbac55a06295ce870b07029bfcdb2dce28d959f2815b16f81798";
    private static final String HOST_UPPER = "F9308A019258C31049344F85F89D5229B531C845836F99B08601F113BCE036F9";

    private final ObjectMapper mapper = new ObjectMapper();

    private Event receipt(String bolt11, String description) {
        List<List<String>> tags = new ArrayList<>();
        tags.add(UnsignedEvent.tag("bolt11", bolt11));
        tags.add(UnsignedEvent.tag("description", description));
        return new UnsignedEvent(EventKinds.ZAP_RECEIPT, 1700000000L, tags, "").toEvent(SENDER);
    }

    @Test
    public void testParseStreamZap() throws Exception {
        String description = "{\"pubkey\":\"" + SENDER + "\",\"content\":\"great stream\","
            + "\"tags\":[[\"a\",\"30311:" + HOST_UPPER + ":live\"],[\"amount\",\"21000\"]]}";

        ZapReceipt zap = ZapReceipt.fromEvent(receipt("lnbc210n1pjqqqqq", description), mapper, pubkey -> "alice");

        assertEquals(21_000L, zap.getAmountMillisats());
        assertEquals(21L, zap.getAmountSats());
        assertEquals(SENDER, zap.getSenderPubkey());
        assertEquals("alice", zap.getSenderName());
        assertEquals("great stream", zap.getComment());
        assertEquals("30311:" + HOST_UPPER.toLowerCase() + ":live", zap.getCoordinate());
        assertEquals(1700000000L, zap.getCreatedAt());
    }

    @Test
    public void testAmountFallsBackToRequest() throws Exception {
        String description = "{\"pubkey\":\"" + SENDER + "\",\"content\":\"\",\"tags\":[[\"amount\",\"5000\"],[\"e\",\"abc\"]]}";

        ZapReceipt zap = ZapReceipt.fromEvent(receipt("lnbc1pjqqqqq", description), mapper, pubkey -> null);

        assertEquals(5_000L, zap.getAmountMillisats());
        assertNull(zap.getCoordinate());
        assertEquals("abc", zap.getZappedEventId());
        assertNull(zap.getSenderName());
    }
}
