package org.nostrtv.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.nostrtv.core.protocol.Coordinate;
import org.nostrtv.core.protocol.Event;

import java.io.IOException;
import java.util.function.Function;

/**
 * Zap receipt (kind 9735, NIP-57). The payer, comment and target come from the zap request
 * embedded in the {@code description} tag; the amount comes from the invoice.
 */
public class ZapReceipt {

    private final String id;
    private final long amountMillisats;
    private final String senderPubkey;
    private final String senderName;
    private final String comment;
    private final long createdAt;

    /** Normalized stream coordinate, or null when the zap targets an event instead */
    private final String coordinate;

    /** Zapped event id from the {@code e} tag, may be null */
    private final String zappedEventId;

    private final String bolt11;

    public ZapReceipt(String id, long amountMillisats, String senderPubkey, String senderName,
                      String comment, long createdAt, String coordinate, String zappedEventId, String bolt11) {
        this.id = id;
        this.amountMillisats = amountMillisats;
        this.senderPubkey = senderPubkey;
        this.senderName = senderName;
        this.comment = comment;
        this.createdAt = createdAt;
        this.coordinate = coordinate;
        this.zappedEventId = zappedEventId;
        this.bolt11 = bolt11;
    }

    /**
     * Parse a receipt that has already passed validation.
     *
     * @param senderName resolved name of the payer, may be null
     * @throws IOException if the description is not JSON
     */
    public static ZapReceipt fromEvent(Event event, ObjectMapper jsonMapper,
                                       Function<String, String> senderName) throws IOException {
        String bolt11 = event.getTagValue("bolt11");
        JsonNode zapRequest = jsonMapper.readTree(event.getTagValue("description"));

        String sender = zapRequest.path("pubkey").asText(null);
        String comment = zapRequest.path("content").asText("");

        String coordinate = tagValue(zapRequest, "a");
        if (coordinate == null) {
            coordinate = event.getTagValue("a");
        }
        String zappedEvent = tagValue(zapRequest, "e");
        if (zappedEvent == null) {
            zappedEvent = event.getTagValue("e");
        }

        Long amount = Bolt11.amountMillisats(bolt11);
        if (amount == null) {
            String requested = tagValue(zapRequest, "amount");
            amount = parseLongOrZero(requested);
        }

        return new ZapReceipt(event.getId(), amount, sender, sender != null ? senderName.apply(sender) : null,
            comment, event.getCreatedAtOrZero(), Coordinate.normalize(coordinate), zappedEvent, bolt11);
    }

    private static String tagValue(JsonNode zapRequest, String name) {
        for (JsonNode tag : zapRequest.path("tags")) {
            if (tag.isArray() && tag.size() > 1 && name.equals(tag.get(0).asText())) {
                return tag.get(1).asText();
            }
        }
        return null;
    }

    private static long parseLongOrZero(String value) {
        if (value == null) {
            return 0L;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    public String getId() { return id; }
    public long getAmountMillisats() { return amountMillisats; }
    public long getAmountSats() { return amountMillisats / 1000; }
    public String getSenderPubkey() { return senderPubkey; }
    public String getSenderName() { return senderName; }
    public String getComment() { return comment; }
    public long getCreatedAt() { return createdAt; }
    public String getCoordinate() { return coordinate; }
    public String getZappedEventId() { return zappedEventId; }
    public String getBolt11() { return bolt11; }

    @Override
    public String toString() {
        return "ZapReceipt{id=" + Profile.shortPubkey(id) + ", sats=" + getAmountSats()
            + ", sender=" + Profile.shortPubkey(senderPubkey) + ", coordinate=" + coordinate + "}";
    }
}
