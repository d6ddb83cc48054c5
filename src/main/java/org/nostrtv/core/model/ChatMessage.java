package org.nostrtv.core.model;

import org.nostrtv.core.protocol.Coordinate;
import org.nostrtv.core.protocol.Event;

/**
 * Live chat message (kind 1311, NIP-53) posted to a stream.
 */
public class ChatMessage {

    /** Event id, used for deduplication */
    private final String id;

    private final String senderPubkey;

    /** Sender name from the profile cache at the time of receipt, may be null */
    private final String senderName;

    private final String content;

    private final long createdAt;

    /** Normalized coordinate of the stream the message belongs to */
    private final String coordinate;

    public ChatMessage(String id, String senderPubkey, String senderName, String content,
                       long createdAt, String coordinate) {
        this.id = id;
        this.senderPubkey = senderPubkey;
        this.senderName = senderName;
        this.content = content;
        this.createdAt = createdAt;
        this.coordinate = coordinate;
    }

    public static ChatMessage fromEvent(Event event, String senderName) {
        return new ChatMessage(event.getId(), event.getPubkey(), senderName, event.getContent(),
            event.getCreatedAtOrZero(), Coordinate.normalize(event.getTagValue("a")));
    }

    public String getId() { return id; }
    public String getSenderPubkey() { return senderPubkey; }
    public String getSenderName() { return senderName; }
    public String getContent() { return content; }
    public long getCreatedAt() { return createdAt; }
    public String getCoordinate() { return coordinate; }

    @Override
    public String toString() {
        return "ChatMessage{id=" + Profile.shortPubkey(id) + ", sender=" + Profile.shortPubkey(senderPubkey)
            + ", coordinate=" + coordinate + "}";
    }
}
