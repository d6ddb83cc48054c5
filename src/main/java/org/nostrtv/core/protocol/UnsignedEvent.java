package org.nostrtv.core.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Event template awaiting a signature. The pubkey is filled in by whoever signs it,
 * which for a remote signer is only known after the handshake.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UnsignedEvent {

    @JsonProperty("kind")
    private final int kind;

    @JsonProperty("created_at")
    private final long createdAt;

    @JsonProperty("tags")
    private final List<List<String>> tags;

    @JsonProperty("content")
    private final String content;

    public UnsignedEvent(int kind, long createdAt, List<List<String>> tags, String content) {
        this.kind = kind;
        this.createdAt = createdAt;
        this.tags = new ArrayList<>();
        if (tags != null) {
            for (List<String> tag : tags) {
                this.tags.add(new ArrayList<>(tag));
            }
        }
        this.content = content != null ? content : "";
    }

    /**
     * Template stamped with the current time.
     */
    public static UnsignedEvent now(int kind, List<List<String>> tags, String content) {
        return new UnsignedEvent(kind, System.currentTimeMillis() / 1000, tags, content);
    }

    public static List<String> tag(String... values) {
        return new ArrayList<>(Arrays.asList(values));
    }

    public int getKind() { return kind; }
    public long getCreatedAt() { return createdAt; }
    public List<List<String>> getTags() { return tags; }
    public String getContent() { return content; }

    /**
     * Attach an author and compute the id; the result still lacks a signature.
     */
    public Event toEvent(String pubkey) {
        Event event = new Event(null, pubkey, createdAt, kind, tags, content, null);
        event.setId(EventIds.calculateId(event));
        return event;
    }
}
