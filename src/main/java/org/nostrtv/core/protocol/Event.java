package org.nostrtv.core.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Signed Nostr event as delivered by relays (NIP-01).
 * <p>
 * {@code createdAt} is boxed so that an event missing its timestamp can be told apart
 * from one created at the epoch.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Event {

    /** Lower-case hex SHA-256 of the canonical serialization */
    @JsonProperty("id")
    private String id;

    /** Author x-only public key (hex) */
    @JsonProperty("pubkey")
    private String pubkey;

    /** Unix timestamp in seconds */
    @JsonProperty("created_at")
    private Long createdAt;

    @JsonProperty("kind")
    private int kind;

    @JsonProperty("tags")
    private List<List<String>> tags;

    @JsonProperty("content")
    private String content;

    /** BIP-340 Schnorr signature over the id (hex) */
    @JsonProperty("sig")
    private String sig;

    /**
     * Default constructor for Jackson deserialization.
     */
    public Event() {
        this.tags = new ArrayList<>();
        this.content = "";
    }

    public Event(String id, String pubkey, Long createdAt, int kind,
                 List<List<String>> tags, String content, String sig) {
        this.id = id;
        this.pubkey = pubkey;
        this.createdAt = createdAt;
        this.kind = kind;
        this.tags = copyTags(tags);
        this.content = content != null ? content : "";
        this.sig = sig;
    }

    public String getId() { return id; }
    public String getPubkey() { return pubkey; }
    public Long getCreatedAt() { return createdAt; }
    public int getKind() { return kind; }
    public List<List<String>> getTags() { return tags; }
    public String getContent() { return content; }
    public String getSig() { return sig; }

    public void setId(String id) { this.id = id; }
    public void setPubkey(String pubkey) { this.pubkey = pubkey; }
    public void setCreatedAt(Long createdAt) { this.createdAt = createdAt; }
    public void setKind(int kind) { this.kind = kind; }
    public void setTags(List<List<String>> tags) { this.tags = copyTags(tags); }
    public void setContent(String content) { this.content = content != null ? content : ""; }
    public void setSig(String sig) { this.sig = sig; }

    /**
     * Timestamp in seconds, or 0 when the event carries none.
     */
    @JsonIgnore
    public long getCreatedAtOrZero() {
        return createdAt != null ? createdAt : 0L;
    }

    /**
     * First value of the named tag, or null.
     */
    public String getTagValue(String tagName) {
        for (List<String> tag : tags) {
            if (tag.size() > 1 && tagName.equals(tag.get(0))) {
                return tag.get(1);
            }
        }
        return null;
    }

    /**
     * All first values of the named tag, in tag order.
     */
    public List<String> getTagValues(String tagName) {
        List<String> values = new ArrayList<>();
        for (List<String> tag : tags) {
            if (tag.size() > 1 && tagName.equals(tag.get(0))) {
                values.add(tag.get(1));
            }
        }
        return values;
    }

    /**
     * The whole first tag with the given name (including the name), or an empty list.
     */
    public List<String> getTag(String tagName) {
        for (List<String> tag : tags) {
            if (!tag.isEmpty() && tagName.equals(tag.get(0))) {
                return Collections.unmodifiableList(tag);
            }
        }
        return Collections.emptyList();
    }

    public boolean hasTag(String tagName) {
        return tags.stream()
            .anyMatch(tag -> !tag.isEmpty() && tagName.equals(tag.get(0)));
    }

    private static List<List<String>> copyTags(List<List<String>> tags) {
        List<List<String>> copy = new ArrayList<>();
        if (tags != null) {
            for (List<String> tag : tags) {
                copy.add(tag != null ? new ArrayList<>(tag) : new ArrayList<>());
            }
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Event event = (Event) o;
        return Objects.equals(id, event.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Event{" +
                "id='" + abbreviate(id) + "'" +
                ", pubkey='" + abbreviate(pubkey) + "'" +
                ", kind=" + kind +
                ", createdAt=" + createdAt +
                ", tags=" + tags.size() +
                '}';
    }

    private static String abbreviate(String hex) {
        if (hex == null) {
            return "null";
        }
        return hex.length() > 12 ? hex.substring(0, 12) + "..." : hex;
    }
}
