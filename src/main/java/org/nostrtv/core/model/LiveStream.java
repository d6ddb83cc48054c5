package org.nostrtv.core.model;

import org.nostrtv.core.protocol.Coordinate;
import org.nostrtv.core.protocol.Event;
import org.nostrtv.core.protocol.EventKinds;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Live stream metadata from a kind 30311 live event (NIP-53).
 */
public class LiveStream {

    public static final String STATUS_LIVE = "live";
    public static final String STATUS_ENDED = "ended";
    public static final String STATUS_PLANNED = "planned";
    public static final String STATUS_UNKNOWN = "unknown";

    private final String streamId;
    private final String eventId;
    private final String title;
    private final String streamingUrl;
    private final String imageUrl;
    private final String status;
    private final String hostPubkey;
    private final String authorPubkey;
    private final Integer viewerCount;
    private final List<String> topics;
    private final long createdAt;

    private LiveStream(Builder builder) {
        this.streamId = builder.streamId;
        this.eventId = builder.eventId;
        this.title = builder.title;
        this.streamingUrl = builder.streamingUrl;
        this.imageUrl = builder.imageUrl;
        this.status = builder.status;
        this.hostPubkey = builder.hostPubkey;
        this.authorPubkey = builder.authorPubkey;
        this.viewerCount = builder.viewerCount;
        this.topics = Collections.unmodifiableList(new ArrayList<>(builder.topics));
        this.createdAt = builder.createdAt;
    }

    /**
     * Build from a validated live event.
     * <p>
     * Title and summary are joined with " - " when both exist; a stream without a URL gets an
     * {@code ended://<d>} placeholder so it still has a stable key; the host is the first
     * {@code p} tag, falling back to the author.
     */
    public static LiveStream fromEvent(Event event) {
        String streamId = event.getTagValue("d");

        String title = event.getTagValue("title");
        String summary = event.getTagValue("summary");
        String combinedTitle;
        if (notEmpty(title) && notEmpty(summary)) {
            combinedTitle = title + " - " + summary;
        } else if (notEmpty(title)) {
            combinedTitle = title;
        } else if (notEmpty(summary)) {
            combinedTitle = summary;
        } else {
            combinedTitle = "(No title)";
        }

        String url = event.getTagValue("streaming");
        if (!notEmpty(url)) {
            url = event.getTagValue("streaming_url");
        }
        if (!notEmpty(url)) {
            url = "ended://" + streamId;
        }

        String status = event.getTagValue("status");
        String host = event.getTagValue("p");

        return builder()
            .streamId(streamId)
            .eventId(event.getId())
            .title(combinedTitle)
            .streamingUrl(url)
            .imageUrl(event.getTagValue("image"))
            .status(notEmpty(status) ? status.toLowerCase(Locale.ROOT) : STATUS_UNKNOWN)
            .hostPubkey(notEmpty(host) ? host : event.getPubkey())
            .authorPubkey(event.getPubkey())
            .viewerCount(parseCount(event.getTagValue("current_participants")))
            .topics(event.getTagValues("t"))
            .createdAt(event.getCreatedAtOrZero())
            .build();
    }

    private static Integer parseCount(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean notEmpty(String value) {
        return value != null && !value.isEmpty();
    }

    public String getStreamId() { return streamId; }
    public String getEventId() { return eventId; }
    public String getTitle() { return title; }
    public String getStreamingUrl() { return streamingUrl; }
    public String getImageUrl() { return imageUrl; }
    public String getStatus() { return status; }
    public String getHostPubkey() { return hostPubkey; }
    public String getAuthorPubkey() { return authorPubkey; }
    public Integer getViewerCount() { return viewerCount; }
    public List<String> getTopics() { return topics; }
    public long getCreatedAt() { return createdAt; }

    public boolean isLive() {
        return STATUS_LIVE.equals(status);
    }

    /**
     * Coordinate that chat and zaps for this stream reference. Always uses the event author,
     * since that is who can replace the live event.
     */
    public String getCoordinate() {
        return Coordinate.of(EventKinds.LIVE_EVENT, authorPubkey, streamId).toString();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for LiveStream instances.
     */
    public static class Builder {
        private String streamId;
        private String eventId;
        private String title;
        private String streamingUrl;
        private String imageUrl;
        private String status = STATUS_UNKNOWN;
        private String hostPubkey;
        private String authorPubkey;
        private Integer viewerCount;
        private List<String> topics = new ArrayList<>();
        private long createdAt;

        public Builder streamId(String streamId) { this.streamId = streamId; return this; }
        public Builder eventId(String eventId) { this.eventId = eventId; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder streamingUrl(String streamingUrl) { this.streamingUrl = streamingUrl; return this; }
        public Builder imageUrl(String imageUrl) { this.imageUrl = imageUrl; return this; }
        public Builder status(String status) { this.status = status; return this; }
        public Builder hostPubkey(String hostPubkey) { this.hostPubkey = hostPubkey; return this; }
        public Builder authorPubkey(String authorPubkey) { this.authorPubkey = authorPubkey; return this; }
        public Builder viewerCount(Integer viewerCount) { this.viewerCount = viewerCount; return this; }
        public Builder topics(List<String> topics) { this.topics = new ArrayList<>(topics); return this; }
        public Builder createdAt(long createdAt) { this.createdAt = createdAt; return this; }

        public LiveStream build() {
            return new LiveStream(this);
        }
    }

    @Override
    public String toString() {
        return "LiveStream{streamId=" + streamId + ", title=" + title + ", status=" + status
            + ", host=" + Profile.shortPubkey(hostPubkey) + "}";
    }
}
