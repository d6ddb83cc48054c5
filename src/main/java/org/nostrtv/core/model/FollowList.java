package org.nostrtv.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.nostrtv.core.protocol.Event;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Follow list (kind 3, NIP-02). Older clients also put their relay set in the content as a
 * JSON object keyed by relay URL; those URLs are kept when present.
 */
public class FollowList {

    private final String pubkey;
    private final long createdAt;
    private final List<String> follows;
    private final List<String> relays;

    public FollowList(String pubkey, long createdAt, List<String> follows, List<String> relays) {
        this.pubkey = pubkey;
        this.createdAt = createdAt;
        this.follows = Collections.unmodifiableList(new ArrayList<>(follows));
        this.relays = Collections.unmodifiableList(new ArrayList<>(relays));
    }

    public static FollowList fromEvent(Event event, ObjectMapper jsonMapper) {
        Set<String> follows = new LinkedHashSet<>();
        for (String pubkey : event.getTagValues("p")) {
            if (!pubkey.isEmpty()) {
                follows.add(pubkey.toLowerCase(Locale.ROOT));
            }
        }
        return new FollowList(event.getPubkey(), event.getCreatedAtOrZero(),
            new ArrayList<>(follows), relaysFromContent(event.getContent(), jsonMapper));
    }

    private static List<String> relaysFromContent(String content, ObjectMapper jsonMapper) {
        List<String> relays = new ArrayList<>();
        if (content == null || content.isEmpty()) {
            return relays;
        }
        JsonNode node;
        try {
            node = jsonMapper.readTree(content);
        } catch (IOException e) {
            return relays;
        }
        if (node != null && node.isObject()) {
            Iterator<String> names = node.fieldNames();
            while (names.hasNext()) {
                String url = names.next();
                if (RelayList.isRelayUrl(url)) {
                    relays.add(url);
                }
            }
        }
        return relays;
    }

    public String getPubkey() { return pubkey; }
    public long getCreatedAt() { return createdAt; }
    public List<String> getFollows() { return follows; }
    public List<String> getRelays() { return relays; }

    public boolean isFollowing(String pubkey) {
        return pubkey != null && follows.contains(pubkey.toLowerCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return "FollowList{pubkey=" + Profile.shortPubkey(pubkey) + ", follows=" + follows.size()
            + ", createdAt=" + createdAt + "}";
    }
}
