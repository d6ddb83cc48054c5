package org.nostrtv.core.model;

import org.nostrtv.core.protocol.Event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Relay list metadata (kind 10002, NIP-65): the relays a user reads from and writes to.
 */
public class RelayList {

    private final String pubkey;
    private final long createdAt;
    private final List<String> relays;

    public RelayList(String pubkey, long createdAt, List<String> relays) {
        this.pubkey = pubkey;
        this.createdAt = createdAt;
        this.relays = Collections.unmodifiableList(new ArrayList<>(relays));
    }

    /**
     * Collect {@code r} tags, keeping only websocket URLs.
     */
    public static RelayList fromEvent(Event event) {
        Set<String> relays = new LinkedHashSet<>();
        for (String url : event.getTagValues("r")) {
            if (isRelayUrl(url)) {
                relays.add(url.trim());
            }
        }
        return new RelayList(event.getPubkey(), event.getCreatedAtOrZero(), new ArrayList<>(relays));
    }

    static boolean isRelayUrl(String url) {
        return url != null && (url.startsWith("wss://") || url.startsWith("ws://"));
    }

    public String getPubkey() { return pubkey; }
    public long getCreatedAt() { return createdAt; }
    public List<String> getRelays() { return relays; }

    @Override
    public String toString() {
        return "RelayList{pubkey=" + Profile.shortPubkey(pubkey) + ", relays=" + relays + "}";
    }
}
