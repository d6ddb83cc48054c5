package org.nostrtv.core.activity;

import org.nostrtv.core.client.RelayPool;
import org.nostrtv.core.crypto.EventSigner;
import org.nostrtv.core.protocol.Coordinate;
import org.nostrtv.core.protocol.Event;
import org.nostrtv.core.protocol.EventKinds;
import org.nostrtv.core.protocol.UnsignedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Outbound live activity (NIP-53 chat and presence, NIP-57 zap requests), signed with whatever
 * {@link EventSigner} the user logged in with.
 */
public class LiveActivityPublisher {

    private static final Logger logger = LoggerFactory.getLogger(LiveActivityPublisher.class);

    private final RelayPool pool;
    private final EventSigner signer;
    private final Clock clock;

    public LiveActivityPublisher(RelayPool pool, EventSigner signer) {
        this(pool, signer, Clock.systemUTC());
    }

    public LiveActivityPublisher(RelayPool pool, EventSigner signer, Clock clock) {
        this.pool = pool;
        this.signer = signer;
        this.clock = clock;
    }

    /**
     * Post a chat message (kind 1311) to a stream.
     *
     * @return future completing with the published event id
     */
    public CompletableFuture<String> sendChatMessage(String streamCoordinate, String content) {
        Coordinate coordinate = Coordinate.parse(streamCoordinate);
        if (coordinate == null) {
            return failed(new IllegalArgumentException("Invalid stream coordinate: " + streamCoordinate));
        }
        if (content == null || content.trim().isEmpty()) {
            return failed(new IllegalArgumentException("Chat message is empty"));
        }
        List<List<String>> tags = new ArrayList<>();
        tags.add(UnsignedEvent.tag("a", coordinate.toString(), "", "root"));
        tags.add(UnsignedEvent.tag("p", coordinate.getPubkey()));
        return signAndPublish(template(EventKinds.LIVE_CHAT_MESSAGE, tags, content.trim()));
    }

    /**
     * Announce that the user is watching a stream (kind 10312). Being replaceable, the newest
     * presence event wins.
     */
    public CompletableFuture<String> announcePresence(String streamCoordinate) {
        Coordinate coordinate = Coordinate.parse(streamCoordinate);
        if (coordinate == null) {
            return failed(new IllegalArgumentException("Invalid stream coordinate: " + streamCoordinate));
        }
        List<List<String>> tags = new ArrayList<>();
        tags.add(UnsignedEvent.tag("a", coordinate.toString()));
        return signAndPublish(template(EventKinds.PRESENCE, tags, ""));
    }

    /**
     * Clear presence by publishing a presence event with no room.
     */
    public CompletableFuture<String> clearPresence() {
        return signAndPublish(template(EventKinds.PRESENCE, new ArrayList<>(), ""));
    }

    /**
     * Build and sign a zap request (kind 9734) for a stream. It is not published: the caller sends
     * it to the recipient's LNURL callback, which embeds it in the receipt.
     *
     * @param amountSats amount in sats; written to the request in millisats
     * @param lnurl      recipient's lightning address or LNURL
     * @param relays     relays the receipt should be published to
     */
    public CompletableFuture<Event> createZapRequest(String streamCoordinate, long amountSats, String lnurl,
                                                     String comment, Collection<String> relays) {
        Coordinate coordinate = Coordinate.parse(streamCoordinate);
        if (coordinate == null) {
            return failed(new IllegalArgumentException("Invalid stream coordinate: " + streamCoordinate));
        }
        if (amountSats <= 0) {
            return failed(new IllegalArgumentException("Zap amount must be positive"));
        }
        List<List<String>> tags = new ArrayList<>();
        List<String> relaysTag = new ArrayList<>();
        relaysTag.add("relays");
        relaysTag.addAll(relays);
        tags.add(relaysTag);
        tags.add(UnsignedEvent.tag("amount", String.valueOf(amountSats * 1000)));
        tags.add(UnsignedEvent.tag("lnurl", lnurl));
        tags.add(UnsignedEvent.tag("p", coordinate.getPubkey()));
        tags.add(UnsignedEvent.tag("a", coordinate.toString()));
        tags.add(UnsignedEvent.tag("k", String.valueOf(coordinate.getKind())));
        return signer.signEvent(template(EventKinds.ZAP_REQUEST, tags, comment));
    }

    private UnsignedEvent template(int kind, List<List<String>> tags, String content) {
        return new UnsignedEvent(kind, clock.millis() / 1000, tags, content);
    }

    private CompletableFuture<String> signAndPublish(UnsignedEvent template) {
        return signer.signEvent(template).thenCompose(event -> {
            logger.debug("Publishing {} event {}", EventKinds.getName(event.getKind()), event.getId());
            return pool.publish(event);
        });
    }

    private static <T> CompletableFuture<T> failed(Throwable error) {
        CompletableFuture<T> future = new CompletableFuture<>();
        future.completeExceptionally(error);
        return future;
    }
}
