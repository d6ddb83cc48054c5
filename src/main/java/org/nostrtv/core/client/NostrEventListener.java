package org.nostrtv.core.client;

import org.nostrtv.core.protocol.Event;

/**
 * Receives the merged inbound stream of all relays in a {@link RelayPool}.
 * Called on relay I/O threads; implementations must hand off anything slow.
 */
public interface NostrEventListener {

    /**
     * An event arrived for one of the pool's subscriptions. The same event may arrive from
     * several relays.
     */
    void onEvent(String relayUrl, String subscriptionId, Event event);

    /**
     * A relay finished sending stored events for a subscription (EOSE).
     */
    default void onEndOfStoredEvents(String relayUrl, String subscriptionId) {
        // Optional callback
    }

    /**
     * A relay acknowledged or rejected a published event (OK).
     */
    default void onOk(String relayUrl, String eventId, boolean accepted, String message) {
        // Optional callback
    }

    /**
     * Human-readable relay message (NOTICE).
     */
    default void onNotice(String relayUrl, String message) {
        // Optional callback
    }
}
