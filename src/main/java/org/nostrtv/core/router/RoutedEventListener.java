package org.nostrtv.core.router;

import org.nostrtv.core.model.ChatMessage;
import org.nostrtv.core.model.FollowList;
import org.nostrtv.core.model.LiveStream;
import org.nostrtv.core.model.Profile;
import org.nostrtv.core.model.RelayList;
import org.nostrtv.core.model.ZapReceipt;
import org.nostrtv.core.protocol.Event;

/**
 * Typed callbacks for events that passed validation. All callbacks run on the router's dispatch
 * thread, one at a time and in arrival order.
 */
public interface RoutedEventListener {

    default void onProfile(Profile profile) {}

    /** Only the newest follow list per author is delivered. */
    default void onFollowList(FollowList followList) {}

    default void onRelayList(RelayList relayList) {}

    default void onLiveStream(LiveStream stream) {}

    default void onChatMessage(ChatMessage message) {}

    default void onZapReceipt(ZapReceipt zap) {}

    /**
     * A kind 24133 event with a verified signature. Content is still encrypted.
     */
    default void onRemoteSignerMessage(Event event) {}
}
