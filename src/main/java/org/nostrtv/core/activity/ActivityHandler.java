package org.nostrtv.core.activity;

import org.nostrtv.core.model.ChatMessage;
import org.nostrtv.core.model.ZapReceipt;

/**
 * Receives the live activity of one stream. Called on the event router's dispatch thread.
 */
public interface ActivityHandler {

    default void onChatMessage(ChatMessage message) {}

    default void onZapReceipt(ZapReceipt zap) {}
}
