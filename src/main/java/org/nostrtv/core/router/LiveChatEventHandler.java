package org.nostrtv.core.router;

import org.nostrtv.core.model.ChatMessage;
import org.nostrtv.core.protocol.Event;

class LiveChatEventHandler implements EventHandler {

    private final EventRouter router;

    LiveChatEventHandler(EventRouter router) {
        this.router = router;
    }

    @Override
    public void handle(Event event) {
        ChatMessage message = ChatMessage.fromEvent(event, router.resolveName(event.getPubkey()));
        router.notifyListeners(listener -> listener.onChatMessage(message));
    }
}
