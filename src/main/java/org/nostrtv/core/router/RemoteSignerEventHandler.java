package org.nostrtv.core.router;

import org.nostrtv.core.protocol.Event;

class RemoteSignerEventHandler implements EventHandler {

    private final EventRouter router;

    RemoteSignerEventHandler(EventRouter router) {
        this.router = router;
    }

    @Override
    public void handle(Event event) {
        router.notifyListeners(listener -> listener.onRemoteSignerMessage(event));
    }
}
