package org.nostrtv.core.router;

import org.nostrtv.core.model.LiveStream;
import org.nostrtv.core.protocol.Event;

class LiveStreamEventHandler implements EventHandler {

    private final EventRouter router;

    LiveStreamEventHandler(EventRouter router) {
        this.router = router;
    }

    @Override
    public void handle(Event event) {
        LiveStream stream = LiveStream.fromEvent(event);
        // Warm the cache so the host name is ready when the stream is shown.
        router.getProfileCache().requestLookup(stream.getHostPubkey());
        router.notifyListeners(listener -> listener.onLiveStream(stream));
    }
}
