package org.nostrtv.core.router;

import org.nostrtv.core.model.RelayList;
import org.nostrtv.core.protocol.Event;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

class RelayListEventHandler implements EventHandler {

    private final EventRouter router;
    private final Map<String, RelayList> latest = new ConcurrentHashMap<>();

    RelayListEventHandler(EventRouter router) {
        this.router = router;
    }

    @Override
    public void handle(Event event) {
        RelayList relayList = RelayList.fromEvent(event);
        String author = relayList.getPubkey().toLowerCase(Locale.ROOT);
        RelayList current = latest.get(author);
        if (current != null && current.getCreatedAt() >= relayList.getCreatedAt()) {
            return;
        }
        latest.put(author, relayList);
        router.notifyListeners(listener -> listener.onRelayList(relayList));
    }

    RelayList get(String pubkey) {
        return latest.get(pubkey.toLowerCase(Locale.ROOT));
    }
}
