package org.nostrtv.core.router;

import org.nostrtv.core.model.FollowList;
import org.nostrtv.core.protocol.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Kind 3 is replaceable: a list older than the one already seen for its author is ignored.
 */
class FollowListEventHandler implements EventHandler {

    private static final Logger logger = LoggerFactory.getLogger(FollowListEventHandler.class);

    private final EventRouter router;
    private final Map<String, FollowList> latest = new ConcurrentHashMap<>();

    FollowListEventHandler(EventRouter router) {
        this.router = router;
    }

    @Override
    public void handle(Event event) {
        FollowList followList = FollowList.fromEvent(event, router.getJsonMapper());
        String author = followList.getPubkey().toLowerCase(Locale.ROOT);
        FollowList current = latest.get(author);
        if (current != null && current.getCreatedAt() >= followList.getCreatedAt()) {
            logger.debug("Ignoring stale follow list for {}", author);
            return;
        }
        latest.put(author, followList);
        router.notifyListeners(listener -> listener.onFollowList(followList));
    }

    FollowList get(String pubkey) {
        return latest.get(pubkey.toLowerCase(Locale.ROOT));
    }
}
