package org.nostrtv.core.router;

import org.nostrtv.core.model.Profile;
import org.nostrtv.core.protocol.Event;

class ProfileEventHandler implements EventHandler {

    private final EventRouter router;

    ProfileEventHandler(EventRouter router) {
        this.router = router;
    }

    @Override
    public void handle(Event event) throws Exception {
        Profile profile = Profile.fromEvent(event, router.getJsonMapper());
        if (!router.getProfileCache().put(profile)) {
            return;
        }
        router.notifyListeners(listener -> listener.onProfile(profile));
    }
}
