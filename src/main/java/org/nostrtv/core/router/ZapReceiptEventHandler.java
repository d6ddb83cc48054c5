package org.nostrtv.core.router;

import org.nostrtv.core.model.ZapReceipt;
import org.nostrtv.core.protocol.Event;

import java.io.IOException;

class ZapReceiptEventHandler implements EventHandler {

    private final EventRouter router;

    ZapReceiptEventHandler(EventRouter router) {
        this.router = router;
    }

    @Override
    public void handle(Event event) throws IOException {
        ZapReceipt zap = ZapReceipt.fromEvent(event, router.getJsonMapper(), router::resolveName);
        router.notifyListeners(listener -> listener.onZapReceipt(zap));
    }
}
