package org.nostrtv.core.crypto;

import org.nostrtv.core.protocol.Event;
import org.nostrtv.core.protocol.UnsignedEvent;

import java.util.concurrent.CompletableFuture;

/**
 * Signs with a key held in this process.
 */
public class LocalEventSigner implements EventSigner {

    private final NostrKeyManager keyManager;

    public LocalEventSigner(NostrKeyManager keyManager) {
        this.keyManager = keyManager;
    }

    @Override
    public CompletableFuture<Event> signEvent(UnsignedEvent template) {
        try {
            return CompletableFuture.completedFuture(keyManager.signEvent(template));
        } catch (RuntimeException e) {
            CompletableFuture<Event> future = new CompletableFuture<>();
            future.completeExceptionally(e);
            return future;
        }
    }

    @Override
    public String getPublicKeyHex() {
        return keyManager.getPublicKeyHex();
    }
}
