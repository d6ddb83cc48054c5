package org.nostrtv.core.crypto;

import org.nostrtv.core.protocol.Event;
import org.nostrtv.core.protocol.UnsignedEvent;

import java.util.concurrent.CompletableFuture;

/**
 * Something that can turn an event template into a signed event, locally or remotely.
 */
public interface EventSigner {

    /**
     * Sign a template. The returned event carries pubkey, id and signature.
     */
    CompletableFuture<Event> signEvent(UnsignedEvent template);

    /**
     * Public key (hex) of the signing identity, or null if not yet known.
     */
    String getPublicKeyHex();
}
