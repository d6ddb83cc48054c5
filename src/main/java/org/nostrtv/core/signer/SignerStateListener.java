package org.nostrtv.core.signer;

/**
 * Observes connection state changes of a {@link RemoteSignerClient}.
 */
@FunctionalInterface
public interface SignerStateListener {
    void onStateChanged(BunkerConnectionState state);
}
