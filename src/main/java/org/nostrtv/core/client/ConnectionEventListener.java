package org.nostrtv.core.client;

/**
 * Connection event listener for monitoring relay connections.
 */
public interface ConnectionEventListener {
    /** Called when a relay connection is established for the first time. */
    default void onConnect(String relayUrl) {}
    /** Called when a relay connection is lost. */
    default void onDisconnect(String relayUrl, String reason) {}
    /** Called when reconnection to one relay is being attempted. */
    default void onReconnecting(String relayUrl, int attempt) {}
    /** Called when a relay connection is re-established. */
    default void onReconnected(String relayUrl) {}
    /** Called when the pool-wide health state changes. */
    default void onStateChanged(ConnectionState state) {}
    /** Called when an {@link ResubscribePolicy#EXTERNAL} subscription was dropped and must be re-issued. */
    default void onResubscribeRequired(String subscriptionId, String purpose) {}
}
