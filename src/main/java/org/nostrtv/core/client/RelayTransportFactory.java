package org.nostrtv.core.client;

/**
 * Creates a fresh transport for every connection attempt.
 */
@FunctionalInterface
public interface RelayTransportFactory {
    RelayTransport create(String relayUrl);
}
