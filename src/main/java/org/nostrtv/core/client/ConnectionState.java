package org.nostrtv.core.client;

/**
 * Pool-wide health as seen by the silence watchdog.
 */
public enum ConnectionState {
    HEALTHY,
    RECONNECTING
}
