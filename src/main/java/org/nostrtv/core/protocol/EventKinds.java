package org.nostrtv.core.protocol;

/**
 * Event kinds used by a live streaming client.
 * See: https://github.com/nostr-protocol/nips
 */
public final class EventKinds {

    /** NIP-01: Profile metadata */
    public static final int METADATA = 0;

    /** NIP-01: Text note */
    public static final int TEXT_NOTE = 1;

    /** NIP-02: Follow list */
    public static final int FOLLOW_LIST = 3;

    /** NIP-53: Live chat message */
    public static final int LIVE_CHAT_MESSAGE = 1311;

    /** NIP-57: Zap request */
    public static final int ZAP_REQUEST = 9734;

    /** NIP-57: Zap receipt */
    public static final int ZAP_RECEIPT = 9735;

    /** NIP-65: Relay list metadata */
    public static final int RELAY_LIST = 10002;

    /** NIP-53: Room presence */
    public static final int PRESENCE = 10312;

    /** NIP-46: Remote signer request/response */
    public static final int NOSTR_CONNECT = 24133;

    /** NIP-53: Live event (stream metadata) */
    public static final int LIVE_EVENT = 30311;

    /** Replaceable events: only most recent event is kept */
    public static boolean isReplaceable(int kind) {
        return kind == METADATA || kind == FOLLOW_LIST || (kind >= 10000 && kind < 20000);
    }

    /** Ephemeral events: not stored by relays */
    public static boolean isEphemeral(int kind) {
        return kind >= 20000 && kind < 30000;
    }

    /** Addressable events: replaceable per "d" tag */
    public static boolean isAddressable(int kind) {
        return kind >= 30000 && kind < 40000;
    }

    public static String getName(int kind) {
        switch (kind) {
            case METADATA: return "Metadata";
            case TEXT_NOTE: return "Text Note";
            case FOLLOW_LIST: return "Follow List";
            case LIVE_CHAT_MESSAGE: return "Live Chat Message";
            case ZAP_REQUEST: return "Zap Request";
            case ZAP_RECEIPT: return "Zap Receipt";
            case RELAY_LIST: return "Relay List";
            case PRESENCE: return "Presence";
            case NOSTR_CONNECT: return "Nostr Connect";
            case LIVE_EVENT: return "Live Event";
            default: return "Unknown (" + kind + ")";
        }
    }

    private EventKinds() {
        // Utility class, no instantiation
    }
}
