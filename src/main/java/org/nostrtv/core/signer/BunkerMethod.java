package org.nostrtv.core.signer;

/**
 * NIP-46 RPC methods used by this client.
 */
public enum BunkerMethod {
    CONNECT("connect"),
    GET_PUBLIC_KEY("get_public_key"),
    SIGN_EVENT("sign_event"),
    PING("ping"),
    DISCONNECT("disconnect"),
    NIP44_ENCRYPT("nip44_encrypt"),
    NIP44_DECRYPT("nip44_decrypt");

    private final String wireName;

    BunkerMethod(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
