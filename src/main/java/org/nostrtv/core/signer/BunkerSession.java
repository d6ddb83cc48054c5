package org.nostrtv.core.signer;

import org.nostrtv.core.crypto.NostrKeyManager;

/**
 * One remote signer connection: the ephemeral client key, the relay used for RPC traffic and what
 * has been learned about the signer so far.
 */
public class BunkerSession {

    private final String relayUrl;
    private final NostrKeyManager clientKeys;
    private final long createdAt;

    private volatile String signerPubkey;
    private volatile String secret;
    private volatile String userPubkey;
    private volatile long lastUsed;

    /**
     * @param signerPubkey null in the reverse flow until the signer's first reply
     */
    public BunkerSession(String signerPubkey, String relayUrl, NostrKeyManager clientKeys, String secret, long createdAt) {
        this.signerPubkey = signerPubkey;
        this.relayUrl = relayUrl;
        this.clientKeys = clientKeys;
        this.secret = secret;
        this.createdAt = createdAt;
        this.lastUsed = createdAt;
    }

    public String getSignerPubkey() { return signerPubkey; }
    public String getRelayUrl() { return relayUrl; }
    public String getClientPubkey() { return clientKeys.getPublicKeyHex(); }
    public String getUserPubkey() { return userPubkey; }
    public long getCreatedAt() { return createdAt; }
    public long getLastUsed() { return lastUsed; }

    /**
     * Client private key (hex), for persisting the session so it can be restored later.
     */
    public String getClientPrivateKeyHex() {
        return clientKeys.getPrivateKeyHex();
    }

    NostrKeyManager getClientKeys() { return clientKeys; }
    String getSecret() { return secret; }

    void setSignerPubkey(String signerPubkey) { this.signerPubkey = signerPubkey; }
    void setUserPubkey(String userPubkey) { this.userPubkey = userPubkey; }
    void clearSecret() { this.secret = null; }
    void touch(long now) { this.lastUsed = now; }
}
