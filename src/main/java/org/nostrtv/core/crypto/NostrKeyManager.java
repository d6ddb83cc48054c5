package org.nostrtv.core.crypto;

import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import org.nostrtv.core.protocol.Event;
import org.nostrtv.core.protocol.EventIds;
import org.nostrtv.core.protocol.UnsignedEvent;

import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds one secp256k1 key pair and performs the signing and NIP-44 operations that need it.
 * Used both for a user's own key and for the ephemeral client key of a remote signer session.
 */
public class NostrKeyManager {

    private final byte[] privateKey;
    private final byte[] publicKey;
    private final String publicKeyHex;

    /** NIP-44 conversation keys by peer pubkey (hex); ECDH is the expensive part */
    private final Map<String, byte[]> conversationKeys = new ConcurrentHashMap<>();

    private NostrKeyManager(byte[] privateKey) {
        this.privateKey = Arrays.copyOf(privateKey, 32);
        this.publicKey = SchnorrSigner.getPublicKey(this.privateKey);
        this.publicKeyHex = new String(Hex.encodeHex(publicKey));
    }

    public static NostrKeyManager fromPrivateKey(byte[] privateKey) {
        return new NostrKeyManager(privateKey);
    }

    public static NostrKeyManager fromPrivateKeyHex(String privateKeyHex) {
        return new NostrKeyManager(decodeHex(privateKeyHex));
    }

    /**
     * Generate a new random key pair.
     */
    public static NostrKeyManager generate() {
        SecureRandom random = new SecureRandom();
        byte[] privateKey = new byte[32];
        while (true) {
            random.nextBytes(privateKey);
            try {
                return new NostrKeyManager(privateKey);
            } catch (IllegalArgumentException e) {
                // zero or >= n, draw again
            }
        }
    }

    public byte[] getPublicKey() { return Arrays.copyOf(publicKey, 32); }
    public String getPublicKeyHex() { return publicKeyHex; }

    /**
     * Private key as hex, for handing to session storage.
     */
    public String getPrivateKeyHex() {
        return new String(Hex.encodeHex(privateKey));
    }

    /**
     * Sign a 32-byte hash (an event id) with BIP-340 Schnorr.
     */
    public byte[] sign(byte[] messageHash) {
        return SchnorrSigner.sign(messageHash, privateKey);
    }

    public String signHex(byte[] messageHash) {
        return new String(Hex.encodeHex(sign(messageHash)));
    }

    /**
     * Fill in pubkey, id and signature for a template.
     */
    public Event signEvent(UnsignedEvent template) {
        Event event = template.toEvent(publicKeyHex);
        event.setSig(signHex(EventIds.hash(event)));
        return event;
    }

    /**
     * Verify a hex-encoded Schnorr signature; malformed hex yields false.
     */
    public static boolean verifyHex(String signatureHex, byte[] messageHash, String publicKeyHex) {
        if (signatureHex == null || publicKeyHex == null) {
            return false;
        }
        try {
            return SchnorrSigner.verify(Hex.decodeHex(signatureHex), messageHash, Hex.decodeHex(publicKeyHex));
        } catch (DecoderException e) {
            return false;
        }
    }

    // NIP-44

    public String nip44Encrypt(String plaintext, String peerPublicKeyHex) throws GeneralSecurityException {
        return NIP44Encryption.encrypt(plaintext, conversationKey(peerPublicKeyHex));
    }

    public String nip44Decrypt(String payload, String peerPublicKeyHex) throws GeneralSecurityException {
        return NIP44Encryption.decrypt(payload, conversationKey(peerPublicKeyHex));
    }

    private byte[] conversationKey(String peerPublicKeyHex) throws GeneralSecurityException {
        String key = peerPublicKeyHex.toLowerCase(Locale.ROOT);
        byte[] cached = conversationKeys.get(key);
        if (cached != null) {
            return cached;
        }
        byte[] peer;
        try {
            peer = Hex.decodeHex(key);
        } catch (DecoderException e) {
            throw new GeneralSecurityException("Invalid peer public key", e);
        }
        byte[] derived = NIP44Encryption.getConversationKey(privateKey, peer);
        conversationKeys.put(key, derived);
        return derived;
    }

    public boolean isMyPublicKey(String publicKeyHex) {
        return this.publicKeyHex.equalsIgnoreCase(publicKeyHex);
    }

    /**
     * Clear sensitive data from memory (call when done).
     */
    public void clear() {
        Arrays.fill(privateKey, (byte) 0);
        for (byte[] conversationKey : conversationKeys.values()) {
            Arrays.fill(conversationKey, (byte) 0);
        }
        conversationKeys.clear();
    }

    private static byte[] decodeHex(String hex) {
        try {
            return Hex.decodeHex(hex);
        } catch (DecoderException e) {
            throw new IllegalArgumentException("Invalid hex string", e);
        }
    }

    @Override
    public String toString() {
        return "NostrKeyManager{pubkey=" + publicKeyHex.substring(0, 16) + "...}";
    }
}
