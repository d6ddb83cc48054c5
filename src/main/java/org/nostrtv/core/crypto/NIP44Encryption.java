package org.nostrtv.core.crypto;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.engines.ChaCha7539Engine;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.HKDFParameters;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.crypto.params.ParametersWithIV;
import org.bouncycastle.math.ec.ECPoint;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * NIP-44 version 2 payload encryption: secp256k1 ECDH, HKDF-SHA256, ChaCha20 and HMAC-SHA256.
 * This is the encryption NIP-46 remote signers use for request and response content.
 * See: https://github.com/nostr-protocol/nips/blob/master/44.md
 */
public class NIP44Encryption {

    public static final byte VERSION = 0x02;

    private static final byte[] SALT = "nip44-v2".getBytes(StandardCharsets.UTF_8);
    private static final int NONCE_SIZE = 32;
    private static final int MAC_SIZE = 32;
    private static final int MIN_PLAINTEXT = 1;
    private static final int MAX_PLAINTEXT = 65535;
    private static final int MIN_PAYLOAD = 99;
    private static final int MAX_PAYLOAD = 65603;

    private static final SecureRandom RANDOM = new SecureRandom();

    /**
     * Encrypt for a peer.
     *
     * @param plaintext UTF-8 text, 1 to 65535 bytes
     * @param privateKey our 32-byte private key
     * @param peerPublicKey their 32-byte x-only public key
     * @return base64 payload
     */
    public static String encryptForPeer(String plaintext, byte[] privateKey, byte[] peerPublicKey)
            throws GeneralSecurityException {
        return encrypt(plaintext, getConversationKey(privateKey, peerPublicKey));
    }

    public static String encrypt(String plaintext, byte[] conversationKey) throws GeneralSecurityException {
        byte[] nonce = new byte[NONCE_SIZE];
        RANDOM.nextBytes(nonce);
        return encrypt(plaintext, conversationKey, nonce);
    }

    static String encrypt(String plaintext, byte[] conversationKey, byte[] nonce) throws GeneralSecurityException {
        MessageKeys keys = MessageKeys.derive(conversationKey, nonce);
        byte[] ciphertext = chacha20(keys.chachaKey, keys.chachaNonce, pad(plaintext));
        byte[] mac = hmac(keys.hmacKey, nonce, ciphertext);

        byte[] payload = Secp256k1.concat(new byte[] {VERSION}, nonce, ciphertext, mac);
        return Base64.getEncoder().encodeToString(payload);
    }

    /**
     * Decrypt a payload from a peer.
     *
     * @throws GeneralSecurityException if the payload is malformed or fails authentication
     */
    public static String decryptFromPeer(String payload, byte[] privateKey, byte[] peerPublicKey)
            throws GeneralSecurityException {
        return decrypt(payload, getConversationKey(privateKey, peerPublicKey));
    }

    public static String decrypt(String payload, byte[] conversationKey) throws GeneralSecurityException {
        if (payload == null || payload.isEmpty() || payload.charAt(0) == '#') {
            throw new GeneralSecurityException("Unknown NIP-44 encryption version");
        }
        byte[] data;
        try {
            data = Base64.getDecoder().decode(payload);
        } catch (IllegalArgumentException e) {
            throw new GeneralSecurityException("Payload is not base64", e);
        }
        if (data.length < MIN_PAYLOAD || data.length > MAX_PAYLOAD) {
            throw new GeneralSecurityException("Invalid payload size: " + data.length);
        }
        if (data[0] != VERSION) {
            throw new GeneralSecurityException("Unknown NIP-44 encryption version: " + data[0]);
        }

        byte[] nonce = Arrays.copyOfRange(data, 1, 1 + NONCE_SIZE);
        byte[] ciphertext = Arrays.copyOfRange(data, 1 + NONCE_SIZE, data.length - MAC_SIZE);
        byte[] mac = Arrays.copyOfRange(data, data.length - MAC_SIZE, data.length);

        MessageKeys keys = MessageKeys.derive(conversationKey, nonce);
        if (!MessageDigest.isEqual(mac, hmac(keys.hmacKey, nonce, ciphertext))) {
            throw new GeneralSecurityException("Invalid MAC");
        }
        return unpad(chacha20(keys.chachaKey, keys.chachaNonce, ciphertext));
    }

    /**
     * HKDF-extract of the shared ECDH x coordinate with salt {@code "nip44-v2"}.
     * Symmetric: both parties derive the same key.
     */
    public static byte[] getConversationKey(byte[] privateKey, byte[] peerPublicKey)
            throws GeneralSecurityException {
        try {
            ECPoint shared = Secp256k1.liftX(peerPublicKey)
                .multiply(Secp256k1.toScalar(privateKey))
                .normalize();
            return hmacSha256(SALT, Secp256k1.xOnly(shared));
        } catch (IllegalArgumentException e) {
            throw new GeneralSecurityException("Invalid key for NIP-44 conversation", e);
        }
    }

    /**
     * Padded plaintext length: 32 minimum, then chunks that grow with the power of two above it.
     */
    static int calcPaddedLength(int unpaddedLength) {
        if (unpaddedLength <= 32) {
            return 32;
        }
        int nextPower = Integer.highestOneBit(unpaddedLength - 1) << 1;
        int chunk = nextPower <= 256 ? 32 : nextPower / 8;
        return chunk * ((unpaddedLength - 1) / chunk + 1);
    }

    private static byte[] pad(String plaintext) throws GeneralSecurityException {
        byte[] bytes = plaintext.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < MIN_PLAINTEXT || bytes.length > MAX_PLAINTEXT) {
            throw new GeneralSecurityException("Invalid plaintext length: " + bytes.length);
        }
        byte[] padded = new byte[2 + calcPaddedLength(bytes.length)];
        padded[0] = (byte) (bytes.length >>> 8);
        padded[1] = (byte) bytes.length;
        System.arraycopy(bytes, 0, padded, 2, bytes.length);
        return padded;
    }

    private static String unpad(byte[] padded) throws GeneralSecurityException {
        if (padded.length < 2) {
            throw new GeneralSecurityException("Invalid padding");
        }
        int length = ((padded[0] & 0xff) << 8) | (padded[1] & 0xff);
        if (length < MIN_PLAINTEXT || length > MAX_PLAINTEXT
                || padded.length != 2 + calcPaddedLength(length)) {
            throw new GeneralSecurityException("Invalid padding");
        }
        return new String(padded, 2, length, StandardCharsets.UTF_8);
    }

    private static byte[] chacha20(byte[] key, byte[] nonce, byte[] input) {
        ChaCha7539Engine engine = new ChaCha7539Engine();
        engine.init(true, new ParametersWithIV(new KeyParameter(key), nonce));
        byte[] out = new byte[input.length];
        engine.processBytes(input, 0, input.length, out, 0);
        return out;
    }

    private static byte[] hmac(byte[] key, byte[] nonce, byte[] ciphertext) {
        return hmacSha256(key, Secp256k1.concat(nonce, ciphertext));
    }

    private static byte[] hmacSha256(byte[] key, byte[] data) {
        HMac mac = new HMac(new SHA256Digest());
        mac.init(new KeyParameter(key));
        mac.update(data, 0, data.length);
        byte[] out = new byte[mac.getMacSize()];
        mac.doFinal(out, 0);
        return out;
    }

    private static final class MessageKeys {
        final byte[] chachaKey;
        final byte[] chachaNonce;
        final byte[] hmacKey;

        private MessageKeys(byte[] chachaKey, byte[] chachaNonce, byte[] hmacKey) {
            this.chachaKey = chachaKey;
            this.chachaNonce = chachaNonce;
            this.hmacKey = hmacKey;
        }

        static MessageKeys derive(byte[] conversationKey, byte[] nonce) throws GeneralSecurityException {
            if (conversationKey.length != 32) {
                throw new GeneralSecurityException("Conversation key must be 32 bytes");
            }
            if (nonce.length != NONCE_SIZE) {
                throw new GeneralSecurityException("Nonce must be 32 bytes");
            }
            HKDFBytesGenerator hkdf = new HKDFBytesGenerator(new SHA256Digest());
            hkdf.init(HKDFParameters.skipExtractParameters(conversationKey, nonce));
            byte[] okm = new byte[76];
            hkdf.generateBytes(okm, 0, okm.length);
            return new MessageKeys(
                Arrays.copyOfRange(okm, 0, 32),
                Arrays.copyOfRange(okm, 32, 44),
                Arrays.copyOfRange(okm, 44, 76));
        }
    }

    private NIP44Encryption() {
        // Utility class
    }
}
