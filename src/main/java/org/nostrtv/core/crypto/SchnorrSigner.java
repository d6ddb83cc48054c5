package org.nostrtv.core.crypto;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.math.ec.ECPoint;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * BIP-340 Schnorr signatures over secp256k1, as used for Nostr event ids.
 * See: https://github.com/bitcoin/bips/blob/master/bip-0340.mediawiki
 */
public class SchnorrSigner {

    private static final SecureRandom RANDOM = new SecureRandom();

    private static final byte[] TAG_AUX = tagHash("BIP0340/aux");
    private static final byte[] TAG_NONCE = tagHash("BIP0340/nonce");
    private static final byte[] TAG_CHALLENGE = tagHash("BIP0340/challenge");

    /**
     * x-only public key for a private key.
     *
     * @param privateKey 32-byte private key
     * @return 32-byte x coordinate of d*G
     */
    public static byte[] getPublicKey(byte[] privateKey) {
        BigInteger d = Secp256k1.toScalar(privateKey);
        return Secp256k1.xOnly(Secp256k1.G.multiply(d).normalize());
    }

    /**
     * Sign a 32-byte message with fresh auxiliary randomness.
     */
    public static byte[] sign(byte[] message, byte[] privateKey) {
        byte[] aux = new byte[32];
        RANDOM.nextBytes(aux);
        return sign(message, privateKey, aux);
    }

    /**
     * Sign a 32-byte message.
     *
     * @param message 32-byte message (an event id)
     * @param privateKey 32-byte private key
     * @param auxRand 32 bytes of auxiliary randomness
     * @return 64-byte signature {@code R.x || s}
     */
    public static byte[] sign(byte[] message, byte[] privateKey, byte[] auxRand) {
        if (message.length != 32) {
            throw new IllegalArgumentException("Message must be 32 bytes");
        }
        if (auxRand.length != 32) {
            throw new IllegalArgumentException("Auxiliary randomness must be 32 bytes");
        }

        BigInteger d0 = Secp256k1.toScalar(privateKey);
        ECPoint pubPoint = Secp256k1.G.multiply(d0).normalize();
        BigInteger d = Secp256k1.hasEvenY(pubPoint) ? d0 : Secp256k1.N.subtract(d0);
        byte[] px = Secp256k1.xOnly(pubPoint);

        byte[] masked = taggedHash(TAG_AUX, auxRand);
        byte[] dBytes = Secp256k1.toBytes32(d);
        for (int i = 0; i < 32; i++) {
            masked[i] ^= dBytes[i];
        }

        BigInteger k0 = new BigInteger(1, taggedHash(TAG_NONCE, Secp256k1.concat(masked, px, message)))
            .mod(Secp256k1.N);
        if (k0.signum() == 0) {
            throw new IllegalStateException("Nonce derivation produced zero");
        }
        ECPoint r = Secp256k1.G.multiply(k0).normalize();
        BigInteger k = Secp256k1.hasEvenY(r) ? k0 : Secp256k1.N.subtract(k0);
        byte[] rx = Secp256k1.xOnly(r);

        BigInteger e = challenge(rx, px, message);
        BigInteger s = k.add(e.multiply(d)).mod(Secp256k1.N);

        return Secp256k1.concat(rx, Secp256k1.toBytes32(s));
    }

    /**
     * Verify a signature; malformed input yields false rather than an exception.
     *
     * @param signature 64-byte signature
     * @param message 32-byte message
     * @param publicKey 32-byte x-only public key
     */
    public static boolean verify(byte[] signature, byte[] message, byte[] publicKey) {
        if (signature == null || message == null || publicKey == null) return false;
        if (signature.length != 64 || message.length != 32 || publicKey.length != 32) return false;

        ECPoint pubPoint;
        try {
            pubPoint = Secp256k1.liftX(publicKey);
        } catch (IllegalArgumentException e) {
            return false;
        }

        byte[] rx = Arrays.copyOfRange(signature, 0, 32);
        BigInteger r = new BigInteger(1, rx);
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(signature, 32, 64));
        if (r.compareTo(Secp256k1.P) >= 0 || s.compareTo(Secp256k1.N) >= 0) {
            return false;
        }

        BigInteger e = challenge(rx, publicKey, message);
        ECPoint point = Secp256k1.G.multiply(s).subtract(pubPoint.multiply(e)).normalize();
        if (point.isInfinity() || !Secp256k1.hasEvenY(point)) {
            return false;
        }
        return point.getAffineXCoord().toBigInteger().equals(r);
    }

    private static BigInteger challenge(byte[] rx, byte[] px, byte[] message) {
        return new BigInteger(1, taggedHash(TAG_CHALLENGE, Secp256k1.concat(rx, px, message)))
            .mod(Secp256k1.N);
    }

    private static byte[] taggedHash(byte[] tagHash, byte[] data) {
        SHA256Digest digest = new SHA256Digest();
        digest.update(tagHash, 0, tagHash.length);
        digest.update(tagHash, 0, tagHash.length);
        digest.update(data, 0, data.length);
        byte[] out = new byte[32];
        digest.doFinal(out, 0);
        return out;
    }

    private static byte[] tagHash(String tag) {
        byte[] bytes = tag.getBytes(StandardCharsets.UTF_8);
        SHA256Digest digest = new SHA256Digest();
        digest.update(bytes, 0, bytes.length);
        byte[] out = new byte[32];
        digest.doFinal(out, 0);
        return out;
    }

    private SchnorrSigner() {
        // Utility class
    }
}
