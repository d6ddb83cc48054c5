package org.nostrtv.core.crypto;

import org.apache.commons.codec.binary.Hex;
import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Unit tests for BIP-340 Schnorr signatures.
 */
public class SchnorrSignerTest {

    private static byte[] key(int value) {
        byte[] key = new byte[32];
        key[31] = (byte) value;
        return key;
    }

    @Test
    public void testPublicKeyDerivation() {
        assertEquals("79be667ef9dcbbac55a06295ce870b07029bfcdb2dce28d959f2815b16f81798",
            Hex.encodeHexString(SchnorrSigner.getPublicKey(key(1))));
        assertEquals("f9308a019258c31049344f85f89d5229b531c845836f99b08601f113bce036f9",
            Hex.encodeHexString(SchnorrSigner.getPublicKey(key(3))));
    }

    @Test
    public void testBip340Vector0() {
        // BIP-340 test vector 0: secret key 3, zero aux randomness, zero message
        byte[] signature = SchnorrSigner.sign(new byte[32], key(3), new byte[32]);

        assertEquals("E907831F80848D1069A5371B402410364BDF1C5F8307B0084C55F1CE2DCA8215"
                + "25F66A4A85EA8B71E482A74F382D2CE5EBEEE8FDB2172F477DF4900D310536C0",
            Hex.encodeHexString(signature).toUpperCase());
        assertTrue(SchnorrSigner.verify(signature, new byte[32], SchnorrSigner.getPublicKey(key(3))));
    }

    @Test
    public void testSignAndVerify() {
        NostrKeyManager keys = NostrKeyManager.generate();
        byte[] message = new byte[32];
        message[0] = 42;

        byte[] signature = keys.sign(message);

        assertEquals(64, signature.length);
        assertTrue(SchnorrSigner.verify(signature, message, keys.getPublicKey()));
    }

    @Test
    public void testVerifyRejectsTampering() {
        NostrKeyManager keys = NostrKeyManager.generate();
        NostrKeyManager other = NostrKeyManager.generate();
        byte[] message = new byte[32];
        byte[] signature = keys.sign(message);

        byte[] tamperedMessage = message.clone();
        tamperedMessage[5] ^= 1;
        byte[] tamperedSignature = signature.clone();
        tamperedSignature[40] ^= 1;

        assertFalse(SchnorrSigner.verify(signature, tamperedMessage, keys.getPublicKey()));
        assertFalse(SchnorrSigner.verify(tamperedSignature, message, keys.getPublicKey()));
        assertFalse(SchnorrSigner.verify(signature, message, other.getPublicKey()));
    }

    @Test
    public void testVerifyRejectsMalformedInput() {
        assertFalse(SchnorrSigner.verify(new byte[10], new byte[32], new byte[32]));
        assertFalse(SchnorrSigner.verify(null, new byte[32], new byte[32]));
        assertFalse(SchnorrSigner.verify(new byte[64], new byte[32], new byte[32]));
    }
}
