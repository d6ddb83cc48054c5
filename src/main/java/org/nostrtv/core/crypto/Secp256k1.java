package org.nostrtv.core.crypto;

import org.bouncycastle.jce.ECNamedCurveTable;
import org.bouncycastle.jce.spec.ECNamedCurveParameterSpec;
import org.bouncycastle.math.ec.ECPoint;

import java.math.BigInteger;

/**
 * secp256k1 helpers shared by Schnorr signing and NIP-44 key agreement.
 */
final class Secp256k1 {

    static final ECNamedCurveParameterSpec PARAMS = ECNamedCurveTable.getParameterSpec("secp256k1");
    static final BigInteger N = PARAMS.getN();
    static final BigInteger P = PARAMS.getCurve().getField().getCharacteristic();
    static final ECPoint G = PARAMS.getG();

    private static final BigInteger SEVEN = BigInteger.valueOf(7);
    private static final BigInteger SQRT_EXPONENT = P.add(BigInteger.ONE).shiftRight(2);

    /**
     * Private key bytes as a scalar in [1, n-1].
     */
    static BigInteger toScalar(byte[] privateKey) {
        if (privateKey == null || privateKey.length != 32) {
            throw new IllegalArgumentException("Private key must be 32 bytes");
        }
        BigInteger d = new BigInteger(1, privateKey);
        if (d.signum() == 0 || d.compareTo(N) >= 0) {
            throw new IllegalArgumentException("Private key out of range");
        }
        return d;
    }

    /**
     * The curve point with the given x coordinate and even y (BIP-340 lift_x).
     *
     * @throws IllegalArgumentException if x is not the coordinate of a curve point
     */
    static ECPoint liftX(byte[] xOnly) {
        if (xOnly == null || xOnly.length != 32) {
            throw new IllegalArgumentException("Public key must be 32 bytes");
        }
        BigInteger x = new BigInteger(1, xOnly);
        if (x.compareTo(P) >= 0) {
            throw new IllegalArgumentException("Public key not on curve");
        }
        BigInteger c = x.pow(3).add(SEVEN).mod(P);
        BigInteger y = c.modPow(SQRT_EXPONENT, P);
        if (!y.multiply(y).mod(P).equals(c)) {
            throw new IllegalArgumentException("Public key not on curve");
        }
        if (y.testBit(0)) {
            y = P.subtract(y);
        }
        return PARAMS.getCurve().createPoint(x, y);
    }

    static boolean hasEvenY(ECPoint point) {
        return !point.getAffineYCoord().toBigInteger().testBit(0);
    }

    static byte[] xOnly(ECPoint point) {
        return toBytes32(point.getAffineXCoord().toBigInteger());
    }

    /**
     * Big-endian 32-byte encoding of a non-negative integer below 2^256.
     */
    static byte[] toBytes32(BigInteger value) {
        byte[] raw = value.toByteArray();
        byte[] out = new byte[32];
        if (raw.length > 32) {
            System.arraycopy(raw, raw.length - 32, out, 0, 32);
        } else {
            System.arraycopy(raw, 0, out, 32 - raw.length, raw.length);
        }
        return out;
    }

    static byte[] concat(byte[]... parts) {
        int length = 0;
        for (byte[] part : parts) {
            length += part.length;
        }
        byte[] out = new byte[length];
        int offset = 0;
        for (byte[] part : parts) {
            System.arraycopy(part, 0, out, offset, part.length);
            offset += part.length;
        }
        return out;
    }

    private Secp256k1() {
        // Utility class
    }
}
