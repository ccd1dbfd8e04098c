package io.hashdb.core.hash;

import java.math.BigInteger;

/**
 * Conversions between 256-bit leaf values and their limb forms.
 * <p>
 * A leaf value is stored as eight 32-bit limbs, least significant first, each held
 * in the low half of a long. On the wire values travel as decimal strings; a "0x"
 * prefix selects hex.
 */
public final class Scalars {

    public static final BigInteger MAX_EXCLUSIVE = BigInteger.ONE.shiftLeft(256);
    private static final BigInteger MASK_32 = BigInteger.valueOf(0xFFFF_FFFFL);

    private Scalars() {}

    public static BigInteger parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("value must not be empty");
        }
        String v = value.trim();
        BigInteger out;
        try {
            if (v.startsWith("0x") || v.startsWith("0X")) {
                out = new BigInteger(v.substring(2), 16);
            } else {
                out = new BigInteger(v, 10);
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("value must be a decimal or 0x-hex integer: " + value, e);
        }
        if (out.signum() < 0 || out.compareTo(MAX_EXCLUSIVE) >= 0) {
            throw new IllegalArgumentException("value out of range [0, 2^256): " + value);
        }
        return out;
    }

    public static String format(BigInteger value) {
        return value.toString(10);
    }

    public static long[] toLimbs32(BigInteger value) {
        long[] out = new long[8];
        for (int i = 0; i < 8; i++) {
            out[i] = value.shiftRight(32 * i).and(MASK_32).longValue();
        }
        return out;
    }

    public static BigInteger fromLimbs32(long[] limbs, int offset) {
        BigInteger out = BigInteger.ZERO;
        for (int i = 7; i >= 0; i--) {
            long limb = limbs[offset + i];
            if ((limb & 0xFFFF_FFFF_0000_0000L) != 0) {
                throw new IllegalArgumentException("value limb " + i + " exceeds 32 bits");
            }
            out = out.shiftLeft(32).or(BigInteger.valueOf(limb));
        }
        return out;
    }
}
