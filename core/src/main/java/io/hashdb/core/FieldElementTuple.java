package io.hashdb.core;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * A 256-bit value expressed as four unsigned 64-bit limbs.
 * <p>
 * Used as tree key, tree root, node hash and proof sibling. fe0 is the least
 * significant limb, so the scalar value is fe3*2^192 + fe2*2^128 + fe1*2^64 + fe0.
 * <p>
 * String form: 64 lowercase hex digits of the scalar (no prefix). This is the
 * form used for read-log keys, flush data keys and LoadDB keys.
 */
public record FieldElementTuple(long fe0, long fe1, long fe2, long fe3) {

    /** The empty tree root / empty child. */
    public static final FieldElementTuple ZERO = new FieldElementTuple(0, 0, 0, 0);

    private static final BigInteger MASK_64 = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    public static FieldElementTuple of(long[] limbs, int offset) {
        Objects.requireNonNull(limbs, "limbs");
        if (offset < 0 || offset + 4 > limbs.length) {
            throw new IllegalArgumentException("need 4 limbs at offset " + offset + ", have " + limbs.length);
        }
        return new FieldElementTuple(limbs[offset], limbs[offset + 1], limbs[offset + 2], limbs[offset + 3]);
    }

    public static FieldElementTuple of(List<Long> limbs) {
        Objects.requireNonNull(limbs, "limbs");
        if (limbs.size() != 4) {
            throw new IllegalArgumentException("expected 4 limbs, got " + limbs.size());
        }
        return new FieldElementTuple(limbs.get(0), limbs.get(1), limbs.get(2), limbs.get(3));
    }

    /**
     * Parse the hex string form. Accepts an optional "0x" prefix and fewer than 64 digits.
     */
    public static FieldElementTuple parse(String hex) {
        if (hex == null || hex.isBlank()) {
            throw new IllegalArgumentException("hash string must not be empty");
        }
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (digits.isEmpty() || digits.length() > 64) {
            throw new IllegalArgumentException("invalid hash string: " + hex);
        }
        try {
            return fromScalar(new BigInteger(digits, 16));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid hash string: " + hex, e);
        }
    }

    public static FieldElementTuple fromScalar(BigInteger scalar) {
        if (scalar.signum() < 0 || scalar.bitLength() > 256) {
            throw new IllegalArgumentException("scalar out of 256-bit range");
        }
        return new FieldElementTuple(
                scalar.and(MASK_64).longValue(),
                scalar.shiftRight(64).and(MASK_64).longValue(),
                scalar.shiftRight(128).and(MASK_64).longValue(),
                scalar.shiftRight(192).and(MASK_64).longValue()
        );
    }

    public BigInteger toScalar() {
        return unsigned(fe3).shiftLeft(192)
                .or(unsigned(fe2).shiftLeft(128))
                .or(unsigned(fe1).shiftLeft(64))
                .or(unsigned(fe0));
    }

    public boolean isZero() {
        return fe0 == 0 && fe1 == 0 && fe2 == 0 && fe3 == 0;
    }

    public long limb(int i) {
        return switch (i) {
            case 0 -> fe0;
            case 1 -> fe1;
            case 2 -> fe2;
            case 3 -> fe3;
            default -> throw new IndexOutOfBoundsException("limb " + i);
        };
    }

    public long[] toArray() {
        return new long[] { fe0, fe1, fe2, fe3 };
    }

    public List<Long> toList() {
        return List.of(fe0, fe1, fe2, fe3);
    }

    /** 64 lowercase hex digits, most significant limb first. */
    public String toHex() {
        return String.format("%016x%016x%016x%016x", fe3, fe2, fe1, fe0);
    }

    @Override
    public String toString() {
        return toHex();
    }

    private static BigInteger unsigned(long v) {
        BigInteger b = BigInteger.valueOf(v);
        return v >= 0 ? b : b.and(MASK_64);
    }
}
