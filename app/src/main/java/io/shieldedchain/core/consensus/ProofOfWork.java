package io.shieldedchain.core.consensus;

import io.shieldedchain.core.protocol.Hash;
import io.shieldedchain.core.protocol.Hashes;

import java.math.BigInteger;

/**
 * Difficulty target maths.
 * - Targets travel in headers as compact "bits": one size byte, then a 3-byte mantissa.
 * - A hash satisfies a target when, read as a little-endian uint256, it is {@code <=} the target.
 */
public final class ProofOfWork {
    private ProofOfWork() {}

    /** Largest possible target; every hash meets it. */
    public static final BigInteger MAX_TARGET = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private static final long SIGN_BIT = 0x0080_0000L;
    private static final long MANTISSA_MASK = 0x007f_ffffL;

    /** Quick check: does this hash meet the target? */
    public static boolean meetsTarget(Hash hash, BigInteger target) {
        return Hashes.toUint256(hash).compareTo(target) <= 0;
    }

    /**
     * Full header check: bits must decode to a positive, non-overflowing target no easier than
     * {@code powLimit}, and the hash must meet it.
     */
    public static boolean checkProofOfWork(Hash hash, long bits, BigInteger powLimit) {
        if (isNegative(bits) || isOverflow(bits)) {
            return false;
        }
        BigInteger target = decodeCompact(bits);
        if (target.signum() == 0 || target.compareTo(powLimit) > 0) {
            return false;
        }
        return meetsTarget(hash, target);
    }

    public static BigInteger decodeCompact(long bits) {
        int size = (int) ((bits >>> 24) & 0xff);
        long word = bits & MANTISSA_MASK;
        if (size <= 3) {
            return BigInteger.valueOf(word >>> (8 * (3 - size)));
        }
        return BigInteger.valueOf(word).shiftLeft(8 * (size - 3));
    }

    public static long encodeCompact(BigInteger target) {
        if (target.signum() < 0) {
            throw new IllegalArgumentException("negative target");
        }
        int size = (target.bitLength() + 7) / 8;
        long compact;
        if (size <= 3) {
            compact = target.longValue() << (8 * (3 - size));
        } else {
            compact = target.shiftRight(8 * (size - 3)).longValue();
        }
        // The mantissa is signed; move a set top bit into the next size step.
        if ((compact & SIGN_BIT) != 0) {
            compact >>>= 8;
            size++;
        }
        return compact | ((long) size << 24);
    }

    static boolean isNegative(long bits) {
        return (bits & MANTISSA_MASK) != 0 && (bits & SIGN_BIT) != 0;
    }

    static boolean isOverflow(long bits) {
        int size = (int) ((bits >>> 24) & 0xff);
        long word = bits & MANTISSA_MASK;
        return word != 0 && (size > 34 || (word > 0xff && size > 33) || (word > 0xffff && size > 32));
    }
}
