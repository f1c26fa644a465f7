package io.shieldedchain.core.protocol;

import java.math.BigInteger;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class Hashes {
    private Hashes(){}

    public static byte[] sha256(byte[] in){
        try {
            return MessageDigest.getInstance("SHA-256").digest(in);
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("SHA-256 not available", e);
        }
    }

    /** SHA-256 applied twice, the hash used for txids, block ids and Merkle nodes. */
    public static Hash sha256d(byte[] in) {
        return new Hash(sha256(sha256(in)));
    }

    /** Reads a hash as the little-endian unsigned 256-bit integer compared against targets. */
    public static BigInteger toUint256(Hash hash) {
        byte[] le = hash.bytes();
        byte[] be = new byte[le.length];
        for (int i = 0; i < le.length; i++) {
            be[i] = le[le.length - 1 - i];
        }
        return new BigInteger(1, be);
    }
}
