package io.shieldedchain.core.protocol;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;

/**
 * Raw script bytes. Interpretation (signature checks, standardness) lives outside this core;
 * only the handful of templates the miner needs are built here.
 */
public final class Script {
    public static final Script EMPTY = new Script(new byte[0]);

    static final int OP_0 = 0x00;
    static final int OP_1NEGATE = 0x4f;
    static final int OP_1 = 0x51;
    static final int OP_DUP = 0x76;
    static final int OP_EQUALVERIFY = 0x88;
    static final int OP_HASH160 = 0xa9;
    static final int OP_CHECKSIG = 0xac;

    public static final int KEY_HASH_LENGTH = 20;

    private final byte[] bytes;

    public Script(byte[] bytes) {
        this.bytes = bytes != null ? bytes.clone() : new byte[0];
    }

    /** OP_DUP OP_HASH160 &lt;20-byte key hash&gt; OP_EQUALVERIFY OP_CHECKSIG */
    public static Script payToKeyHash(byte[] keyHash) {
        if (keyHash == null || keyHash.length != KEY_HASH_LENGTH) {
            throw new IllegalArgumentException("key hash must be 20 bytes");
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(25);
        out.write(OP_DUP);
        out.write(OP_HASH160);
        out.write(KEY_HASH_LENGTH);
        out.write(keyHash, 0, keyHash.length);
        out.write(OP_EQUALVERIFY);
        out.write(OP_CHECKSIG);
        return new Script(out.toByteArray());
    }

    /**
     * Coinbase scriptSig: the block height followed by an extra nonce, both as minimal script numbers.
     * Always at least two bytes long.
     */
    public static Script coinbase(long height, long extraNonce) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        pushNumber(out, height);
        pushNumber(out, extraNonce);
        return new Script(out.toByteArray());
    }

    /** The height push every coinbase scriptSig must start with. */
    public static Script heightPush(long height) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        pushNumber(out, height);
        return new Script(out.toByteArray());
    }

    public boolean isPayToKeyHash() {
        return bytes.length == 25
                && (bytes[0] & 0xff) == OP_DUP
                && (bytes[1] & 0xff) == OP_HASH160
                && bytes[2] == KEY_HASH_LENGTH
                && (bytes[23] & 0xff) == OP_EQUALVERIFY
                && (bytes[24] & 0xff) == OP_CHECKSIG;
    }

    public byte[] bytes() { return bytes.clone(); }
    public int size() { return bytes.length; }

    private static void pushNumber(ByteArrayOutputStream out, long n) {
        if (n == 0) {
            out.write(OP_0);
            return;
        }
        if (n == -1) {
            out.write(OP_1NEGATE);
            return;
        }
        if (n >= 1 && n <= 16) {
            out.write(OP_1 + (int) (n - 1));
            return;
        }
        byte[] num = encodeScriptNum(n);
        out.write(num.length);
        out.write(num, 0, num.length);
    }

    // Little-endian magnitude with a sign bit in the top byte.
    private static byte[] encodeScriptNum(long n) {
        boolean negative = n < 0;
        long abs = Math.abs(n);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        while (abs > 0) {
            out.write((int) (abs & 0xff));
            abs >>>= 8;
        }
        byte[] result = out.toByteArray();
        if ((result[result.length - 1] & 0x80) != 0) {
            byte[] extended = Arrays.copyOf(result, result.length + 1);
            extended[result.length] = (byte) (negative ? 0x80 : 0x00);
            return extended;
        }
        if (negative) {
            result[result.length - 1] |= (byte) 0x80;
        }
        return result;
    }

    @Override public boolean equals(Object o){ return o instanceof Script && Arrays.equals(bytes, ((Script)o).bytes); }
    @Override public int hashCode(){ return Arrays.hashCode(bytes); }
    @Override public String toString(){ return "Script(" + Hash.toHex(bytes) + ")"; }
}
