package io.shieldedchain.core.protocol;

import java.util.Arrays;

/**
 * 32-byte identifier: txids, block hashes, Merkle roots, nullifiers and note commitments.
 * The all-zero value doubles as the "null" marker used by coinbase prevouts and empty roots.
 */
public final class Hash {
    public static final int LENGTH = 32;
    public static final Hash ZERO = new Hash(new byte[LENGTH]);

    private final byte[] bytes;

    public Hash(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Hash must be 32 bytes");
        }
        this.bytes = bytes.clone();
    }

    /** Convenience for tests and fixtures: every byte set to {@code b}. */
    public static Hash repeat(int b) {
        byte[] out = new byte[LENGTH];
        Arrays.fill(out, (byte) b);
        return new Hash(out);
    }

    public byte[] bytes() { return bytes.clone(); }
    public boolean isNull() { return equals(ZERO); }
    public String hex() { return toHex(bytes); }

    static String toHex(byte[] b){
        final char[] HEX="0123456789abcdef".toCharArray();
        char[] out=new char[b.length*2];
        for(int i=0,j=0;i<b.length;i++){int v=b[i]&0xff;out[j++]=HEX[v>>>4];out[j++]=HEX[v&0x0f];}
        return new String(out);
    }

    @Override public boolean equals(Object o){ return o instanceof Hash && Arrays.equals(bytes, ((Hash)o).bytes); }
    @Override public int hashCode(){ return Arrays.hashCode(bytes); }
    @Override public String toString(){ return "Hash("+hex().substring(0,8)+"...)"; }
}
