package io.shieldedchain.core.protocol;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.util.Objects;

import static io.shieldedchain.core.protocol.WireCodec.*;

/**
 * Block header:
 * - version
 * - prevHash: link to the previous block
 * - merkleRoot: commitment to all txids in this block
 * - time: seconds since epoch (uint32)
 * - bits: compact difficulty target
 * - nonce: 256-bit little-endian counter varied by the miner
 * - solution: Equihash solution bound to everything before it
 *
 * Immutable; the miner derives new headers through the {@code with*} copies.
 */
public final class BlockHeader {
    public static final int CURRENT_VERSION = 4;

    private final int version;
    private final Hash prevHash;
    private final Hash merkleRoot;
    private final long time;
    private final long bits;
    private final Hash nonce;
    private final byte[] solution;

    public BlockHeader(int version, Hash prevHash, Hash merkleRoot, long time, long bits,
                       Hash nonce, byte[] solution) {
        this.version = version;
        this.prevHash = Objects.requireNonNull(prevHash, "prevHash");
        this.merkleRoot = Objects.requireNonNull(merkleRoot, "merkleRoot");
        this.time = time;
        this.bits = bits;
        this.nonce = nonce != null ? nonce : Hash.ZERO;
        this.solution = solution != null ? solution.clone() : new byte[0];
        basicValidate();
    }

    public int version() { return version; }
    public Hash prevHash() { return prevHash; }
    public Hash merkleRoot() { return merkleRoot; }
    public long time() { return time; }
    public long bits() { return bits; }
    public Hash nonce() { return nonce; }
    public byte[] solution() { return solution.clone(); }

    public BlockHeader withNonce(Hash n) {
        return new BlockHeader(version, prevHash, merkleRoot, time, bits, n, solution);
    }

    public BlockHeader withSolution(byte[] s) {
        return new BlockHeader(version, prevHash, merkleRoot, time, bits, nonce, s);
    }

    public BlockHeader withMerkleRoot(Hash root) {
        return new BlockHeader(version, prevHash, root, time, bits, nonce, solution);
    }

    /** Header bytes preceding the nonce: the fixed prefix absorbed once per search. */
    public byte[] powInputBytes() {
        ByteArrayOutputStream out = new ByteArrayOutputStream(80);
        writePowInput(out);
        return out.toByteArray();
    }

    public byte[] serialize() {
        ByteArrayOutputStream out = new ByteArrayOutputStream(112 + solution.length);
        writePowInput(out);
        writeHash(out, nonce);
        writeVarBytes(out, solution);
        return out.toByteArray();
    }

    public Hash hash() {
        return Hashes.sha256d(serialize());
    }

    public static BlockHeader read(ByteBuffer buf) {
        int version = buf.getInt();
        Hash prev = readHash(buf);
        Hash merkle = readHash(buf);
        long time = readUint32(buf);
        long bits = readUint32(buf);
        Hash nonce = readHash(buf);
        byte[] solution = readVarBytes(buf);
        return new BlockHeader(version, prev, merkle, time, bits, nonce, solution);
    }

    public void basicValidate() {
        if (time < 0 || time > 0xFFFF_FFFFL) throw new IllegalArgumentException("time must be a uint32");
        if (bits < 0 || bits > 0xFFFF_FFFFL) throw new IllegalArgumentException("bits must be a uint32");
    }

    private void writePowInput(ByteArrayOutputStream out) {
        writeInt32(out, version);
        writeHash(out, prevHash);
        writeHash(out, merkleRoot);
        writeUint32(out, time);
        writeUint32(out, bits);
    }

    @Override public String toString() {
        return "BlockHeader{prev=" + prevHash.hex().substring(0, 8) + ", time=" + time
                + ", bits=0x" + Long.toHexString(bits) + "}";
    }
}
