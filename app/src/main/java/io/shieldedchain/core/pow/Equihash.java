package io.shieldedchain.core.pow;

import io.shieldedchain.core.consensus.EquihashParams;
import io.shieldedchain.core.protocol.BlockHeader;
import org.bouncycastle.crypto.digests.Blake2bDigest;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Equihash building blocks shared by the solver and the verifier.
 *
 * Hash i is bytes {@code [(i % perOutput) * N/8, +N/8)} of
 * {@code BLAKE2b(state || le32(i / perOutput))}, split MSB-first into K+1 chunks of
 * {@code N/(K+1)} bits. Round r of the tree collides on chunk r; the final XOR must be zero.
 */
public final class Equihash {
    private Equihash() {}

    /** Fresh BLAKE2b state personalised with {@code personalization || le32(N) || le32(K)}. */
    public static Blake2bDigest initialiseState(EquihashParams p) {
        byte[] personal = new byte[16];
        byte[] prefix = p.personalization().getBytes(StandardCharsets.US_ASCII);
        System.arraycopy(prefix, 0, personal, 0, prefix.length);
        putLe32(personal, 8, p.n());
        putLe32(personal, 12, p.k());
        return new Blake2bDigest(null, p.hashOutputLength(), null, personal);
    }

    /** State over the header's fixed prefix followed by its nonce. */
    public static Blake2bDigest stateFor(EquihashParams p, BlockHeader header) {
        Blake2bDigest state = initialiseState(p);
        byte[] prefix = header.powInputBytes();
        state.update(prefix, 0, prefix.length);
        byte[] nonce = header.nonce().bytes();
        state.update(nonce, 0, nonce.length);
        return state;
    }

    public static boolean isValidSolution(EquihashParams p, BlockHeader header) {
        return isValidSolution(p, stateFor(p, header), header.solution());
    }

    public static boolean isValidSolution(EquihashParams p, Blake2bDigest state, byte[] solution) {
        if (solution == null || solution.length != p.solutionWidth()) {
            return false;
        }
        int[] indices = decodeIndices(solution, p.collisionBitLength() + 1, p.solutionIndices());

        List<Row> level = new ArrayList<>(indices.length);
        for (int index : indices) {
            byte[] digest = hashBlock(p, state, index / p.indicesPerHashOutput());
            level.add(new Row(chunks(p, digest, (index % p.indicesPerHashOutput()) * p.hashLength()), new int[]{index}));
        }

        for (int r = 0; r < p.k(); r++) {
            List<Row> next = new ArrayList<>(level.size() / 2);
            for (int i = 0; i < level.size(); i += 2) {
                Row left = level.get(i);
                Row right = level.get(i + 1);
                if (left.chunks[r] != right.chunks[r]) {
                    return false;
                }
                if (left.indices[0] >= right.indices[0]) {
                    return false;
                }
                if (!Row.distinct(left, right)) {
                    return false;
                }
                next.add(Row.join(left, right));
            }
            level = next;
        }
        return level.get(0).chunks[p.k()] == 0;
    }

    // ---------- package helpers ----------

    static byte[] hashBlock(EquihashParams p, Blake2bDigest state, int g) {
        Blake2bDigest d = new Blake2bDigest(state);
        byte[] le = new byte[4];
        putLe32(le, 0, g);
        d.update(le, 0, le.length);
        byte[] out = new byte[p.hashOutputLength()];
        d.doFinal(out, 0);
        return out;
    }

    static int[] chunks(EquihashParams p, byte[] digest, int offset) {
        int cbl = p.collisionBitLength();
        int[] out = new int[p.k() + 1];
        int base = offset * 8;
        for (int j = 0; j <= p.k(); j++) {
            int v = 0;
            for (int b = 0; b < cbl; b++) {
                int pos = base + j * cbl + b;
                v = (v << 1) | ((digest[pos >>> 3] >>> (7 - (pos & 7))) & 1);
            }
            out[j] = v;
        }
        return out;
    }

    /** Packs each index into {@code bitLen} bits, most significant bit first. */
    static byte[] encodeIndices(int[] indices, int bitLen) {
        byte[] out = new byte[indices.length * bitLen / 8];
        int pos = 0;
        for (int index : indices) {
            for (int b = bitLen - 1; b >= 0; b--, pos++) {
                if (((index >>> b) & 1) != 0) {
                    out[pos >>> 3] |= (byte) (0x80 >>> (pos & 7));
                }
            }
        }
        return out;
    }

    static int[] decodeIndices(byte[] packed, int bitLen, int count) {
        int[] out = new int[count];
        int pos = 0;
        for (int i = 0; i < count; i++) {
            int v = 0;
            for (int b = 0; b < bitLen; b++, pos++) {
                v = (v << 1) | ((packed[pos >>> 3] >>> (7 - (pos & 7))) & 1);
            }
            out[i] = v;
        }
        return out;
    }

    private static void putLe32(byte[] buf, int off, int v) {
        buf[off] = (byte) v;
        buf[off + 1] = (byte) (v >>> 8);
        buf[off + 2] = (byte) (v >>> 16);
        buf[off + 3] = (byte) (v >>> 24);
    }

    /** Partial XOR of hash chunks together with the indices that produced it, left subtree first. */
    static final class Row {
        final int[] chunks;
        final int[] indices;

        Row(int[] chunks, int[] indices) {
            this.chunks = chunks;
            this.indices = indices;
        }

        /** Concatenates in the given order; the caller decides which side goes first. */
        static Row join(Row left, Row right) {
            int[] x = new int[left.chunks.length];
            for (int i = 0; i < x.length; i++) {
                x[i] = left.chunks[i] ^ right.chunks[i];
            }
            int[] idx = Arrays.copyOf(left.indices, left.indices.length + right.indices.length);
            System.arraycopy(right.indices, 0, idx, left.indices.length, right.indices.length);
            return new Row(x, idx);
        }

        /** Joins with the subtree holding the smaller first index on the left. */
        static Row ordered(Row a, Row b) {
            return a.indices[0] < b.indices[0] ? join(a, b) : join(b, a);
        }

        static boolean distinct(Row a, Row b) {
            int[] all = Arrays.copyOf(a.indices, a.indices.length + b.indices.length);
            System.arraycopy(b.indices, 0, all, a.indices.length, b.indices.length);
            Arrays.sort(all);
            for (int i = 1; i < all.length; i++) {
                if (all[i] == all[i - 1]) {
                    return false;
                }
            }
            return true;
        }
    }
}
