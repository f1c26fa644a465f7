package io.shieldedchain.core.protocol;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlockCodecTest {

    private static Block sample() {
        Transaction cb = TxFixtures.coinbase(Script.coinbase(7, 1), 50);
        Transaction tx = TxFixtures.transparent(9).build();
        BlockHeader h = new BlockHeader(BlockHeader.CURRENT_VERSION, Hash.repeat(0x01), Hash.ZERO,
                1_700_000_000L, 0x200f0f0fL, Hash.repeat(0x05), new byte[]{1, 2, 3});
        Block unrooted = new Block(h, List.of(cb, tx));
        return unrooted.withHeader(h.withMerkleRoot(unrooted.computeMerkleRoot()));
    }

    @Test
    void roundTripPreservesHashAndTransactions() {
        Block block = sample();
        Block decoded = BlockCodec.fromBytes(block.serialize());

        assertEquals(block.hash(), decoded.hash());
        assertEquals(2, decoded.transactions().size());
        assertEquals(block.coinbase().txid(), decoded.coinbase().txid());
        assertArrayEquals(new byte[]{1, 2, 3}, decoded.header().solution());
        assertEquals(Hash.repeat(0x05), decoded.header().nonce());
    }

    @Test
    void headerHashCoversNonceAndSolution() {
        BlockHeader h = sample().header();
        assertNotEquals(h.hash(), h.withNonce(Hash.repeat(0x06)).hash());
        assertNotEquals(h.hash(), h.withSolution(new byte[]{1, 2, 4}).hash());
        // the search prefix excludes both
        assertArrayEquals(h.powInputBytes(), h.withNonce(Hash.repeat(0x06)).withSolution(null).powInputBytes());
        assertEquals(4 + 32 + 32 + 4 + 4, h.powInputBytes().length);
    }

    @Test
    void merkleRootDuplicatesOddLeaf() {
        Hash a = Hash.repeat(0xaa);
        Hash b = Hash.repeat(0xbb);
        Hash c = Hash.repeat(0xcc);
        assertEquals(Hash.ZERO, Merkle.rootOf(List.of()));
        assertEquals(a, Merkle.rootOf(List.of(a)));
        Hash ab = Merkle.rootOf(List.of(a, b));
        Hash cc = Merkle.rootOf(List.of(c, c));
        assertEquals(Merkle.rootOf(List.of(ab, cc)), Merkle.rootOf(List.of(a, b, c)));
    }

    @Test
    void trailingBytesAreRejected() {
        byte[] bytes = sample().serialize();
        byte[] longer = java.util.Arrays.copyOf(bytes, bytes.length + 2);
        assertThrows(IllegalArgumentException.class, () -> BlockCodec.fromBytes(longer));
    }
}
