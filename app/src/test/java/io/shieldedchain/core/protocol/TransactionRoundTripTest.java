package io.shieldedchain.core.protocol;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TransactionRoundTripTest {

    @Test
    void roundTripKeepsEveryPool() {
        Transaction tx = TxFixtures.transparent(123)
                .lockTime(42)
                .spend(SpendDescription.ofNullifier(Hash.repeat(0x31)))
                .shieldedOutput(OutputDescription.ofCommitment(Hash.repeat(0x32)))
                .valueBalance(-7)
                .joinSplit(TxFixtures.joinSplit(5, 0, 0x40))
                .build();

        Transaction tx2 = TransactionCodec.fromBytes(tx.serialize());

        assertEquals(tx.txid(), tx2.txid());
        assertEquals(123, tx2.outputs().get(0).value());
        assertEquals(42, tx2.lockTime());
        assertEquals(-7, tx2.valueBalance());
        assertEquals(Hash.repeat(0x31), tx2.spends().get(0).nullifier());
        assertEquals(Hash.repeat(0x32), tx2.shieldedOutputs().get(0).cmu());
        assertEquals(List.of(Hash.repeat(0x40), Hash.repeat(0x41)), tx2.joinSplits().get(0).nullifiers());
        assertEquals(5, tx2.joinSplits().get(0).vpubOld());
    }

    @Test
    void olderVersionsOmitShieldedSections() {
        Transaction v1 = TxFixtures.transparent(1).version(1).build();
        Transaction v4 = TxFixtures.transparent(1).build();
        // v4 adds valueBalance (8) and two empty counts, plus the join-split count
        assertEquals(v1.serializedSize() + 8 + 1 + 1 + 1, v4.serializedSize());
        assertEquals(v1.txid(), TransactionCodec.fromBytes(v1.serialize()).txid());
    }

    @Test
    void shieldedFieldsNeedRecentVersion() {
        assertThrows(IllegalArgumentException.class,
                () -> TxFixtures.transparent(1).version(1).joinSplit(TxFixtures.joinSplit(0, 0, 1)).build());
        assertThrows(IllegalArgumentException.class,
                () -> TxFixtures.transparent(1).version(3).valueBalance(1).build());
    }

    @Test
    void malformedBytesAreRejected() {
        byte[] bytes = TxFixtures.transparent(1).build().serialize();
        byte[] truncated = java.util.Arrays.copyOf(bytes, bytes.length - 3);
        assertThrows(IllegalArgumentException.class, () -> TransactionCodec.fromBytes(truncated));

        byte[] trailing = java.util.Arrays.copyOf(bytes, bytes.length + 1);
        assertThrows(IllegalArgumentException.class, () -> TransactionCodec.fromBytes(trailing));
    }

    @Test
    void coinbaseNeedsExactlyOneNullInput() {
        assertTrue(TxFixtures.coinbase(Script.coinbase(1, 1), 1).isCoinbase());
        assertFalse(TxFixtures.transparent(1).build().isCoinbase());
    }
}
