package io.shieldedchain.core.protocol;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Block = header + ordered transactions, the first of which is the coinbase.
 */
public final class Block {
    private final BlockHeader header;
    private final List<Transaction> transactions;

    public Block(BlockHeader header, List<Transaction> txs) {
        this.header = Objects.requireNonNull(header, "missing header");
        this.transactions = txs != null ? List.copyOf(txs) : List.of();
        basicValidate();
    }

    public BlockHeader header() { return header; }
    public List<Transaction> transactions() { return transactions; }
    public Hash hash() { return header.hash(); }

    public Block withHeader(BlockHeader h) {
        return new Block(h, transactions);
    }

    public Transaction coinbase() {
        if (transactions.isEmpty()) {
            throw new IllegalStateException("block has no transactions");
        }
        return transactions.get(0);
    }

    public Hash computeMerkleRoot() {
        List<Hash> leaves = new ArrayList<>(transactions.size());
        for (Transaction tx : transactions) leaves.add(tx.txid());
        return Merkle.rootOf(leaves);
    }

    public byte[] serialize() {
        return BlockCodec.toBytes(this);
    }

    public void basicValidate() {
        if (transactions.size() > ProtocolLimits.MAX_TXS_PER_BLOCK) throw new IllegalArgumentException("too many txs");
    }

    @Override public String toString() {
        return "Block{hash=" + hash().hex().substring(0, 16) + ", txs=" + transactions.size() + "}";
    }
}
