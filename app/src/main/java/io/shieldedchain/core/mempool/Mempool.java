package io.shieldedchain.core.mempool;

import io.shieldedchain.core.consensus.AmountRangeException;
import io.shieldedchain.core.consensus.Amounts;
import io.shieldedchain.core.node.TransactionSelection;
import io.shieldedchain.core.node.TransactionSource;
import io.shieldedchain.core.protocol.Hash;
import io.shieldedchain.core.protocol.JoinSplit;
import io.shieldedchain.core.protocol.OutPoint;
import io.shieldedchain.core.protocol.ProtocolLimits;
import io.shieldedchain.core.protocol.Script;
import io.shieldedchain.core.protocol.SpendDescription;
import io.shieldedchain.core.protocol.Transaction;
import io.shieldedchain.core.protocol.TxIn;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal mempool:
 * - admits transactions that pass {@link TxValidator}, with the fee supplied by the caller
 *   (input values need the UTXO set, which lives outside this core)
 * - refuses a transaction that spends a prevout or nullifier already claimed by a pooled one
 * - selection is FIFO by insertion, capped by count and block weight
 */
public final class Mempool implements TransactionSource {

    // Room left in a block for the header and coinbase.
    static final int COINBASE_WEIGHT_RESERVE = 4_000;

    private record Entry(Transaction tx, long fee) {}

    private final Map<Hash, Entry> byTxid = new LinkedHashMap<>();
    private final Map<OutPoint, Hash> spentPrevouts = new HashMap<>();
    private final Map<Hash, Hash> joinSplitNullifiers = new HashMap<>();
    private final Map<Hash, Hash> spendNullifiers = new HashMap<>();
    private final TxValidator validator;
    private final int maxTxPerBlock;

    public Mempool(TxValidator validator, int maxTxPerBlock) {
        this.validator = validator;
        this.maxTxPerBlock = maxTxPerBlock;
    }

    /** Validate and add a tx. Returns false if it is already pooled. */
    public synchronized boolean add(Transaction tx, long fee) {
        validator.validate(tx, fee);
        Hash txid = tx.txid();
        if (byTxid.containsKey(txid)) {
            return false;
        }
        for (TxIn in : tx.inputs()) {
            if (spentPrevouts.containsKey(in.prevout())) {
                throw new IllegalArgumentException("txn-mempool-conflict: prevout already spent by " + spentPrevouts.get(in.prevout()).hex());
            }
        }
        for (JoinSplit js : tx.joinSplits()) {
            for (Hash nf : js.nullifiers()) {
                if (joinSplitNullifiers.containsKey(nf)) {
                    throw new IllegalArgumentException("txn-mempool-conflict: join-split nullifier already spent");
                }
            }
        }
        for (SpendDescription spend : tx.spends()) {
            if (spendNullifiers.containsKey(spend.nullifier())) {
                throw new IllegalArgumentException("txn-mempool-conflict: spend nullifier already spent");
            }
        }

        byTxid.put(txid, new Entry(tx, fee));
        for (TxIn in : tx.inputs()) spentPrevouts.put(in.prevout(), txid);
        for (JoinSplit js : tx.joinSplits()) {
            for (Hash nf : js.nullifiers()) joinSplitNullifiers.put(nf, txid);
        }
        for (SpendDescription spend : tx.spends()) spendNullifiers.put(spend.nullifier(), txid);
        return true;
    }

    /** Picks pooled transactions in arrival order; the pool does not rank by payout destination. */
    @Override
    public synchronized TransactionSelection select(Script rewardDestination) {
        List<Transaction> picked = new ArrayList<>();
        long fees = 0L;
        long weight = COINBASE_WEIGHT_RESERVE;
        for (Entry e : byTxid.values()) {
            if (picked.size() >= maxTxPerBlock) break;
            long txWeight = (long) e.tx().serializedSize() * ProtocolLimits.WITNESS_SCALE_FACTOR;
            if (weight + txWeight > ProtocolLimits.MAX_BLOCK_WEIGHT) continue;
            try {
                fees = Amounts.add(fees, e.fee());
            } catch (AmountRangeException ex) {
                break;
            }
            weight += txWeight;
            picked.add(e.tx());
        }
        return new TransactionSelection(picked, fees);
    }

    /** Remove transactions that made it into a block. */
    public synchronized void removeAll(Collection<Transaction> included) {
        for (Transaction tx : included) {
            Entry removed = byTxid.remove(tx.txid());
            if (removed == null) continue;
            for (TxIn in : tx.inputs()) spentPrevouts.remove(in.prevout());
            for (JoinSplit js : tx.joinSplits()) {
                for (Hash nf : js.nullifiers()) joinSplitNullifiers.remove(nf);
            }
            for (SpendDescription spend : tx.spends()) spendNullifiers.remove(spend.nullifier());
        }
    }

    public synchronized boolean contains(Hash txid) { return byTxid.containsKey(txid); }

    public synchronized int size() { return byTxid.size(); }
}
