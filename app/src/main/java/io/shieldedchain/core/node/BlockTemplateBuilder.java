package io.shieldedchain.core.node;

import io.shieldedchain.core.consensus.AmountRangeException;
import io.shieldedchain.core.consensus.Amounts;
import io.shieldedchain.core.consensus.ConsensusParams;
import io.shieldedchain.core.protocol.Block;
import io.shieldedchain.core.protocol.BlockHeader;
import io.shieldedchain.core.protocol.Hash;
import io.shieldedchain.core.protocol.Merkle;
import io.shieldedchain.core.protocol.OutPoint;
import io.shieldedchain.core.protocol.Script;
import io.shieldedchain.core.protocol.Transaction;
import io.shieldedchain.core.protocol.TxIn;
import io.shieldedchain.core.protocol.TxOut;
import io.shieldedchain.core.storage.ChainTip;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Builds a candidate block on top of a chain-tip snapshot: coinbase first, then the selected
 * transactions, header time one second past the tip's median time past, Merkle root over txids.
 * Nonce and solution are left empty for the proof-of-work search.
 */
public final class BlockTemplateBuilder {
    private static final Logger LOG = Logger.getLogger(BlockTemplateBuilder.class.getName());

    private final ConsensusParams params;
    private final AtomicLong extraNonce = new AtomicLong();

    public BlockTemplateBuilder(ConsensusParams params) {
        this.params = params;
    }

    /**
     * Failures of {@code source} propagate unchanged. Does not touch chain state.
     */
    public Block build(TransactionSource source, ChainTip tip, Script rewardDestination) {
        TransactionSelection selection = source.select(rewardDestination);
        long height = tip.height() + 1;

        long reward;
        try {
            reward = Amounts.add(params.subsidy(height), selection.totalFees());
        } catch (AmountRangeException e) {
            throw new IllegalStateException("Coinbase value out of range at height " + height, e);
        }

        // extraNonce keeps coinbases, and thus Merkle roots, distinct across templates at one height
        Transaction coinbase = Transaction.builder()
                .input(new TxIn(OutPoint.NULL, Script.coinbase(height, extraNonce.incrementAndGet())))
                .output(new TxOut(reward, rewardDestination))
                .build();

        List<Transaction> txs = new ArrayList<>(selection.transactions().size() + 1);
        txs.add(coinbase);
        txs.addAll(selection.transactions());

        List<Hash> ids = new ArrayList<>(txs.size());
        for (Transaction tx : txs) ids.add(tx.txid());

        BlockHeader hdr = new BlockHeader(
                BlockHeader.CURRENT_VERSION,
                tip.hash(),
                Merkle.rootOf(ids),
                tip.medianTimePast() + 1,
                tip.bits(),
                Hash.ZERO,
                null
        );
        LOG.fine(() -> "Template at height " + height + ": " + txs.size() + " txs, coinbase "
                + Amounts.format(reward));
        return new Block(hdr, txs);
    }
}
