package io.shieldedchain.core.node;

import io.shieldedchain.core.consensus.ConsensusParams;
import io.shieldedchain.core.consensus.EquihashParams;
import io.shieldedchain.core.consensus.ProofOfWork;
import io.shieldedchain.core.mempool.Mempool;
import io.shieldedchain.core.pow.PowSearch;
import io.shieldedchain.core.protocol.Block;
import io.shieldedchain.core.protocol.OutPoint;
import io.shieldedchain.core.protocol.Script;
import io.shieldedchain.core.protocol.Transaction;
import io.shieldedchain.core.storage.ChainStore;
import io.shieldedchain.core.storage.ChainTip;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.logging.Logger;

/**
 * Mines one block at a time: snapshot the tip and build a template under the read lock,
 * search with no lock held, then submit through the gate and evict the mined transactions.
 */
public final class Miner {
    private static final Logger LOG = Logger.getLogger(Miner.class.getName());

    private final ChainStore chain;
    private final ReadWriteLock chainLock;
    private final Mempool mempool;
    private final BlockTemplateBuilder builder;
    private final PowSearch search;
    private final SubmissionGate gate;
    private final ConsensusParams params;
    private final NodeConfig config;
    private final DestinationDecoder decoder;

    public Miner(ChainStore chain, ReadWriteLock chainLock, Mempool mempool, BlockTemplateBuilder builder,
                 PowSearch search, SubmissionGate gate, ConsensusParams params, NodeConfig config,
                 DestinationDecoder decoder) {
        this.chain = chain;
        this.chainLock = chainLock;
        this.mempool = mempool;
        this.builder = builder;
        this.search = search;
        this.gate = gate;
        this.params = params;
        this.config = config;
        this.decoder = decoder;
    }

    /**
     * Mine one block paying {@code address}.
     *
     * @throws IllegalArgumentException if the address does not decode
     * @throws IllegalStateException if the decoded script is not a pay-to-key-hash script
     */
    public Optional<OutPoint> generateToAddress(String address) throws InterruptedException {
        Script destination = decoder.decode(address);
        if (!destination.isPayToKeyHash()) {
            throw new IllegalStateException("Decoder produced a malformed reward script for " + address);
        }
        return mineBlock(destination);
    }

    /** Returns the coinbase outpoint of the mined block, or empty when the nonce budget ran out. */
    public Optional<OutPoint> mineBlock(Script rewardDestination) throws InterruptedException {
        ChainTip tip;
        Block template;
        chainLock.readLock().lock();
        try {
            tip = chain.tip();
            template = builder.build(mempool, tip, rewardDestination);
        } finally {
            chainLock.readLock().unlock();
        }

        long height = tip.height() + 1;
        BigInteger target = ProofOfWork.decodeCompact(template.header().bits());
        EquihashParams equihash = params.equihashFor(height);

        Optional<Block> solved = search.solve(template, target, config.maxPowTries, equihash);
        if (solved.isEmpty()) {
            LOG.info("No solution within " + config.maxPowTries + " nonce(s) at height " + height);
            return Optional.empty();
        }

        Block block = solved.get();
        OutPoint reward = gate.submit(block);
        List<Transaction> txs = block.transactions();
        mempool.removeAll(txs.subList(1, txs.size()));
        LOG.info("Mined block " + block.hash().hex() + " at height " + height
                + " with " + txs.size() + " tx(s)");
        return Optional.of(reward);
    }
}
