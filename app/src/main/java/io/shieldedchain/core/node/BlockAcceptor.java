package io.shieldedchain.core.node;

import io.shieldedchain.core.consensus.BlockChecks;
import io.shieldedchain.core.consensus.ConsensusParams;
import io.shieldedchain.core.protocol.Block;
import io.shieldedchain.core.storage.ChainStore;
import io.shieldedchain.core.storage.ChainTip;

import java.util.concurrent.locks.ReadWriteLock;
import java.util.function.LongSupplier;
import java.util.logging.Logger;

/**
 * Acceptance pipeline backed by a {@link ChainStore}: runs {@link BlockChecks} against the current
 * tip and appends the block, all under the chain lock held exclusively.
 */
public final class BlockAcceptor implements AcceptancePipeline {
    private static final Logger LOG = Logger.getLogger(BlockAcceptor.class.getName());

    private final ChainStore chain;
    private final ConsensusParams params;
    private final ReadWriteLock chainLock;
    private final LongSupplier clockSeconds;

    public BlockAcceptor(ChainStore chain, ConsensusParams params, ReadWriteLock chainLock, LongSupplier clockSeconds) {
        this.chain = chain;
        this.params = params;
        this.chainLock = chainLock;
        this.clockSeconds = clockSeconds;
    }

    public BlockAcceptor(ChainStore chain, ConsensusParams params, ReadWriteLock chainLock) {
        this(chain, params, chainLock, () -> System.currentTimeMillis() / 1000L);
    }

    @Override
    public boolean processNewBlock(Block block) {
        chainLock.writeLock().lock();
        try {
            ChainTip tip = chain.tip();
            BlockChecks.validateBlock(block, tip, params, clockSeconds.getAsLong());
            chain.putBlock(block);
            LOG.info("Accepted block " + block.hash().hex() + " at height " + (tip.height() + 1));
            return true;
        } catch (IllegalArgumentException e) {
            LOG.warning("Rejected block " + block.hash().hex() + ": " + e.getMessage());
            return false;
        } finally {
            chainLock.writeLock().unlock();
        }
    }
}
