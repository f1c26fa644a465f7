package io.shieldedchain.core.node;

import io.shieldedchain.core.consensus.ConsensusParams;
import io.shieldedchain.core.consensus.ProofOfWork;
import io.shieldedchain.core.pow.BasicEquihashSolver;
import io.shieldedchain.core.pow.PowSearch;
import io.shieldedchain.core.protocol.Block;
import io.shieldedchain.core.protocol.Script;
import io.shieldedchain.core.storage.ChainTip;

/** Solves regtest blocks for tests that need a real proof of work. */
public final class RegtestBlocks {
    private RegtestBlocks() {}

    public static final ConsensusParams PARAMS = ConsensusParams.regtest();

    public static Block template(ChainTip tip, Script payee) {
        return new BlockTemplateBuilder(PARAMS).build(s -> TransactionSelection.empty(), tip, payee);
    }

    /** Runs the real search on {@code template} at the difficulty its header carries. */
    public static Block solve(Block template, long height) {
        try {
            return new PowSearch(new BasicEquihashSolver())
                    .solve(template, ProofOfWork.decodeCompact(template.header().bits()), 5_000,
                            PARAMS.equihashFor(height))
                    .orElseThrow(() -> new AssertionError("no regtest solution in 5000 nonces"));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError(e);
        }
    }
}
