package io.shieldedchain.core.consensus;

import io.shieldedchain.core.node.GenesisBuilder;
import io.shieldedchain.core.node.RegtestBlocks;
import io.shieldedchain.core.pow.BasicEquihashSolver;
import io.shieldedchain.core.pow.PowSearch;
import io.shieldedchain.core.protocol.Block;
import io.shieldedchain.core.protocol.BlockHeader;
import io.shieldedchain.core.protocol.Hash;
import io.shieldedchain.core.protocol.Script;
import io.shieldedchain.core.protocol.Transaction;
import io.shieldedchain.core.protocol.TxFixtures;
import io.shieldedchain.core.storage.ChainTip;
import io.shieldedchain.core.storage.InMemoryChainStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static io.shieldedchain.core.protocol.TxFixtures.PAYEE;
import static org.junit.jupiter.api.Assertions.*;

class BlockChecksTest {

    private static final ConsensusParams PARAMS = RegtestBlocks.PARAMS;

    private ChainTip tip;
    private long now;

    @BeforeEach
    void setUp() {
        InMemoryChainStore chain = new InMemoryChainStore();
        chain.putBlock(GenesisBuilder.build(PARAMS));
        tip = chain.tip();
        now = tip.medianTimePast() + 60;
    }

    private String rejection(Block block, ChainTip against, long nowSeconds) {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> BlockChecks.validateBlock(block, against, PARAMS, nowSeconds));
        return e.getMessage();
    }

    /** Re-roots and solves a block carrying {@code txs} on top of the tip. */
    private Block solvedWith(List<Transaction> txs) {
        BlockHeader h = RegtestBlocks.template(tip, PAYEE).header();
        Block unrooted = new Block(h, txs);
        return RegtestBlocks.solve(unrooted.withHeader(h.withMerkleRoot(unrooted.computeMerkleRoot())), 1);
    }

    @Test
    void acceptsSolvedTemplate() {
        Block block = RegtestBlocks.solve(RegtestBlocks.template(tip, PAYEE), 1);
        assertDoesNotThrow(() -> BlockChecks.validateBlock(block, tip, PARAMS, now));
    }

    @Test
    void headerContextFailures() {
        Block block = RegtestBlocks.solve(RegtestBlocks.template(tip, PAYEE), 1);
        long time = block.header().time();

        ChainTip otherParent = new ChainTip(Hash.repeat(9), tip.height(), tip.medianTimePast(), tip.bits());
        assertTrue(rejection(block, otherParent, now).startsWith("bad-prevblk"));

        ChainTip lateMedian = new ChainTip(tip.hash(), tip.height(), time, tip.bits());
        assertTrue(rejection(block, lateMedian, now).startsWith("time-too-old"));

        assertTrue(rejection(block, tip, time - PARAMS.maxFutureBlockTime() - 1).startsWith("time-too-new"));

        ChainTip harder = new ChainTip(tip.hash(), tip.height(), tip.medianTimePast(), 0x1f0f0f0fL);
        assertTrue(rejection(block, harder, now).startsWith("bad-diffbits"));
    }

    @Test
    void tamperedSolutionIsRejected() {
        Block block = RegtestBlocks.solve(RegtestBlocks.template(tip, PAYEE), 1);
        byte[] solution = block.header().solution();
        solution[solution.length - 1] ^= 0x01;
        Block tampered = block.withHeader(block.header().withSolution(solution));
        assertTrue(rejection(tampered, tip, now).startsWith("invalid-solution"));
    }

    @Test
    void solutionAboveTargetIsHighHash() throws Exception {
        Block template = RegtestBlocks.template(tip, PAYEE);
        EquihashParams eh = PARAMS.equihashFor(1);
        BigInteger target = ProofOfWork.decodeCompact(template.header().bits());
        for (int i = 1; i < 200; i++) {
            Block start = template.withHeader(template.header().withNonce(Hash.repeat(i)));
            Block any = new PowSearch(new BasicEquihashSolver())
                    .solve(start, ProofOfWork.MAX_TARGET, 1, eh)
                    .orElse(null);
            if (any != null && !ProofOfWork.meetsTarget(any.hash(), target)) {
                assertTrue(rejection(any, tip, now).startsWith("high-hash"));
                return;
            }
        }
        fail("every candidate met the regtest target");
    }

    @Test
    void coinbasePlacementIsEnforced() {
        Transaction spend = TxFixtures.transparent(1).build();
        assertTrue(rejection(solvedWith(List.of(spend)), tip, now).startsWith("bad-cb-missing"));

        Transaction cb = TxFixtures.coinbase(Script.coinbase(1, 1), 1);
        Transaction cb2 = TxFixtures.coinbase(Script.coinbase(1, 2), 1);
        assertTrue(rejection(solvedWith(List.of(cb, cb2)), tip, now).startsWith("bad-cb-multiple"));
    }

    @Test
    void invalidTransactionReportsItsReasonCode() {
        Transaction cb = TxFixtures.coinbase(Script.coinbase(1, 1), 1);
        Transaction negative = TxFixtures.transparent(-5).build();
        assertTrue(rejection(solvedWith(List.of(cb, negative)), tip, now)
                .startsWith(RejectionReason.NEGATIVE_OUTPUT.code()));
    }

    @Test
    void coinbaseMustCommitToHeight() {
        Transaction wrongHeight = TxFixtures.coinbase(Script.coinbase(2, 1), 1);
        assertTrue(rejection(solvedWith(List.of(wrongHeight)), tip, now).startsWith("bad-cb-height"));
    }

    @Test
    void merkleRootMustMatch() {
        Block template = RegtestBlocks.template(tip, PAYEE);
        Block wrongRoot = template.withHeader(template.header().withMerkleRoot(Hash.repeat(3)));
        assertTrue(rejection(RegtestBlocks.solve(wrongRoot, 1), tip, now).startsWith("bad-txnmrklroot"));
    }
}
