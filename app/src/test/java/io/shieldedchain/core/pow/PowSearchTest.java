package io.shieldedchain.core.pow;

import io.shieldedchain.core.consensus.ConsensusParams;
import io.shieldedchain.core.consensus.EquihashParams;
import io.shieldedchain.core.consensus.ProofOfWork;
import io.shieldedchain.core.protocol.Block;
import io.shieldedchain.core.protocol.BlockHeader;
import io.shieldedchain.core.protocol.Hash;
import io.shieldedchain.core.protocol.Script;
import io.shieldedchain.core.protocol.TxFixtures;
import org.bouncycastle.crypto.digests.Blake2bDigest;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class PowSearchTest {

    private static final EquihashParams REGTEST = new EquihashParams(48, 5, "ZcashPoW");
    private static final BigInteger NEVER = BigInteger.valueOf(-1);

    /** Yields one fixed candidate per nonce and counts how often it was asked. */
    private static final class CountingSolver implements EquihashSolver {
        final AtomicInteger calls = new AtomicInteger();

        @Override
        public Stream<byte[]> solutions(EquihashParams params, Blake2bDigest state) {
            calls.incrementAndGet();
            return Stream.of(new byte[params.solutionWidth()]);
        }
    }

    private static Block template() {
        BlockHeader h = new BlockHeader(BlockHeader.CURRENT_VERSION, Hash.repeat(0x11), Hash.repeat(0x22),
                1_700_000_000L, 0x200f0f0fL, Hash.ZERO, null);
        return new Block(h, List.of(TxFixtures.coinbase(Script.coinbase(1, 1), 50)));
    }

    @Test
    void maximalTargetSucceedsOnFirstNonce() throws Exception {
        CountingSolver solver = new CountingSolver();
        Optional<Block> solved = new PowSearch(solver).solve(template(), ProofOfWork.MAX_TARGET, 5, REGTEST);

        assertTrue(solved.isPresent());
        assertEquals(1, solver.calls.get());
        byte[] nonce = solved.get().header().nonce().bytes();
        assertEquals(1, nonce[0]);
        assertEquals(REGTEST.solutionWidth(), solved.get().header().solution().length);
        assertEquals(template().header().merkleRoot(), solved.get().header().merkleRoot());
    }

    @Test
    void impossibleTargetRunsExactlyMaxTriesIterations() throws Exception {
        CountingSolver solver = new CountingSolver();
        Optional<Block> solved = new PowSearch(solver).solve(template(), NEVER, 37, REGTEST);

        assertTrue(solved.isEmpty());
        assertEquals(37, solver.calls.get());
    }

    @Test
    void innerLoopMaskBoundsTheSearch() throws Exception {
        CountingSolver solver = new CountingSolver();
        Optional<Block> solved = new PowSearch(solver, 0x0F).solve(template(), NEVER, 1_000, REGTEST);

        assertTrue(solved.isEmpty());
        // nonces 1..15; the loop stops once the low bits reach the mask
        assertEquals(15, solver.calls.get());
    }

    @Test
    void zeroBudgetDoesNothing() throws Exception {
        CountingSolver solver = new CountingSolver();
        assertTrue(new PowSearch(solver).solve(template(), ProofOfWork.MAX_TARGET, 0, REGTEST).isEmpty());
        assertEquals(0, solver.calls.get());
    }

    @Test
    void emptyCandidateStreamMovesToNextNonce() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        EquihashSolver sometimes = (params, state) ->
                calls.incrementAndGet() < 3 ? Stream.empty() : Stream.of(new byte[params.solutionWidth()]);
        Optional<Block> solved = new PowSearch(sometimes).solve(template(), ProofOfWork.MAX_TARGET, 10, REGTEST);

        assertTrue(solved.isPresent());
        assertEquals(3, solved.get().header().nonce().bytes()[0]);
    }

    @Test
    void interruptionStopsTheSearch() {
        Thread.currentThread().interrupt();
        try {
            assertThrows(InterruptedException.class,
                    () -> new PowSearch(new CountingSolver()).solve(template(), NEVER, 10, REGTEST));
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void rejectsNonPositiveMask() {
        assertThrows(IllegalArgumentException.class, () -> new PowSearch(new CountingSolver(), 0));
    }

    @Test
    void realSolverFindsBlockMeetingRegtestTarget() throws Exception {
        ConsensusParams regtest = ConsensusParams.regtest();
        BigInteger target = ProofOfWork.decodeCompact(regtest.powLimitBits());
        Optional<Block> solved = new PowSearch(new BasicEquihashSolver())
                .solve(template(), target, 2_000, REGTEST);

        assertTrue(solved.isPresent());
        BlockHeader h = solved.get().header();
        assertTrue(Equihash.isValidSolution(REGTEST, h));
        assertTrue(ProofOfWork.meetsTarget(h.hash(), target));
    }

    @Test
    void nullTemplateIsAProgrammingError() {
        assertThrows(NullPointerException.class,
                () -> new PowSearch(new CountingSolver()).solve(null, ProofOfWork.MAX_TARGET, 5, REGTEST));
    }

    @Test
    void productionSizedParamsFailBeforeSearching() {
        EquihashParams main = ConsensusParams.load("main").equihashFor(1);
        assertThrows(IllegalArgumentException.class,
                () -> new PowSearch(new BasicEquihashSolver()).solve(template(), ProofOfWork.MAX_TARGET, 5, main));
    }
}
