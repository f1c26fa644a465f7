package io.shieldedchain.core.pow;

import io.micrometer.core.instrument.Timer;
import io.shieldedchain.core.consensus.EquihashParams;
import io.shieldedchain.core.consensus.ProofOfWork;
import io.shieldedchain.core.metrics.NodeMetrics;
import io.shieldedchain.core.protocol.Block;
import io.shieldedchain.core.protocol.BlockHeader;
import io.shieldedchain.core.protocol.Hash;
import org.bouncycastle.crypto.digests.Blake2bDigest;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Proof-of-work search over a block template.
 *
 * The header prefix (everything before the nonce) is absorbed into a BLAKE2b state once.
 * Each outer iteration bumps the 256-bit nonce, extends a copy of that state with it, and asks
 * the solver for candidate solutions; the first candidate whose header hash meets the target wins.
 *
 * Bounds: at most {@code maxTries} outer iterations, and the loop also stops once the low bits of
 * the nonce selected by {@code innerLoopMask} reach the mask. Neither is a correctness limit.
 * The search is single-threaded, holds no locks, and checks for interruption once per nonce.
 */
public final class PowSearch {
    private static final Logger LOG = Logger.getLogger(PowSearch.class.getName());

    public static final int DEFAULT_INNER_LOOP_MASK = 0xFFFF;

    private final EquihashSolver solver;
    private final int innerLoopMask;

    public PowSearch(EquihashSolver solver, int innerLoopMask) {
        if (innerLoopMask <= 0) {
            throw new IllegalArgumentException("innerLoopMask must be positive");
        }
        this.solver = solver;
        this.innerLoopMask = innerLoopMask;
    }

    public PowSearch(EquihashSolver solver) {
        this(solver, DEFAULT_INNER_LOOP_MASK);
    }

    /**
     * Try to solve a block by incrementing the nonce up to maxTries times.
     * Returns Optional.of(solvedBlock) if found; Optional.empty() once the budget runs out.
     *
     * The returned Block is a NEW instance carrying the winning nonce and solution.
     *
     * @throws InterruptedException if the calling thread is interrupted between nonces
     */
    public Optional<Block> solve(Block template, BigInteger target, long maxTries, EquihashParams params)
            throws InterruptedException {
        Objects.requireNonNull(template, "template");

        BlockHeader h = template.header();

        // I = header minus nonce and solution, absorbed once: H(I||...
        Blake2bDigest prefixState = Equihash.initialiseState(params);
        byte[] prefix = h.powInputBytes();
        prefixState.update(prefix, 0, prefix.length);

        byte[] nonce = h.nonce().bytes();
        long tries = maxTries;
        Timer.Sample sample = NodeMetrics.startSearch();
        try {
            while (tries > 0 && (lowBits(nonce) & innerLoopMask) < innerLoopMask) {
                if (Thread.interrupted()) {
                    throw new InterruptedException("proof-of-work search interrupted");
                }
                increment(nonce);
                NodeMetrics.incrementNonces();

                // H(I||V||...
                Blake2bDigest nonceState = new Blake2bDigest(prefixState);
                nonceState.update(nonce, 0, nonce.length);

                BlockHeader withNonce = h.withNonce(new Hash(nonce));
                Optional<BlockHeader> found = solver.solutions(params, nonceState)
                        .map(withNonce::withSolution)
                        .peek(c -> NodeMetrics.incrementSolutions())
                        .filter(c -> ProofOfWork.meetsTarget(c.hash(), target))
                        .findFirst();
                tries--;
                if (found.isPresent()) {
                    long used = maxTries - tries;
                    LOG.fine(() -> "Solved " + params + " after " + used + " nonce(s)");
                    return Optional.of(template.withHeader(found.get()));
                }
            }
        } finally {
            NodeMetrics.stopSearch(sample);
        }
        NodeMetrics.incrementExhausted();
        return Optional.empty();
    }

    /** Low 32 bits of the little-endian nonce, enough for any int mask. */
    private static int lowBits(byte[] nonce) {
        return (nonce[0] & 0xff) | (nonce[1] & 0xff) << 8 | (nonce[2] & 0xff) << 16 | (nonce[3] & 0xff) << 24;
    }

    /** Adds one to a little-endian 256-bit counter, wrapping at 2^256. */
    private static void increment(byte[] nonce) {
        for (int i = 0; i < nonce.length; i++) {
            nonce[i]++;
            if (nonce[i] != 0) {
                return;
            }
        }
    }
}
