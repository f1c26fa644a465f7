package io.shieldedchain.core.pow;

import io.shieldedchain.core.consensus.EquihashParams;
import org.bouncycastle.crypto.digests.Blake2bDigest;

import java.util.stream.Stream;

/**
 * Combinatorial puzzle solver. Given a BLAKE2b state that has already absorbed the header prefix
 * and nonce, yields candidate solutions in minimal (bit-packed) encoding.
 *
 * The consumer stops at the first candidate it accepts, so implementations may produce
 * candidates lazily. Implementations must not mutate {@code state}.
 */
public interface EquihashSolver {
    Stream<byte[]> solutions(EquihashParams params, Blake2bDigest state);
}
