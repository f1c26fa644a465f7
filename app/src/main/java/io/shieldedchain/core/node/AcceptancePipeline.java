package io.shieldedchain.core.node;

import io.shieldedchain.core.protocol.Block;

/** Validates a fully formed block and, when it is valid, extends the best chain with it. */
public interface AcceptancePipeline {
    boolean processNewBlock(Block block);
}
