package io.shieldedchain.core.node;

import io.shieldedchain.core.metrics.NodeMetrics;
import io.shieldedchain.core.protocol.Block;
import io.shieldedchain.core.protocol.OutPoint;

/**
 * Hands solved blocks to the acceptance pipeline. The search only produces blocks that should be
 * accepted, so a rejection here is a bug and fails hard instead of being retried.
 */
public final class SubmissionGate {
    private final AcceptancePipeline pipeline;

    public SubmissionGate(AcceptancePipeline pipeline) {
        this.pipeline = pipeline;
    }

    /** Returns the coinbase's first output, for callers that want to spend the fresh reward. */
    public OutPoint submit(Block block) {
        boolean processed = pipeline.processNewBlock(block);
        if (!processed) {
            throw new IllegalStateException("Acceptance pipeline rejected solved block " + block.hash().hex());
        }
        NodeMetrics.incrementBlocks();
        return new OutPoint(block.coinbase().txid(), 0);
    }
}
