package io.shieldedchain.core.node;

import io.shieldedchain.core.protocol.Script;

/**
 * Supplies the transactions for a new block. Ordering and fee prioritisation are up to the source.
 */
public interface TransactionSource {
    TransactionSelection select(Script rewardDestination);
}
