package io.shieldedchain.core.storage;

import io.shieldedchain.core.protocol.Hash;

/**
 * Snapshot of the best chain's tip, taken under the chain lock and handed to the template builder
 * and block checks by value.
 *
 * @param hash           tip block hash
 * @param height         tip height (genesis = 0)
 * @param medianTimePast median time of the last 11 blocks ending at the tip
 * @param bits           compact target the next block must carry
 */
public record ChainTip(Hash hash, long height, long medianTimePast, long bits) {
}
