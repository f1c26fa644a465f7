package io.shieldedchain.core.protocol;

import java.util.Objects;

/**
 * Reference to a transparent output: (txid, output index).
 * The null outpoint (zero txid, index 0xFFFFFFFF) marks a coinbase input.
 */
public record OutPoint(Hash txid, long index) {
    public static final long NULL_INDEX = 0xFFFF_FFFFL;
    public static final OutPoint NULL = new OutPoint(Hash.ZERO, NULL_INDEX);

    public OutPoint {
        Objects.requireNonNull(txid, "txid");
        if (index < 0 || index > NULL_INDEX) {
            throw new IllegalArgumentException("index must be a uint32: " + index);
        }
    }

    public boolean isNull() {
        return txid.isNull() && index == NULL_INDEX;
    }
}
