package io.shieldedchain.core.protocol;

import java.util.Objects;

/** Transparent output. The value is not range-checked here; that is a consensus rule. */
public final class TxOut {
    private final long value;
    private final Script scriptPubKey;

    public TxOut(long value, Script scriptPubKey) {
        this.value = value;
        this.scriptPubKey = Objects.requireNonNull(scriptPubKey, "scriptPubKey");
    }

    public long value() { return value; }
    public Script scriptPubKey() { return scriptPubKey; }
}
