package io.shieldedchain.core.protocol;

import java.util.Objects;

public final class TxIn {
    private final OutPoint prevout;
    private final Script scriptSig;
    private final long sequence;

    public TxIn(OutPoint prevout, Script scriptSig, long sequence) {
        this.prevout = Objects.requireNonNull(prevout, "prevout");
        this.scriptSig = scriptSig != null ? scriptSig : Script.EMPTY;
        this.sequence = sequence;
    }

    public TxIn(OutPoint prevout, Script scriptSig) {
        this(prevout, scriptSig, ProtocolLimits.SEQUENCE_FINAL);
    }

    public OutPoint prevout() { return prevout; }
    public Script scriptSig() { return scriptSig; }
    public long sequence() { return sequence; }
}
