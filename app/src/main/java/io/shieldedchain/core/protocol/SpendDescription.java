package io.shieldedchain.core.protocol;

import java.util.Objects;

/** Modern shielded spend. Only the nullifier matters to context-free checks. */
public final class SpendDescription {
    private final Hash cv;
    private final Hash anchor;
    private final Hash nullifier;
    private final Hash rk;
    private final byte[] zkproof;
    private final byte[] spendAuthSig;

    public SpendDescription(Hash cv, Hash anchor, Hash nullifier, Hash rk, byte[] zkproof, byte[] spendAuthSig) {
        this.cv = Objects.requireNonNull(cv, "cv");
        this.anchor = Objects.requireNonNull(anchor, "anchor");
        this.nullifier = Objects.requireNonNull(nullifier, "nullifier");
        this.rk = Objects.requireNonNull(rk, "rk");
        this.zkproof = fixed(zkproof, ProtocolLimits.GROTH_PROOF_SIZE, "zkproof");
        this.spendAuthSig = fixed(spendAuthSig, ProtocolLimits.SPEND_AUTH_SIG_SIZE, "spendAuthSig");
    }

    /** Spend with zeroed commitments, proof and signature; handy where only the nullifier is relevant. */
    public static SpendDescription ofNullifier(Hash nullifier) {
        return new SpendDescription(Hash.ZERO, Hash.ZERO, nullifier, Hash.ZERO, null, null);
    }

    public Hash cv() { return cv; }
    public Hash anchor() { return anchor; }
    public Hash nullifier() { return nullifier; }
    public Hash rk() { return rk; }
    public byte[] zkproof() { return zkproof.clone(); }
    public byte[] spendAuthSig() { return spendAuthSig.clone(); }

    static byte[] fixed(byte[] v, int len, String name) {
        if (v == null) return new byte[len];
        if (v.length != len) {
            throw new IllegalArgumentException(name + " must be " + len + " bytes");
        }
        return v.clone();
    }
}
