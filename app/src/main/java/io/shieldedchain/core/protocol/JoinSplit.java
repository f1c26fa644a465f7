package io.shieldedchain.core.protocol;

import java.util.List;
import java.util.Objects;

/**
 * Legacy shielded join-split. {@code vpubOld} leaves the transparent pool, {@code vpubNew} enters it.
 * Amounts are kept raw so that out-of-range values can be rejected by the checker with a precise reason.
 */
public final class JoinSplit {
    private final long vpubOld;
    private final long vpubNew;
    private final Hash anchor;
    private final List<Hash> nullifiers;
    private final List<Hash> commitments;
    private final byte[] proof;

    public JoinSplit(long vpubOld, long vpubNew, Hash anchor,
                     List<Hash> nullifiers, List<Hash> commitments, byte[] proof) {
        this.vpubOld = vpubOld;
        this.vpubNew = vpubNew;
        this.anchor = Objects.requireNonNull(anchor, "anchor");
        this.nullifiers = List.copyOf(nullifiers);
        this.commitments = List.copyOf(commitments);
        this.proof = proof != null ? proof.clone() : new byte[ProtocolLimits.GROTH_PROOF_SIZE];
        if (this.nullifiers.size() != ProtocolLimits.JS_INPUTS) {
            throw new IllegalArgumentException("join-split needs " + ProtocolLimits.JS_INPUTS + " nullifiers");
        }
        if (this.commitments.size() != ProtocolLimits.JS_OUTPUTS) {
            throw new IllegalArgumentException("join-split needs " + ProtocolLimits.JS_OUTPUTS + " commitments");
        }
        if (this.proof.length != ProtocolLimits.GROTH_PROOF_SIZE) {
            throw new IllegalArgumentException("join-split proof must be " + ProtocolLimits.GROTH_PROOF_SIZE + " bytes");
        }
    }

    public long vpubOld() { return vpubOld; }
    public long vpubNew() { return vpubNew; }
    public Hash anchor() { return anchor; }
    public List<Hash> nullifiers() { return nullifiers; }
    public List<Hash> commitments() { return commitments; }
    public byte[] proof() { return proof.clone(); }
}
