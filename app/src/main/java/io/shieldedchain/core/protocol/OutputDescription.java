package io.shieldedchain.core.protocol;

import java.util.Objects;

public final class OutputDescription {
    private final Hash cv;
    private final Hash cmu;
    private final Hash ephemeralKey;
    private final byte[] encCiphertext;
    private final byte[] outCiphertext;
    private final byte[] zkproof;

    public OutputDescription(Hash cv, Hash cmu, Hash ephemeralKey,
                             byte[] encCiphertext, byte[] outCiphertext, byte[] zkproof) {
        this.cv = Objects.requireNonNull(cv, "cv");
        this.cmu = Objects.requireNonNull(cmu, "cmu");
        this.ephemeralKey = Objects.requireNonNull(ephemeralKey, "ephemeralKey");
        this.encCiphertext = SpendDescription.fixed(encCiphertext, ProtocolLimits.ENC_CIPHERTEXT_SIZE, "encCiphertext");
        this.outCiphertext = SpendDescription.fixed(outCiphertext, ProtocolLimits.OUT_CIPHERTEXT_SIZE, "outCiphertext");
        this.zkproof = SpendDescription.fixed(zkproof, ProtocolLimits.GROTH_PROOF_SIZE, "zkproof");
    }

    public static OutputDescription ofCommitment(Hash cmu) {
        return new OutputDescription(Hash.ZERO, cmu, Hash.ZERO, null, null, null);
    }

    public Hash cv() { return cv; }
    public Hash cmu() { return cmu; }
    public Hash ephemeralKey() { return ephemeralKey; }
    public byte[] encCiphertext() { return encCiphertext.clone(); }
    public byte[] outCiphertext() { return outCiphertext.clone(); }
    public byte[] zkproof() { return zkproof.clone(); }
}
