package io.shieldedchain.core.protocol;

public final class ProtocolLimits {
    private ProtocolLimits(){}

    public static final int MAX_BLOCK_WEIGHT = 4_000_000;
    public static final int WITNESS_SCALE_FACTOR = 4;
    public static final int MAX_BLOCK_SERIALIZED_SIZE = MAX_BLOCK_WEIGHT;
    public static final int MAX_TXS_PER_BLOCK = 1_000_000;

    public static final int MIN_COINBASE_SCRIPT_LEN = 2;
    public static final int MAX_COINBASE_SCRIPT_LEN = 100;

    // Legacy join-splits always spend two notes and create two.
    public static final int JS_INPUTS = 2;
    public static final int JS_OUTPUTS = 2;

    public static final int GROTH_PROOF_SIZE = 192;
    public static final int SPEND_AUTH_SIG_SIZE = 64;
    public static final int ENC_CIPHERTEXT_SIZE = 580;
    public static final int OUT_CIPHERTEXT_SIZE = 80;

    public static final long SEQUENCE_FINAL = 0xFFFF_FFFFL;
}
