package io.shieldedchain.core.consensus;

/** Closed set of context-free transaction rejection reasons with their stable reason codes. */
public enum RejectionReason {
    EMPTY_INPUTS("bad-txns-vin-empty"),
    EMPTY_OUTPUTS("bad-txns-vout-empty"),
    OVERSIZE("bad-txns-oversize"),
    NEGATIVE_OUTPUT("bad-txns-vout-negative"),
    OUTPUT_TOO_LARGE("bad-txns-vout-toolarge"),
    TOTAL_TOO_LARGE("bad-txns-txouttotal-toolarge"),
    UNEXPECTED_VALUE_BALANCE("bad-txns-valuebalance-nonzero"),
    VALUE_BALANCE_TOO_LARGE("bad-txns-valuebalance-toolarge"),
    VPUB_OLD_NEGATIVE("bad-txns-vpub_old-negative"),
    VPUB_NEW_NEGATIVE("bad-txns-vpub_new-negative"),
    VPUB_OLD_TOO_LARGE("bad-txns-vpub_old-toolarge"),
    VPUB_NEW_TOO_LARGE("bad-txns-vpub_new-toolarge"),
    BOTH_VPUBS_NONZERO("bad-txns-vpubs-both-nonzero"),
    INPUT_TOTAL_TOO_LARGE("bad-txns-txintotal-toolarge"),
    DUPLICATE_INPUTS("bad-txns-inputs-duplicate"),
    DUPLICATE_JOINSPLIT_NULLIFIERS("bad-joinsplits-nullifiers-duplicate"),
    DUPLICATE_SPEND_NULLIFIERS("bad-spend-description-nullifiers-duplicate"),
    COINBASE_SCRIPT_LENGTH_INVALID("bad-cb-length"),
    COINBASE_HAS_SPEND_DESCRIPTION("bad-cb-has-spend-description"),
    PREVOUT_NULL("bad-txns-prevout-null"),
    SPEND_NULLIFIER_NULL("bad-spend-description-nullifier-null");

    private final String code;

    RejectionReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
