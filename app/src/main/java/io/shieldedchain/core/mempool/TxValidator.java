package io.shieldedchain.core.mempool;

import io.shieldedchain.core.consensus.Amounts;
import io.shieldedchain.core.consensus.TransactionChecker;
import io.shieldedchain.core.consensus.ValidationResult;
import io.shieldedchain.core.metrics.NodeMetrics;
import io.shieldedchain.core.protocol.Transaction;

import java.util.logging.Logger;

/** Admission rules for the mempool: consensus checks first, then relay policy. */
public class TxValidator {
    private static final Logger LOG = Logger.getLogger(TxValidator.class.getName());

    private final long minFee;

    public TxValidator(long minFee) {
        this.minFee = minFee;
    }

    public TxValidator() {
        this(0L);
    }

    public void validate(Transaction tx, long fee) {
        if (tx == null) {
            throw new IllegalArgumentException("Transaction required");
        }
        if (tx.isCoinbase()) {
            throw new IllegalArgumentException("coinbase: only valid inside a block");
        }
        ValidationResult result = TransactionChecker.check(tx);
        if (!result.ok) {
            NodeMetrics.recordRejection(result.reason.code());
            LOG.fine(() -> "Rejected " + tx.txid().hex() + " " + result);
            throw new IllegalArgumentException(result.reason.code() + ": " + result.message);
        }
        if (!Amounts.moneyRange(fee)) {
            throw new IllegalArgumentException("Fee out of range: " + fee);
        }
        if (fee < minFee) {
            throw new IllegalArgumentException("Fee below minimum");
        }
    }
}
