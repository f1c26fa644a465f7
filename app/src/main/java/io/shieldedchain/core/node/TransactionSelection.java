package io.shieldedchain.core.node;

import io.shieldedchain.core.protocol.Transaction;

import java.util.List;

/** Ordered non-coinbase transactions chosen for a block, with the fees they pay in total. */
public record TransactionSelection(List<Transaction> transactions, long totalFees) {
    public TransactionSelection {
        transactions = List.copyOf(transactions);
        if (totalFees < 0) {
            throw new IllegalArgumentException("totalFees must be >= 0");
        }
    }

    public static TransactionSelection empty() {
        return new TransactionSelection(List.of(), 0L);
    }
}
