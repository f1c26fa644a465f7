package io.shieldedchain.core.consensus;

import io.shieldedchain.core.protocol.Hash;
import io.shieldedchain.core.protocol.JoinSplit;
import io.shieldedchain.core.protocol.OutPoint;
import io.shieldedchain.core.protocol.ProtocolLimits;
import io.shieldedchain.core.protocol.SpendDescription;
import io.shieldedchain.core.protocol.Transaction;
import io.shieldedchain.core.protocol.TxIn;
import io.shieldedchain.core.protocol.TxOut;

import java.util.HashSet;
import java.util.Set;

import static io.shieldedchain.core.consensus.Amounts.MAX_MONEY;
import static io.shieldedchain.core.consensus.RejectionReason.*;

/**
 * Context-free consensus checks on a single transaction.
 *
 * Rules run in a fixed order and the first violation is reported, so diagnostics are
 * deterministic. Two running totals are kept: value leaving the transparent pool
 * (outputs, negative value balance, join-split vpub_old) and value entering it
 * (join-split vpub_new, positive value balance). Each addition is range-checked as it happens.
 *
 * Stateless; safe to call from any thread.
 */
public final class TransactionChecker {
    private TransactionChecker() {}

    public static ValidationResult check(Transaction tx) {
        // 1) Non-emptiness
        if (tx.inputs().isEmpty() && tx.joinSplits().isEmpty()) {
            return ValidationResult.invalid(EMPTY_INPUTS, "no transparent inputs or join-splits");
        }
        if (tx.outputs().isEmpty() && tx.joinSplits().isEmpty() && tx.shieldedOutputs().isEmpty()) {
            return ValidationResult.invalid(EMPTY_OUTPUTS, "no transparent or shielded outputs");
        }

        // 2) Size ceiling
        long weight = (long) tx.serializedSize() * ProtocolLimits.WITNESS_SCALE_FACTOR;
        if (weight > ProtocolLimits.MAX_BLOCK_WEIGHT) {
            return ValidationResult.invalid(OVERSIZE, "weight " + weight + " > " + ProtocolLimits.MAX_BLOCK_WEIGHT);
        }

        // 3) Transparent outputs
        long valueOut = 0;
        for (TxOut out : tx.outputs()) {
            if (out.value() < 0) {
                return ValidationResult.invalid(NEGATIVE_OUTPUT, "output value " + out.value());
            }
            try {
                valueOut = Amounts.add(valueOut, out.value());
            } catch (AmountRangeException e) {
                RejectionReason r = e.kind() == AmountRangeException.Kind.AMOUNT ? OUTPUT_TOO_LARGE : TOTAL_TOO_LARGE;
                return ValidationResult.invalid(r, e.getMessage());
            }
        }

        // 4) Value balance sanity
        long valueBalance = tx.valueBalance();
        if (tx.spends().isEmpty() && tx.shieldedOutputs().isEmpty() && valueBalance != 0) {
            return ValidationResult.invalid(UNEXPECTED_VALUE_BALANCE, "value balance " + valueBalance + " without shielded spends or outputs");
        }
        if (!Amounts.signedMoneyRange(valueBalance)) {
            return ValidationResult.invalid(VALUE_BALANCE_TOO_LARGE, "value balance " + valueBalance);
        }

        // 5) A negative value balance takes value from the transparent pool, just as outputs do
        if (valueBalance <= 0) {
            try {
                valueOut = Amounts.add(valueOut, -valueBalance);
            } catch (AmountRangeException e) {
                return ValidationResult.invalid(TOTAL_TOO_LARGE, e.getMessage());
            }
        }

        // 6) Join-split amounts
        for (JoinSplit js : tx.joinSplits()) {
            if (js.vpubOld() < 0) {
                return ValidationResult.invalid(VPUB_OLD_NEGATIVE, "vpub_old " + js.vpubOld());
            }
            if (js.vpubNew() < 0) {
                return ValidationResult.invalid(VPUB_NEW_NEGATIVE, "vpub_new " + js.vpubNew());
            }
            if (js.vpubOld() > MAX_MONEY) {
                return ValidationResult.invalid(VPUB_OLD_TOO_LARGE, "vpub_old " + js.vpubOld());
            }
            if (js.vpubNew() > MAX_MONEY) {
                return ValidationResult.invalid(VPUB_NEW_TOO_LARGE, "vpub_new " + js.vpubNew());
            }
            if (js.vpubOld() != 0 && js.vpubNew() != 0) {
                return ValidationResult.invalid(BOTH_VPUBS_NONZERO, "join-split moves value in both directions");
            }
            try {
                valueOut = Amounts.add(valueOut, js.vpubOld());
            } catch (AmountRangeException e) {
                return ValidationResult.invalid(TOTAL_TOO_LARGE, e.getMessage());
            }
        }

        // 7) + 8) Value claimed to enter the transparent pool
        long valueIn = 0;
        for (JoinSplit js : tx.joinSplits()) {
            try {
                valueIn = Amounts.add(valueIn, js.vpubNew());
            } catch (AmountRangeException e) {
                return ValidationResult.invalid(INPUT_TOTAL_TOO_LARGE, e.getMessage());
            }
        }
        if (valueBalance >= 0) {
            try {
                valueIn = Amounts.add(valueIn, valueBalance);
            } catch (AmountRangeException e) {
                return ValidationResult.invalid(INPUT_TOTAL_TOO_LARGE, e.getMessage());
            }
        }

        // 9) Duplicate prevouts
        Set<OutPoint> prevouts = new HashSet<>();
        for (TxIn in : tx.inputs()) {
            if (!prevouts.add(in.prevout())) {
                return ValidationResult.invalid(DUPLICATE_INPUTS, "prevout " + in.prevout().txid().hex() + ":" + in.prevout().index());
            }
        }

        // 10) Duplicate nullifiers, one namespace per pool
        Set<Hash> joinSplitNullifiers = new HashSet<>();
        for (JoinSplit js : tx.joinSplits()) {
            for (Hash nf : js.nullifiers()) {
                if (!joinSplitNullifiers.add(nf)) {
                    return ValidationResult.invalid(DUPLICATE_JOINSPLIT_NULLIFIERS, "nullifier " + nf.hex());
                }
            }
        }
        Set<Hash> spendNullifiers = new HashSet<>();
        for (SpendDescription spend : tx.spends()) {
            if (!spendNullifiers.add(spend.nullifier())) {
                return ValidationResult.invalid(DUPLICATE_SPEND_NULLIFIERS, "nullifier " + spend.nullifier().hex());
            }
        }

        // 11) / 12) Coinbase shape, or non-null references everywhere else
        if (tx.isCoinbase()) {
            int scriptLen = tx.inputs().get(0).scriptSig().size();
            if (scriptLen < ProtocolLimits.MIN_COINBASE_SCRIPT_LEN || scriptLen > ProtocolLimits.MAX_COINBASE_SCRIPT_LEN) {
                return ValidationResult.invalid(COINBASE_SCRIPT_LENGTH_INVALID, "coinbase script length " + scriptLen);
            }
            if (!tx.spends().isEmpty()) {
                return ValidationResult.invalid(COINBASE_HAS_SPEND_DESCRIPTION, "coinbase with " + tx.spends().size() + " spends");
            }
        } else {
            for (TxIn in : tx.inputs()) {
                if (in.prevout().isNull()) {
                    return ValidationResult.invalid(PREVOUT_NULL, "null prevout in non-coinbase");
                }
            }
            for (SpendDescription spend : tx.spends()) {
                if (spend.nullifier().isNull()) {
                    return ValidationResult.invalid(SPEND_NULLIFIER_NULL, "null spend nullifier");
                }
            }
        }

        return ValidationResult.ok();
    }
}
