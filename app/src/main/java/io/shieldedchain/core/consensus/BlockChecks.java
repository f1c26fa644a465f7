package io.shieldedchain.core.consensus;

import io.shieldedchain.core.pow.Equihash;
import io.shieldedchain.core.protocol.Block;
import io.shieldedchain.core.protocol.BlockHeader;
import io.shieldedchain.core.protocol.Script;
import io.shieldedchain.core.protocol.Transaction;
import io.shieldedchain.core.storage.ChainTip;

import java.util.Arrays;
import java.util.List;

/**
 * Block validity rules applied before a block may extend the chain.
 * Failures throw {@link IllegalArgumentException} whose message starts with a reason code.
 */
public final class BlockChecks {
    private BlockChecks() {}

    public static void validateBlock(Block block, ChainTip tip, ConsensusParams params, long nowSeconds)
            throws IllegalArgumentException {
        BlockHeader hdr = block.header();
        long height = tip.height() + 1;

        // 1) Must build on the current tip
        if (!hdr.prevHash().equals(tip.hash())) {
            throw new IllegalArgumentException("bad-prevblk: expected " + tip.hash().hex() + ", got " + hdr.prevHash().hex());
        }

        // 2) Timestamp sanity
        if (hdr.time() <= tip.medianTimePast()) {
            throw new IllegalArgumentException("time-too-old: " + hdr.time() + " <= " + tip.medianTimePast());
        }
        if (hdr.time() > nowSeconds + params.maxFutureBlockTime()) {
            throw new IllegalArgumentException("time-too-new: " + hdr.time());
        }

        // 3) Difficulty carried forward from the tip
        if (hdr.bits() != tip.bits()) {
            throw new IllegalArgumentException("bad-diffbits: 0x" + Long.toHexString(hdr.bits()));
        }

        // 4) Equihash solution and proof-of-work
        EquihashParams eh = params.equihashFor(height);
        if (!Equihash.isValidSolution(eh, hdr)) {
            throw new IllegalArgumentException("invalid-solution: " + eh);
        }
        if (!ProofOfWork.checkProofOfWork(hdr.hash(), hdr.bits(), params.powLimit())) {
            throw new IllegalArgumentException("high-hash");
        }

        // 5) Transactions
        List<Transaction> txs = block.transactions();
        if (txs.isEmpty() || !txs.get(0).isCoinbase()) {
            throw new IllegalArgumentException("bad-cb-missing");
        }
        for (int i = 1; i < txs.size(); i++) {
            if (txs.get(i).isCoinbase()) {
                throw new IllegalArgumentException("bad-cb-multiple");
            }
        }
        for (Transaction tx : txs) {
            ValidationResult result = TransactionChecker.check(tx);
            if (!result.ok) {
                throw new IllegalArgumentException(result.reason.code() + ": " + tx.txid().hex() + " " + result.message);
            }
        }
        byte[] heightPrefix = Script.heightPush(height).bytes();
        byte[] scriptSig = block.coinbase().inputs().get(0).scriptSig().bytes();
        if (scriptSig.length < heightPrefix.length
                || !Arrays.equals(Arrays.copyOf(scriptSig, heightPrefix.length), heightPrefix)) {
            throw new IllegalArgumentException("bad-cb-height: expected height " + height);
        }

        // 6) Merkle root must match
        if (!hdr.merkleRoot().equals(block.computeMerkleRoot())) {
            throw new IllegalArgumentException("bad-txnmrklroot");
        }
    }
}
