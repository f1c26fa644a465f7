package io.shieldedchain.core.protocol;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

import static io.shieldedchain.core.protocol.WireCodec.*;

/**
 * Transaction wire format:
 * version, vin, vout, lockTime,
 * [v4+] valueBalance, spends, shielded outputs,
 * [v2+] join-splits.
 */
public final class TransactionCodec {
    private TransactionCodec(){}

    public static byte[] toBytes(Transaction tx) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(256);
        writeInt32(out, tx.version());

        writeCompactSize(out, tx.inputs().size());
        for (TxIn in : tx.inputs()) {
            writeHash(out, in.prevout().txid());
            writeUint32(out, in.prevout().index());
            writeVarBytes(out, in.scriptSig().bytes());
            writeUint32(out, in.sequence());
        }

        writeCompactSize(out, tx.outputs().size());
        for (TxOut o : tx.outputs()) {
            writeInt64(out, o.value());
            writeVarBytes(out, o.scriptPubKey().bytes());
        }

        writeUint32(out, tx.lockTime());

        if (tx.version() >= Transaction.SAPLING_MIN_VERSION) {
            writeInt64(out, tx.valueBalance());
            writeCompactSize(out, tx.spends().size());
            for (SpendDescription s : tx.spends()) {
                writeHash(out, s.cv());
                writeHash(out, s.anchor());
                writeHash(out, s.nullifier());
                writeHash(out, s.rk());
                writeBytes(out, s.zkproof());
                writeBytes(out, s.spendAuthSig());
            }
            writeCompactSize(out, tx.shieldedOutputs().size());
            for (OutputDescription o : tx.shieldedOutputs()) {
                writeHash(out, o.cv());
                writeHash(out, o.cmu());
                writeHash(out, o.ephemeralKey());
                writeBytes(out, o.encCiphertext());
                writeBytes(out, o.outCiphertext());
                writeBytes(out, o.zkproof());
            }
        }

        if (tx.version() >= Transaction.JOINSPLIT_MIN_VERSION) {
            writeCompactSize(out, tx.joinSplits().size());
            for (JoinSplit js : tx.joinSplits()) {
                writeInt64(out, js.vpubOld());
                writeInt64(out, js.vpubNew());
                writeHash(out, js.anchor());
                for (Hash nf : js.nullifiers()) writeHash(out, nf);
                for (Hash cm : js.commitments()) writeHash(out, cm);
                writeBytes(out, js.proof());
            }
        }
        return out.toByteArray();
    }

    public static Transaction fromBytes(byte[] bytes) {
        try {
            ByteBuffer buf = reader(bytes);
            Transaction tx = read(buf);
            if (buf.hasRemaining()) {
                throw new IllegalArgumentException("Trailing bytes: " + buf.remaining());
            }
            return tx;
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Malformed Transaction bytes", ex);
        }
    }

    /** Reads one transaction from the buffer's current position (used by BlockCodec). */
    static Transaction read(ByteBuffer buf) {
        Transaction.Builder b = Transaction.builder();
        int version = buf.getInt();
        b.version(version);

        long vinCount = readCompactSize(buf);
        for (long i = 0; i < vinCount; i++) {
            Hash txid = readHash(buf);
            long index = readUint32(buf);
            byte[] script = readVarBytes(buf);
            long sequence = readUint32(buf);
            b.input(new TxIn(new OutPoint(txid, index), new Script(script), sequence));
        }

        long voutCount = readCompactSize(buf);
        for (long i = 0; i < voutCount; i++) {
            long value = buf.getLong();
            b.output(new TxOut(value, new Script(readVarBytes(buf))));
        }

        b.lockTime(readUint32(buf));

        if (version >= Transaction.SAPLING_MIN_VERSION) {
            b.valueBalance(buf.getLong());
            long spendCount = readCompactSize(buf);
            for (long i = 0; i < spendCount; i++) {
                b.spend(new SpendDescription(readHash(buf), readHash(buf), readHash(buf), readHash(buf),
                        readFixed(buf, ProtocolLimits.GROTH_PROOF_SIZE),
                        readFixed(buf, ProtocolLimits.SPEND_AUTH_SIG_SIZE)));
            }
            long outputCount = readCompactSize(buf);
            for (long i = 0; i < outputCount; i++) {
                b.shieldedOutput(new OutputDescription(readHash(buf), readHash(buf), readHash(buf),
                        readFixed(buf, ProtocolLimits.ENC_CIPHERTEXT_SIZE),
                        readFixed(buf, ProtocolLimits.OUT_CIPHERTEXT_SIZE),
                        readFixed(buf, ProtocolLimits.GROTH_PROOF_SIZE)));
            }
        }

        if (version >= Transaction.JOINSPLIT_MIN_VERSION) {
            long jsCount = readCompactSize(buf);
            for (long i = 0; i < jsCount; i++) {
                long vpubOld = buf.getLong();
                long vpubNew = buf.getLong();
                Hash anchor = readHash(buf);
                List<Hash> nullifiers = new ArrayList<>(ProtocolLimits.JS_INPUTS);
                for (int n = 0; n < ProtocolLimits.JS_INPUTS; n++) nullifiers.add(readHash(buf));
                List<Hash> commitments = new ArrayList<>(ProtocolLimits.JS_OUTPUTS);
                for (int n = 0; n < ProtocolLimits.JS_OUTPUTS; n++) commitments.add(readHash(buf));
                byte[] proof = readFixed(buf, ProtocolLimits.GROTH_PROOF_SIZE);
                b.joinSplit(new JoinSplit(vpubOld, vpubNew, anchor, nullifiers, commitments, proof));
            }
        }
        return b.build();
    }
}
