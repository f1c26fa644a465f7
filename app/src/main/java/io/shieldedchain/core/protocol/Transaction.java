package io.shieldedchain.core.protocol;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable transaction carrying transparent inputs/outputs, legacy join-splits and
 * modern shielded spends/outputs tied to the transparent pool by {@code valueBalance}.
 *
 * Consensus validity is not enforced here (see TransactionChecker); the constructor only
 * rejects shapes that the wire format for the given version cannot carry.
 */
public final class Transaction {

    public static final int JOINSPLIT_MIN_VERSION = 2;
    public static final int SAPLING_MIN_VERSION = 4;

    private final int version;
    private final List<TxIn> inputs;
    private final List<TxOut> outputs;
    private final long lockTime;
    private final long valueBalance;
    private final List<SpendDescription> spends;
    private final List<OutputDescription> shieldedOutputs;
    private final List<JoinSplit> joinSplits;

    private final byte[] encoded;
    private final Hash txid;

    private Transaction(Builder b) {
        this.version = b.version;
        this.inputs = List.copyOf(b.inputs);
        this.outputs = List.copyOf(b.outputs);
        this.lockTime = b.lockTime;
        this.valueBalance = b.valueBalance;
        this.spends = List.copyOf(b.spends);
        this.shieldedOutputs = List.copyOf(b.shieldedOutputs);
        this.joinSplits = List.copyOf(b.joinSplits);
        basicValidate();
        this.encoded = TransactionCodec.toBytes(this);
        this.txid = Hashes.sha256d(encoded);
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private int version = SAPLING_MIN_VERSION;
        private final List<TxIn> inputs = new ArrayList<>();
        private final List<TxOut> outputs = new ArrayList<>();
        private long lockTime;
        private long valueBalance;
        private final List<SpendDescription> spends = new ArrayList<>();
        private final List<OutputDescription> shieldedOutputs = new ArrayList<>();
        private final List<JoinSplit> joinSplits = new ArrayList<>();

        public Builder version(int v) { this.version = v; return this; }
        public Builder input(TxIn in) { this.inputs.add(in); return this; }
        public Builder inputs(List<TxIn> in) { this.inputs.addAll(in); return this; }
        public Builder output(TxOut out) { this.outputs.add(out); return this; }
        public Builder outputs(List<TxOut> out) { this.outputs.addAll(out); return this; }
        public Builder lockTime(long t) { this.lockTime = t; return this; }
        public Builder valueBalance(long v) { this.valueBalance = v; return this; }
        public Builder spend(SpendDescription s) { this.spends.add(s); return this; }
        public Builder spends(List<SpendDescription> s) { this.spends.addAll(s); return this; }
        public Builder shieldedOutput(OutputDescription o) { this.shieldedOutputs.add(o); return this; }
        public Builder shieldedOutputs(List<OutputDescription> o) { this.shieldedOutputs.addAll(o); return this; }
        public Builder joinSplit(JoinSplit js) { this.joinSplits.add(js); return this; }
        public Builder joinSplits(List<JoinSplit> js) { this.joinSplits.addAll(js); return this; }

        public Transaction build() {
            return new Transaction(this);
        }
    }

    // -------------------- getters --------------------
    public int version() { return version; }
    public List<TxIn> inputs() { return inputs; }
    public List<TxOut> outputs() { return outputs; }
    public long lockTime() { return lockTime; }
    public long valueBalance() { return valueBalance; }
    public List<SpendDescription> spends() { return spends; }
    public List<OutputDescription> shieldedOutputs() { return shieldedOutputs; }
    public List<JoinSplit> joinSplits() { return joinSplits; }
    public Hash txid() { return txid; }

    public byte[] serialize() { return encoded.clone(); }
    public int serializedSize() { return encoded.length; }

    /** Exactly one input, and that input spends the null outpoint. */
    public boolean isCoinbase() {
        return inputs.size() == 1 && inputs.get(0).prevout().isNull();
    }

    private void basicValidate() {
        if (version < 1) throw new IllegalArgumentException("Unsupported version: " + version);
        if (lockTime < 0 || lockTime > 0xFFFF_FFFFL) throw new IllegalArgumentException("lockTime must be a uint32");
        if (version < JOINSPLIT_MIN_VERSION && !joinSplits.isEmpty()) {
            throw new IllegalArgumentException("join-splits need version >= " + JOINSPLIT_MIN_VERSION);
        }
        if (version < SAPLING_MIN_VERSION
                && (valueBalance != 0 || !spends.isEmpty() || !shieldedOutputs.isEmpty())) {
            throw new IllegalArgumentException("shielded fields need version >= " + SAPLING_MIN_VERSION);
        }
    }

    @Override public String toString() {
        return "Transaction{txid=" + txid.hex() + ", vin=" + inputs.size() + ", vout=" + outputs.size()
                + ", js=" + joinSplits.size() + ", spends=" + spends.size()
                + ", shieldedOutputs=" + shieldedOutputs.size() + "}";
    }
}
