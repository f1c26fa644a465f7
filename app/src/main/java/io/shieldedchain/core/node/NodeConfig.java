package io.shieldedchain.core.node;

import io.shieldedchain.core.pow.PowSearch;

/** Simple config holder for a local mining node. */
public final class NodeConfig {
    public final String network;
    public final int maxTxPerBlock;
    public final long maxPowTries;
    public final int innerLoopMask;
    public final long minRelayFee;
    public final String minerAddress;

    public NodeConfig(String network, int maxTxPerBlock, long maxPowTries, int innerLoopMask,
                      long minRelayFee, String minerAddress) {
        this.network = network;
        this.maxTxPerBlock = maxTxPerBlock;
        this.maxPowTries = maxPowTries;
        this.innerLoopMask = innerLoopMask;
        this.minRelayFee = minRelayFee;
        this.minerAddress = minerAddress;
    }

    public static NodeConfig defaultRegtest() {
        return new NodeConfig(
                "regtest",
                1000,                               // tx per block cap
                1_000_000L,                         // nonce budget per template
                PowSearch.DEFAULT_INNER_LOOP_MASK,  // low nonce bits per search
                0L,                                 // no relay fee floor on regtest
                null                                // miner address resolved later
        );
    }

    public NodeConfig withMiner(String minerAddress) {
        return new NodeConfig(network, maxTxPerBlock, maxPowTries, innerLoopMask, minRelayFee, minerAddress);
    }

    public NodeConfig withNetwork(String network) {
        return new NodeConfig(network, maxTxPerBlock, maxPowTries, innerLoopMask, minRelayFee, minerAddress);
    }

    public NodeConfig withMaxPowTries(long maxPowTries) {
        return new NodeConfig(network, maxTxPerBlock, maxPowTries, innerLoopMask, minRelayFee, minerAddress);
    }
}
