package io.shieldedchain.core.node;

import io.shieldedchain.core.consensus.ConsensusParams;
import io.shieldedchain.core.mempool.Mempool;
import io.shieldedchain.core.mempool.TxValidator;
import io.shieldedchain.core.pow.BasicEquihashSolver;
import io.shieldedchain.core.pow.PowSearch;
import io.shieldedchain.core.storage.ChainStore;
import io.shieldedchain.core.storage.InMemoryChainStore;

import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Wires storage, mempool, consensus, and the miner around one chain lock.
 */
public final class Node {

    private final ChainStore chain;
    private final ReadWriteLock chainLock;
    private final Mempool mempool;
    private final ConsensusParams params;
    private final Miner miner;

    public Node(ChainStore chain, Mempool mempool, ConsensusParams params, NodeConfig config, DestinationDecoder decoder) {
        this.chain = chain;
        this.chainLock = new ReentrantReadWriteLock();
        this.mempool = mempool;
        this.params = params;
        SubmissionGate gate = new SubmissionGate(new BlockAcceptor(chain, params, chainLock));
        this.miner = new Miner(
                chain, chainLock, mempool,
                new BlockTemplateBuilder(params),
                new PowSearch(new BasicEquihashSolver(), config.innerLoopMask),
                gate, params, config, decoder
        );
    }

    /** Convenience factory for an in-memory node seeded with its network's genesis block. */
    public static Node inMemory(NodeConfig config) {
        ConsensusParams params = ConsensusParams.load(config.network);
        ChainStore chain = new InMemoryChainStore();
        chain.putBlock(GenesisBuilder.build(params));
        Mempool mempool = new Mempool(new TxValidator(config.minRelayFee), config.maxTxPerBlock);
        return new Node(chain, mempool, params, config, new HexKeyHashDecoder());
    }

    public ChainStore chain() { return chain; }
    public ReadWriteLock chainLock() { return chainLock; }
    public Mempool mempool() { return mempool; }
    public ConsensusParams params() { return params; }
    public Miner miner() { return miner; }
}
