package io.shieldedchain.core.storage;

import io.shieldedchain.core.protocol.Block;
import io.shieldedchain.core.protocol.Hash;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Simple, fast in-memory chain store.
 * Good for tests and regtest nodes.
 */
public final class InMemoryChainStore implements ChainStore {

    /** Blocks in the median-time-past window. */
    public static final int MEDIAN_TIME_SPAN = 11;

    /** Map: blockHash -> height */
    private final Map<Hash, Long> heights = new HashMap<>();

    /** Best chain, index = height */
    private final List<Block> chain = new ArrayList<>();

    @Override
    public synchronized void putBlock(Block block) {
        if (block == null) throw new IllegalArgumentException("null block");
        Hash h = block.hash();
        if (heights.containsKey(h)) {
            throw new IllegalArgumentException("Block already stored: " + h.hex());
        }
        if (chain.isEmpty()) {
            if (!block.header().prevHash().isNull()) {
                throw new IllegalArgumentException("First block must be genesis (null parent)");
            }
        } else {
            Hash head = chain.get(chain.size() - 1).hash();
            if (!block.header().prevHash().equals(head)) {
                throw new IllegalArgumentException("Block does not extend head " + head.hex());
            }
        }
        heights.put(h, (long) chain.size());
        chain.add(block);
    }

    @Override
    public synchronized Optional<Block> getBlock(Hash blockHash) {
        Long height = blockHash == null ? null : heights.get(blockHash);
        return height == null ? Optional.empty() : Optional.of(chain.get(height.intValue()));
    }

    @Override
    public synchronized Optional<Hash> getHead() {
        if (chain.isEmpty()) return Optional.empty();
        return Optional.of(chain.get(chain.size() - 1).hash());
    }

    @Override
    public synchronized Optional<Long> getHeight(Hash blockHash) {
        if (blockHash == null) return Optional.empty();
        return Optional.ofNullable(heights.get(blockHash));
    }

    @Override
    public synchronized ChainTip tip() {
        if (chain.isEmpty()) {
            throw new IllegalStateException("Chain is empty (no genesis)");
        }
        Block head = chain.get(chain.size() - 1);
        return new ChainTip(head.hash(), chain.size() - 1L, medianTimePast(), head.header().bits());
    }

    @Override
    public synchronized long size() {
        return chain.size();
    }

    /** Median of the last {@value #MEDIAN_TIME_SPAN} block times ending at the head. */
    private long medianTimePast() {
        int from = Math.max(0, chain.size() - MEDIAN_TIME_SPAN);
        long[] times = new long[chain.size() - from];
        for (int i = from; i < chain.size(); i++) {
            times[i - from] = chain.get(i).header().time();
        }
        Arrays.sort(times);
        return times[times.length / 2];
    }
}
