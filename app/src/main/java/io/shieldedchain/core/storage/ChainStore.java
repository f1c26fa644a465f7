package io.shieldedchain.core.storage;

import io.shieldedchain.core.protocol.Block;
import io.shieldedchain.core.protocol.Hash;

import java.util.Optional;

/**
 * Minimal best-chain storage.
 * Stores blocks by their header hash, tracks heights and the current head.
 *
 * Notes:
 * - Block "hash" = SHA-256d of the header serialization (see BlockHeader#hash()).
 * - The chain only grows at the head; fork choice and reorganisation live elsewhere.
 * - Callers serialise writers against readers with the node's chain lock.
 */
public interface ChainStore {

    /** Append a block on top of the current head (or as genesis when empty). */
    void putBlock(Block block);

    /** Fetch a block by its hash. */
    Optional<Block> getBlock(Hash blockHash);

    /** Return the current head hash if set. */
    Optional<Hash> getHead();

    /** Height for a given block hash if known. */
    Optional<Long> getHeight(Hash blockHash);

    /** Snapshot of the head for template building and block checks. */
    ChainTip tip();

    /** Number of blocks stored (debug/metrics). */
    long size();
}
