package io.shieldedchain.core.node;

import io.shieldedchain.core.protocol.Script;

/** Maps a human-readable address to the script that locks coins to it. */
public interface DestinationDecoder {
    /** @throws IllegalArgumentException if the address cannot be decoded */
    Script decode(String address);
}
