package io.shieldedchain.core.node;

import io.shieldedchain.core.protocol.Script;

/**
 * Regtest address form: the 20-byte key hash as 40 hex characters, paid to with a P2PKH script.
 */
public final class HexKeyHashDecoder implements DestinationDecoder {

    @Override
    public Script decode(String address) {
        if (address == null) {
            throw new IllegalArgumentException("Missing address");
        }
        String hex = address.trim();
        if (hex.length() != Script.KEY_HASH_LENGTH * 2) {
            throw new IllegalArgumentException("Address must be " + (Script.KEY_HASH_LENGTH * 2) + " hex chars: " + address);
        }
        byte[] keyHash = new byte[Script.KEY_HASH_LENGTH];
        for (int i = 0; i < keyHash.length; i++) {
            int hi = Character.digit(hex.charAt(2 * i), 16);
            int lo = Character.digit(hex.charAt(2 * i + 1), 16);
            if (hi < 0 || lo < 0) {
                throw new IllegalArgumentException("Address is not hex: " + address);
            }
            keyHash[i] = (byte) ((hi << 4) | lo);
        }
        return Script.payToKeyHash(keyHash);
    }
}
