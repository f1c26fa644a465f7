package io.shieldedchain.core.consensus;

import java.nio.charset.StandardCharsets;

/**
 * Equihash (N, K) instance plus the BLAKE2b personalization prefix of the network.
 * Derived sizes follow the usual construction: each BLAKE2b output yields
 * {@code 512 / N} hashes of {@code N} bits, collisions are found on {@code N / (K + 1)} bits,
 * and a solution packs {@code 2^K} indices of {@code N / (K + 1) + 1} bits each.
 */
public final class EquihashParams {
    private final int n;
    private final int k;
    private final String personalization;

    public EquihashParams(int n, int k, String personalization) {
        if (k < 1 || k >= n) throw new IllegalArgumentException("Equihash K must be in [1, N)");
        if (n % 8 != 0) throw new IllegalArgumentException("Equihash N must be a multiple of 8");
        if (n % (k + 1) != 0) throw new IllegalArgumentException("Equihash N must be divisible by K + 1");
        if (n > 512) throw new IllegalArgumentException("Equihash N must fit one BLAKE2b output");
        if (n / (k + 1) + 1 > 31) throw new IllegalArgumentException("Equihash indices must fit an int");
        if (((1 << k) * (n / (k + 1) + 1)) % 8 != 0) throw new IllegalArgumentException("Equihash solution must be whole bytes");
        if (personalization == null || personalization.getBytes(StandardCharsets.US_ASCII).length > 8) {
            throw new IllegalArgumentException("personalization must be at most 8 ASCII bytes");
        }
        this.n = n;
        this.k = k;
        this.personalization = personalization;
    }

    public int n() { return n; }
    public int k() { return k; }
    public String personalization() { return personalization; }

    public int collisionBitLength() { return n / (k + 1); }
    public int indicesPerHashOutput() { return 512 / n; }
    public int hashOutputLength() { return indicesPerHashOutput() * n / 8; }
    public int hashLength() { return n / 8; }
    public int initialListSize() { return 1 << (collisionBitLength() + 1); }
    public int solutionIndices() { return 1 << k; }
    public int solutionWidth() { return solutionIndices() * (collisionBitLength() + 1) / 8; }

    @Override public String toString() {
        return "Equihash(" + n + "," + k + ")";
    }
}
