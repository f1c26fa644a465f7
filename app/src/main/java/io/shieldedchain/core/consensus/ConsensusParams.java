package io.shieldedchain.core.consensus;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Per-network consensus constants, read from {@code consensus-params.json} on the classpath.
 */
public final class ConsensusParams {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final String RESOURCE = "/consensus-params.json";

    /** Equihash instance that applies from {@code activationHeight} onwards. */
    public record EquihashUpgrade(long activationHeight, EquihashParams params) {}

    private final String network;
    private final BigInteger powLimit;
    private final long genesisTime;
    private final long initialSubsidy;
    private final long halvingInterval;
    private final long maxFutureBlockTime;
    private final List<EquihashUpgrade> equihash;

    public ConsensusParams(String network, BigInteger powLimit, long genesisTime, long initialSubsidy,
                           long halvingInterval, long maxFutureBlockTime, List<EquihashUpgrade> equihash) {
        this.network = network;
        this.powLimit = powLimit;
        this.genesisTime = genesisTime;
        this.initialSubsidy = initialSubsidy;
        this.halvingInterval = halvingInterval;
        this.maxFutureBlockTime = maxFutureBlockTime;
        List<EquihashUpgrade> sorted = new ArrayList<>(equihash);
        sorted.sort(Comparator.comparingLong(EquihashUpgrade::activationHeight));
        this.equihash = List.copyOf(sorted);
        if (this.equihash.isEmpty() || this.equihash.get(0).activationHeight() != 0) {
            throw new IllegalArgumentException(network + ": Equihash schedule must start at height 0");
        }
        if (!Amounts.moneyRange(initialSubsidy)) {
            throw new IllegalArgumentException(network + ": initial subsidy out of range");
        }
        if (halvingInterval <= 0) {
            throw new IllegalArgumentException(network + ": halving interval must be positive");
        }
    }

    public static ConsensusParams regtest() {
        return load("regtest");
    }

    public static ConsensusParams load(String network) {
        try (InputStream in = ConsensusParams.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + RESOURCE);
            }
            JsonNode root = JSON.readTree(in);
            JsonNode node = root.get(network);
            if (node == null) {
                throw new IllegalArgumentException("Unknown network: " + network);
            }
            return fromJson(network, node);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + RESOURCE, e);
        }
    }

    static ConsensusParams fromJson(String network, JsonNode node) {
        List<EquihashUpgrade> schedule = new ArrayList<>();
        for (JsonNode eh : required(node, "equihash")) {
            EquihashParams p = new EquihashParams(
                    required(eh, "n").asInt(),
                    required(eh, "k").asInt(),
                    required(eh, "personalization").asText());
            schedule.add(new EquihashUpgrade(required(eh, "activationHeight").asLong(), p));
        }
        return new ConsensusParams(
                network,
                new BigInteger(required(node, "powLimit").asText(), 16),
                required(node, "genesisTime").asLong(),
                required(node, "initialSubsidy").asLong(),
                required(node, "halvingInterval").asLong(),
                node.path("maxFutureBlockTime").asLong(2 * 60 * 60),
                schedule);
    }

    private static JsonNode required(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            throw new IllegalArgumentException("consensus params missing field '" + field + "'");
        }
        return v;
    }

    public String network() { return network; }
    public BigInteger powLimit() { return powLimit; }
    public long powLimitBits() { return ProofOfWork.encodeCompact(powLimit); }
    public long genesisTime() { return genesisTime; }
    public long maxFutureBlockTime() { return maxFutureBlockTime; }

    public EquihashParams equihashFor(long height) {
        EquihashParams active = equihash.get(0).params();
        for (EquihashUpgrade u : equihash) {
            if (u.activationHeight() <= height) {
                active = u.params();
            }
        }
        return active;
    }

    /** Block subsidy, halving every {@code halvingInterval} blocks. */
    public long subsidy(long height) {
        long halvings = height / halvingInterval;
        if (halvings >= 63) {
            return 0L;
        }
        return initialSubsidy >> halvings;
    }
}
