package io.shieldedchain.core.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class NodeMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter noncesTried = registry.counter("pow.nonces.tried");
    private static final Counter solutionsTested = registry.counter("pow.solutions.tested");
    private static final Counter blocksMined = registry.counter("blocks.mined");
    private static final Counter searchesExhausted = registry.counter("pow.search.exhausted");
    private static final Timer searchTime = registry.timer("pow.search.time");

    public static Timer.Sample startSearch() {
        return Timer.start(registry);
    }

    public static void stopSearch(Timer.Sample sample) {
        sample.stop(searchTime);
    }

    public static void incrementNonces() {
        noncesTried.increment();
    }

    public static void incrementSolutions() {
        solutionsTested.increment();
    }

    public static void incrementBlocks() {
        blocksMined.increment();
    }

    public static void incrementExhausted() {
        searchesExhausted.increment();
    }

    /** Counts a context-free transaction rejection, tagged with its reason code. */
    public static void recordRejection(String reasonCode) {
        registry.counter("tx.rejected", "reason", reasonCode).increment();
    }

    public static double count(String name) {
        Counter c = registry.find(name).counter();
        return c == null ? 0.0 : c.count();
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName());
                for (Tag tag : m.getId().getTags()) {
                    sb.append('{').append(tag.getKey()).append('=').append(tag.getValue()).append('}');
                }
                sb.append("{stat=")
                  .append(meas.getStatistic())
                  .append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
