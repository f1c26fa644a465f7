package io.shieldedchain.core;

import io.shieldedchain.core.metrics.NodeMetrics;
import io.shieldedchain.core.node.Node;
import io.shieldedchain.core.node.NodeConfig;
import io.shieldedchain.core.params.ParamsFetcher;
import io.shieldedchain.core.protocol.OutPoint;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Path;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    // Burn-style key hash used when no miner address is given.
    static final String DEFAULT_MINER_ADDRESS = "0000000000000000000000000000000000000000";

    public static void main(String[] args) throws Exception {
        configureLogging();
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        if (options.paramsUrl() != null) {
            ParamsFetcher fetcher = new ParamsFetcher();
            URI source = URI.create(options.paramsUrl());
            String name = Path.of(source.getPath()).getFileName().toString();
            Path target = options.paramsDir().resolve(name);
            boolean ok = fetcher.ensure(source, target, options.paramsSha256(),
                    (label, percent) -> LOG.info(label + " [" + percent + "%]"));
            if (!ok) {
                LOG.severe("Parameter file " + target + " failed verification");
                System.exit(2);
            }
        }

        NodeConfig config = NodeConfig.defaultRegtest()
                .withNetwork(options.network())
                .withMaxPowTries(options.maxTries())
                .withMiner(options.minerAddress());
        Node node = Node.inMemory(config);
        LOG.info("Mining " + options.blocks() + " block(s) on " + config.network + " to " + config.minerAddress);

        int mined = 0;
        while (mined < options.blocks()) {
            Optional<OutPoint> reward;
            try {
                reward = node.miner().generateToAddress(config.minerAddress);
            } catch (IllegalArgumentException e) {
                LOG.severe("Mining failed on " + config.network + ": " + e.getMessage());
                System.exit(2);
                return;
            }
            if (reward.isPresent()) {
                mined++;
                LOG.info("Block " + mined + " reward at " + reward.get().txid().hex() + ":" + reward.get().index());
            }
        }
        LOG.info("Chain height " + node.chain().tip().height());
        LOG.info("=== Metrics ===\n" + NodeMetrics.scrapeMetrics());
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Could not load logging.properties", e);
        }
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            String network,
            int blocks,
            String minerAddress,
            long maxTries,
            String paramsUrl,
            String paramsSha256,
            Path paramsDir
    ) {
        static CliOptions parse(String[] args) {
            String network = envOrDefault("SHIELDED_CHAIN_NETWORK", "regtest");
            String minerAddress = envOrDefault("SHIELDED_CHAIN_MINER_ADDRESS", DEFAULT_MINER_ADDRESS);
            Path paramsDir = Path.of(envOrDefault("SHIELDED_CHAIN_PARAMS_DIR", "./params"));
            int blocks = 1;
            long maxTries = NodeConfig.defaultRegtest().maxPowTries;
            String paramsUrl = null;
            String paramsSha256 = null;
            boolean showHelp = false;
            String error = null;

            String triesEnv = System.getenv("SHIELDED_CHAIN_MAX_TRIES");
            if (triesEnv != null && !triesEnv.isBlank()) {
                try {
                    maxTries = parsePositiveLong(triesEnv, "SHIELDED_CHAIN_MAX_TRIES");
                } catch (IllegalArgumentException ex) {
                    showHelp = true;
                    error = ex.getMessage();
                }
            }

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    if ("--help".equals(arg) || "-h".equals(arg)) {
                        showHelp = true;
                    } else if (arg.startsWith("--network=")) {
                        network = arg.substring("--network=".length()).trim();
                    } else if (arg.startsWith("--blocks=")) {
                        try {
                            String value = arg.substring("--blocks=".length());
                            long parsed = parsePositiveLong(value, "--blocks");
                            if (parsed > Integer.MAX_VALUE) {
                                throw new IllegalArgumentException("Invalid value for --blocks: " + value);
                            }
                            blocks = (int) parsed;
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--miner-address=")) {
                        minerAddress = arg.substring("--miner-address=".length()).trim();
                    } else if (arg.startsWith("--max-tries=")) {
                        try {
                            maxTries = parsePositiveLong(arg.substring("--max-tries=".length()), "--max-tries");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--params-url=")) {
                        paramsUrl = arg.substring("--params-url=".length()).trim();
                    } else if (arg.startsWith("--params-sha256=")) {
                        paramsSha256 = arg.substring("--params-sha256=".length()).trim();
                    } else if (arg.startsWith("--params-dir=")) {
                        paramsDir = Path.of(arg.substring("--params-dir=".length()));
                    } else if (error == null) {
                        showHelp = true;
                        error = "Unknown option: " + arg;
                    }
                }
            }

            if (paramsUrl != null && paramsUrl.isBlank()) {
                paramsUrl = null;
            }
            if (paramsUrl != null && (paramsSha256 == null || paramsSha256.isBlank()) && error == null) {
                showHelp = true;
                error = "--params-url requires --params-sha256";
            }
            if (minerAddress == null || minerAddress.isBlank()) {
                minerAddress = DEFAULT_MINER_ADDRESS;
            }

            return new CliOptions(
                    showHelp,
                    error,
                    network,
                    blocks,
                    minerAddress,
                    maxTries,
                    paramsUrl,
                    paramsSha256,
                    paramsDir
            );
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: shielded-chain [options]

Options:
  --help, -h                 Show this help message and exit
  --network=<name>           Consensus parameters to use: regtest (default), test or main
  --blocks=<n>               Number of blocks to mine (default 1)
  --miner-address=<hex>      40 hex chars of key hash receiving the coinbase
  --max-tries=<n>            Nonce budget per block template (default 1000000)
  --params-url=<url>         Download a parameter file before mining
  --params-sha256=<hex>      Expected SHA-256 of the parameter file
  --params-dir=<path>        Where parameter files are kept (default ./params)

Environment overrides:
  SHIELDED_CHAIN_NETWORK         Override --network
  SHIELDED_CHAIN_MINER_ADDRESS   Override --miner-address
  SHIELDED_CHAIN_MAX_TRIES       Override --max-tries
  SHIELDED_CHAIN_PARAMS_DIR      Override --params-dir
""");
        }

        private static String envOrDefault(String key, String fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : value;
        }

        private static long parsePositiveLong(String value, String flag) {
            try {
                long parsed = Long.parseLong(value.trim());
                if (parsed <= 0) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }
    }
}
