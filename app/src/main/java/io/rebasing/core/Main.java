package io.rebasing.core;

import io.rebasing.core.config.LedgerConfig;
import io.rebasing.core.ledger.AuditReport;
import io.rebasing.core.ledger.Ledger;
import io.rebasing.core.ledger.LedgerAuditor;
import io.rebasing.core.ledger.RebasingLedger;
import io.rebasing.core.metrics.LedgerMetrics;
import io.rebasing.core.protocol.LedgerResult;
import io.rebasing.core.sim.LedgerSimulation;
import io.rebasing.core.storage.InMemoryLedgerStore;
import io.rebasing.core.storage.LedgerSnapshotJson;
import io.rebasing.core.storage.LedgerStore;
import io.rebasing.core.storage.RocksDBLedgerStore;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.logging.Logger;
import java.util.stream.Stream;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) {
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        Path dataPath = options.dataDir().toAbsolutePath().normalize();
        if (options.resetLedger()) {
            resetLedgerState(dataPath);
        }

        LedgerConfig config = resolveConfig(options, dataPath);
        LedgerStore store = null;
        try {
            if (options.inMemory()) {
                store = new InMemoryLedgerStore();
            } else {
                Files.createDirectories(dataPath);
                store = RocksDBLedgerStore.open(dataPath.resolve("db").toString());
            }
            RebasingLedger ledger = Ledger.assemble(store, config);

            if (options.demo()) {
                runDemoFlow(config);
            } else {
                LOG.info("Demo flow disabled (--no-demo)");
            }

            if (options.simulateSteps() > 0) {
                new LedgerSimulation(ledger, options.seed(), options.accounts()).run(options.simulateSteps());
            }

            AuditReport audit = LedgerAuditor.audit(ledger);
            LOG.info("Ledger audit: " + audit);

            if (options.exportPath() != null) {
                LedgerSnapshotJson.export(ledger.snapshot(), options.exportPath());
                LOG.info("Exported snapshot to " + options.exportPath());
            }
            LOG.info("=== Metrics ===\n" + LedgerMetrics.scrapeMetrics());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to prepare data directory " + dataPath, e);
        } finally {
            if (store instanceof AutoCloseable) {
                try {
                    ((AutoCloseable) store).close();
                } catch (Exception e) {
                    LOG.warning("Failed to close ledger store: " + e.getMessage());
                }
            }
        }
    }

    static LedgerConfig resolveConfig(CliOptions options, Path dataPath) {
        LedgerConfig config;
        if (options.configPath() != null) {
            config = LedgerConfig.load(options.configPath());
        } else {
            Path stored = dataPath.resolve("ledger-config.json");
            if (Files.exists(stored)) {
                config = LedgerConfig.load(stored);
            } else {
                config = LedgerConfig.defaultLocal();
                if (!options.inMemory()) {
                    config.save(stored);
                    LOG.info("Wrote default ledger config to " + stored + ". Edit it to change rounding modes.");
                }
            }
        }
        if (options.naive()) {
            LedgerConfig historical = LedgerConfig.historical();
            config = config.withModes(historical.supplyChangeMode, historical.transferRoundingMode, historical.burnMode);
        }
        if (options.trackRounding()) {
            config = config.withTracking(true);
        }
        return config;
    }

    /** Replays the two documented rounding defects on a scratch in-memory ledger. */
    private static void runDemoFlow(LedgerConfig config) {
        RebasingLedger ledger = Ledger.assemble(new InMemoryLedgerStore(), config);
        ledger.mint("alice", BigInteger.ONE);
        ledger.mint("bob", BigInteger.ONE);
        ledger.changeSupply(BigInteger.valueOf(3));
        LOG.info("Rebase 2 -> 3: alice=" + ledger.balanceOf("alice")
                + " bob=" + ledger.balanceOf("bob")
                + " totalSupply=" + ledger.totalSupply()
                + " audit=" + LedgerAuditor.audit(ledger));

        RebasingLedger dusty = Ledger.assemble(new InMemoryLedgerStore(), config);
        dusty.mint("carol", BigInteger.valueOf(50));
        dusty.changeSupply(BigInteger.valueOf(100));
        LedgerResult<BigInteger> burn = dusty.burn("carol", BigInteger.ONE);
        LOG.info("Burn 1 of 100 under " + config.burnMode + " burn: " + burn
                + " balance=" + dusty.balanceOf("carol")
                + " totalSupply=" + dusty.totalSupply());
    }

    private static void resetLedgerState(Path dataPath) {
        if (!Files.exists(dataPath)) {
            return;
        }
        Path configFile = dataPath.resolve("ledger-config.json").normalize();
        try (Stream<Path> stream = Files.walk(dataPath)) {
            stream.sorted(Comparator.reverseOrder())
                    .filter(path -> !path.equals(dataPath))
                    .filter(path -> !path.normalize().equals(configFile))
                    .forEach(path -> {
                        try {
                            Files.deleteIfExists(path);
                        } catch (IOException e) {
                            throw new IllegalStateException("Failed to delete " + path, e);
                        }
                    });
        } catch (IOException e) {
            throw new IllegalStateException("Failed to reset ledger data in " + dataPath, e);
        }
        LOG.info("Cleared ledger data under " + dataPath + " (config preserved).");
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path dataDir,
            boolean resetLedger,
            boolean inMemory,
            Path configPath,
            boolean demo,
            int simulateSteps,
            long seed,
            int accounts,
            boolean trackRounding,
            boolean naive,
            Path exportPath
    ) {
        static CliOptions parse(String[] args) {
            Path dataDir = envPath("REBASE_LEDGER_DATA_DIR", Path.of("./data/ledger"));
            boolean reset = false;
            boolean inMemory = "true".equalsIgnoreCase(System.getenv("REBASE_LEDGER_IN_MEMORY"));
            Path configPath = envPath("REBASE_LEDGER_CONFIG", null);
            boolean demo = true;
            int simulateSteps = 0;
            long seed = 42L;
            int accounts = 8;
            boolean trackRounding = "true".equalsIgnoreCase(System.getenv("REBASE_LEDGER_TRACK_ROUNDING"));
            boolean naive = false;
            Path exportPath = null;
            boolean showHelp = false;
            String error = null;

            String stepsEnv = System.getenv("REBASE_LEDGER_SIMULATE_STEPS");
            if (stepsEnv != null && !stepsEnv.isBlank()) {
                try {
                    simulateSteps = parseNonNegativeInt(stepsEnv, "REBASE_LEDGER_SIMULATE_STEPS");
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
                    try {
                        if ("--help".equals(arg) || "-h".equals(arg)) {
                            showHelp = true;
                        } else if (arg.startsWith("--data-dir=")) {
                            dataDir = Path.of(arg.substring("--data-dir=".length()));
                        } else if (arg.equals("--reset-ledger")) {
                            reset = true;
                        } else if (arg.equals("--in-memory")) {
                            inMemory = true;
                        } else if (arg.startsWith("--config=")) {
                            configPath = Path.of(arg.substring("--config=".length()));
                        } else if (arg.equals("--demo")) {
                            demo = true;
                        } else if (arg.equals("--no-demo")) {
                            demo = false;
                        } else if (arg.startsWith("--simulate-steps=")) {
                            simulateSteps = parseNonNegativeInt(arg.substring("--simulate-steps=".length()), "--simulate-steps");
                        } else if (arg.startsWith("--seed=")) {
                            seed = parseLong(arg.substring("--seed=".length()), "--seed");
                        } else if (arg.startsWith("--accounts=")) {
                            accounts = parseNonNegativeInt(arg.substring("--accounts=".length()), "--accounts");
                            if (accounts == 0) {
                                throw new IllegalArgumentException("Invalid value for --accounts: 0");
                            }
                        } else if (arg.equals("--track-rounding")) {
                            trackRounding = true;
                        } else if (arg.equals("--naive")) {
                            naive = true;
                        } else if (arg.startsWith("--export=")) {
                            exportPath = Path.of(arg.substring("--export=".length()));
                        } else if (!arg.startsWith("--")) {
                            dataDir = Path.of(arg);
                        } else if (error == null) {
                            showHelp = true;
                            error = "Unknown option: " + arg;
                        }
                    } catch (IllegalArgumentException ex) {
                        showHelp = true;
                        if (error == null) {
                            error = ex.getMessage();
                        }
                    }
                }
            }

            return new CliOptions(
                    showHelp,
                    error,
                    dataDir,
                    reset,
                    inMemory,
                    configPath,
                    demo,
                    simulateSteps,
                    seed,
                    accounts,
                    trackRounding,
                    naive,
                    exportPath
            );
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: rebasing-ledger [options]

Options:
  --help, -h                 Show this help message and exit
  --data-dir=<path>          Path for ledger data (default ./data/ledger)
  --reset-ledger             Delete ledger data (the config file is preserved)
  --in-memory                Keep the ledger in memory instead of RocksDB
  --config=<file>            JSON ledger config (default <data-dir>/ledger-config.json)
  --demo / --no-demo         Enable (default) or disable the rounding-defect demo
  --simulate-steps=<n>       Run n random operations and audit after each (default 0)
  --seed=<n>                 Seed for the simulation (default 42)
  --accounts=<n>             Number of simulated accounts (default 8)
  --track-rounding           Wrap the ledger in the rounding-error tracker
  --naive                    Use the historical rounding variants
  --export=<file>            Write a JSON snapshot of the ledger when done

Environment overrides:
  REBASE_LEDGER_DATA_DIR        Override --data-dir
  REBASE_LEDGER_CONFIG          Override --config
  REBASE_LEDGER_IN_MEMORY       Set to "true" to skip RocksDB
  REBASE_LEDGER_SIMULATE_STEPS  Default for --simulate-steps
  REBASE_LEDGER_TRACK_ROUNDING  Set to "true" to enable the tracker
""");
        }

        private static Path envPath(String key, Path fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }

        private static int parseNonNegativeInt(String value, String flag) {
            try {
                int parsed = Integer.parseInt(value.trim());
                if (parsed < 0) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }

        private static long parseLong(String value, String flag) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }
    }
}
