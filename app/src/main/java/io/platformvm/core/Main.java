package io.platformvm.core;

import io.platformvm.core.metrics.MetricsScraper;
import io.platformvm.core.metrics.RegistrationException;
import io.platformvm.core.node.AcceptanceReplayer;
import io.platformvm.core.node.NodeConfig;
import io.platformvm.core.node.PlatformNode;
import io.platformvm.core.node.ReplaySummary;
import io.platformvm.core.protocol.AbortBlock;
import io.platformvm.core.protocol.AddDelegatorTx;
import io.platformvm.core.protocol.AddValidatorTx;
import io.platformvm.core.protocol.AdvanceTimeTx;
import io.platformvm.core.protocol.AtomicBlock;
import io.platformvm.core.protocol.Block;
import io.platformvm.core.protocol.CommitBlock;
import io.platformvm.core.protocol.ExportTx;
import io.platformvm.core.protocol.Hash;
import io.platformvm.core.protocol.ImportTx;
import io.platformvm.core.protocol.ProposalBlock;
import io.platformvm.core.protocol.RewardValidatorTx;
import io.platformvm.core.protocol.SignedTx;
import io.platformvm.core.protocol.StandardBlock;
import io.platformvm.core.rpc.MetricsServer;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.Logger;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) throws Exception {
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        NodeConfig config = NodeConfig.defaultLocal()
                .withNamespace(options.namespace())
                .withMetricsEndpoint(options.metricsBind(), options.metricsPort(), options.metricsToken());
        PlatformNode node = PlatformNode.inMemory(config);

        MetricsServer metricsServer = null;
        int exitCode = 0;
        try {
            try {
                node.start();
            } catch (RegistrationException e) {
                LOG.log(Level.WARNING, "Continuing with partially registered metrics", e);
            }

            if (options.enableMetrics()) {
                metricsServer = new MetricsServer(
                        node.metrics(),
                        node.registry(),
                        config.metricsBind,
                        config.metricsPort,
                        config.metricsToken
                );
                metricsServer.start();
            }

            if (options.replayFile() != null) {
                ReplaySummary summary = AcceptanceReplayer.replay(options.replayFile(), node.blockDispatcher());
                if (!summary.isComplete()) {
                    LOG.severe("Acceptance log line " + summary.failedLine() + ": " + summary.failure().getMessage());
                    exitCode = 1;
                }
            }

            if (options.demo()) {
                runDemoFlow(node);
            } else {
                LOG.info("Demo flow disabled (--no-demo)");
            }

            LOG.info("=== Metrics ===\n" + MetricsScraper.scrape(node.registry()));

            boolean keepAlive = options.keepAlive() || options.enableMetrics();
            if (keepAlive && exitCode == 0) {
                CountDownLatch shutdownLatch = new CountDownLatch(1);
                Runtime.getRuntime().addShutdownHook(new Thread(shutdownLatch::countDown, "platformvm-shutdown"));
                LOG.info("Node running. Press CTRL+C to exit.");
                shutdownLatch.await();
            }
        } finally {
            if (metricsServer != null) {
                metricsServer.stop();
            }
        }
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /** Accepts a short chain covering every block kind and sets the stake gauges. */
    private static void runDemoFlow(PlatformNode node) {
        List<Block> blocks = demoBlocks(Hash.sha256("genesis".getBytes(StandardCharsets.UTF_8)), 1);
        for (Block block : blocks) {
            node.accept(block);
        }
        node.metrics().totalStake().set(new BigDecimal("2000000000000"));
        node.metrics().percentConnected().set(new BigDecimal("0.8"));
        LOG.info("Demo accepted " + blocks.size() + " blocks");
    }

    static List<Block> demoBlocks(Hash genesis, long firstHeight) {
        long now = System.currentTimeMillis() / 1000;
        Hash cChain = Hash.sha256("C".getBytes(StandardCharsets.UTF_8));
        List<Block> blocks = new ArrayList<>();

        ProposalBlock advance = new ProposalBlock(genesis, firstHeight, SignedTx.of(new AdvanceTimeTx(now)));
        blocks.add(advance);
        CommitBlock commit = new CommitBlock(advance.id(), firstHeight + 1);
        blocks.add(commit);

        SignedTx addValidator = SignedTx.of(new AddValidatorTx(
                "NodeID-demo", now + 30, now + 86_400 * 14, 2_000_000_000_000L, "P-demo1reward", 20_000));
        StandardBlock standard = new StandardBlock(commit.id(), firstHeight + 2, List.of(
                addValidator,
                SignedTx.of(new AddDelegatorTx("NodeID-demo", now + 60, now + 86_400 * 7, 25_000_000_000L, "P-demo1delegator")),
                SignedTx.of(new ExportTx(cChain, 1_000_000_000L, "C-demo1recipient"))));
        blocks.add(standard);

        AtomicBlock atomic = new AtomicBlock(standard.id(), firstHeight + 3,
                SignedTx.of(new ImportTx(cChain, List.of(Hash.sha256(new byte[] {1})), "P-demo1recipient")));
        blocks.add(atomic);

        ProposalBlock reward = new ProposalBlock(atomic.id(), firstHeight + 4, SignedTx.of(new RewardValidatorTx(addValidator.id())));
        blocks.add(reward);
        blocks.add(new AbortBlock(reward.id(), firstHeight + 5));
        return blocks;
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            String namespace,
            boolean enableMetrics,
            String metricsBind,
            int metricsPort,
            String metricsToken,
            Path replayFile,
            boolean demo,
            boolean keepAlive
    ) {
        static CliOptions parse(String[] args) {
            NodeConfig defaults = NodeConfig.defaultLocal();
            String namespace = envOrDefault("PLATFORMVM_NAMESPACE", defaults.namespace);
            boolean enableMetrics = "true".equalsIgnoreCase(System.getenv("PLATFORMVM_ENABLE_METRICS"));
            String metricsBind = envOrDefault("PLATFORMVM_METRICS_BIND", defaults.metricsBind);
            String metricsToken = System.getenv("PLATFORMVM_METRICS_TOKEN");
            Path replayFile = null;
            boolean demo = true;
            boolean keepAlive = "true".equalsIgnoreCase(System.getenv("PLATFORMVM_KEEP_ALIVE"));
            boolean showHelp = false;
            String error = null;

            int metricsPort = defaults.metricsPort;
            try {
                metricsPort = envPort("PLATFORMVM_METRICS_PORT", defaults.metricsPort);
            } catch (IllegalArgumentException ex) {
                showHelp = true;
                error = ex.getMessage();
            }

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    if ("--help".equals(arg) || "-h".equals(arg)) {
                        showHelp = true;
                    } else if (arg.startsWith("--namespace=")) {
                        namespace = arg.substring("--namespace=".length()).trim();
                    } else if (arg.equals("--enable-metrics")) {
                        enableMetrics = true;
                    } else if (arg.startsWith("--metrics-bind=")) {
                        metricsBind = arg.substring("--metrics-bind=".length());
                    } else if (arg.startsWith("--metrics-port=")) {
                        try {
                            metricsPort = parsePort(arg.substring("--metrics-port=".length()), "--metrics-port");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--metrics-token=")) {
                        metricsToken = arg.substring("--metrics-token=".length());
                    } else if (arg.startsWith("--replay=")) {
                        String value = arg.substring("--replay=".length()).trim();
                        if (value.isEmpty()) {
                            showHelp = true;
                            error = "--replay requires a file path";
                        } else {
                            replayFile = Path.of(value);
                        }
                    } else if (arg.equals("--demo")) {
                        demo = true;
                    } else if (arg.equals("--no-demo")) {
                        demo = false;
                    } else if (arg.equals("--keep-alive")) {
                        keepAlive = true;
                    } else if (error == null) {
                        showHelp = true;
                        error = "Unknown option: " + arg;
                    }
                }
            }

            if (metricsToken != null && metricsToken.isBlank()) {
                metricsToken = null;
            }

            return new CliOptions(
                    showHelp,
                    error,
                    namespace,
                    enableMetrics,
                    metricsBind,
                    metricsPort,
                    metricsToken,
                    replayFile,
                    demo,
                    keepAlive
            );
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: platformvm-node [options]

Options:
  --help, -h                 Show this help message and exit
  --namespace=<ns>           Metric name prefix (default platformvm, empty for none)
  --enable-metrics           Start the metrics HTTP server (default bind 127.0.0.1:9650)
  --metrics-bind=<host>      Bind address for the metrics server
  --metrics-port=<port>      Port for the metrics server (default 9650)
  --metrics-token=<token>    Require Bearer/X-API-Key token for the metrics server
  --replay=<file>            Account every block in a JSON-lines acceptance log
  --demo / --no-demo         Enable (default) or disable the demo block sequence
  --keep-alive               Keep the node running until interrupted

Environment overrides:
  PLATFORMVM_NAMESPACE       Override --namespace
  PLATFORMVM_ENABLE_METRICS  Set to "true" to start the metrics server without CLI flag
  PLATFORMVM_METRICS_BIND    Override --metrics-bind
  PLATFORMVM_METRICS_PORT    Override --metrics-port
  PLATFORMVM_METRICS_TOKEN   Token for metrics auth (if --metrics-token not supplied)
  PLATFORMVM_KEEP_ALIVE      Set to "true" to force keep-alive mode
""");
        }

        private static String envOrDefault(String key, String fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : value;
        }

        private static int envPort(String key, int fallback) {
            String value = System.getenv(key);
            if (value == null || value.isBlank()) {
                return fallback;
            }
            return parsePort(value, key);
        }

        private static int parsePort(String value, String flag) {
            try {
                int port = Integer.parseInt(value);
                if (port <= 0 || port > 65_535) {
                    throw new NumberFormatException();
                }
                return port;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port for " + flag + ": " + value);
            }
        }
    }
}
