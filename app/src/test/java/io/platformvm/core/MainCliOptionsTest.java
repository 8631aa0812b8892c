package io.platformvm.core;

import io.platformvm.core.protocol.Block;
import io.platformvm.core.protocol.Hash;
import io.platformvm.core.protocol.PlatformBlock;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MainCliOptionsTest {

    @Test
    void parsesDefaults() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {});
        assertFalse(options.showHelp());
        assertNull(options.errorMessage());
        assertTrue(options.demo());
        assertNull(options.replayFile());
        if (System.getenv("PLATFORMVM_NAMESPACE") == null) {
            assertEquals("platformvm", options.namespace());
        }
        if (System.getenv("PLATFORMVM_METRICS_PORT") == null) {
            assertEquals(9650, options.metricsPort());
        }
    }

    @Test
    void parsesMetricsAndReplayFlags() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {
                "--namespace=pchain",
                "--enable-metrics",
                "--metrics-bind=0.0.0.0",
                "--metrics-port=9191",
                "--metrics-token=secret",
                "--replay=data/accepted.jsonl",
                "--no-demo",
                "--keep-alive"
        });
        assertFalse(options.showHelp());
        assertEquals("pchain", options.namespace());
        assertTrue(options.enableMetrics());
        assertEquals("0.0.0.0", options.metricsBind());
        assertEquals(9191, options.metricsPort());
        assertEquals("secret", options.metricsToken());
        assertEquals(Path.of("data/accepted.jsonl"), options.replayFile());
        assertFalse(options.demo());
        assertTrue(options.keepAlive());
    }

    @Test
    void invalidPortSetsError() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--metrics-port=70000"});
        assertTrue(options.showHelp());
        assertTrue(options.errorMessage().contains("--metrics-port"));
    }

    @Test
    void emptyReplayPathSetsError() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--replay="});
        assertTrue(options.showHelp());
        assertEquals("--replay requires a file path", options.errorMessage());
    }

    @Test
    void unknownFlagTriggersHelp() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--unknown-flag"});
        assertTrue(options.showHelp());
        assertEquals("Unknown option: --unknown-flag", options.errorMessage());
    }

    @Test
    void demoBlocksFormAChain() {
        Hash genesis = Hash.sha256(new byte[] {0});
        List<Block> blocks = Main.demoBlocks(genesis, 1);

        assertEquals(genesis, blocks.get(0).parentId());
        for (int i = 1; i < blocks.size(); i++) {
            assertEquals(blocks.get(i - 1).id(), blocks.get(i).parentId());
            assertEquals(blocks.get(i - 1).height() + 1, blocks.get(i).height());
        }
        assertEquals(5, blocks.stream().map(b -> ((PlatformBlock) b).kind()).distinct().count());
    }
}
