package io.platformvm.core.node;

import io.platformvm.core.acceptance.UnknownBlockTypeException;
import io.platformvm.core.metrics.RegistrationException;
import io.platformvm.core.protocol.AbortBlock;
import io.platformvm.core.protocol.BlockKind;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static io.platformvm.core.protocol.TestBlocks.*;
import static org.junit.jupiter.api.Assertions.*;

class PlatformNodeTest {

    @Test
    void startRegistersUnderConfiguredNamespace() {
        PlatformNode node = PlatformNode.inMemory(NodeConfig.defaultLocal().withNamespace("pchain"));
        node.start();

        node.accept(new AbortBlock(PARENT, 1));

        assertEquals(1.0, node.registry().get("pchain_abort_blks_accepted").functionCounter().count());
        assertNotNull(node.registry().find("pchain_total_staked").gauge());
    }

    @Test
    void acceptRethrowsUnknownBlocks() {
        PlatformNode node = PlatformNode.inMemory(NodeConfig.defaultLocal());
        node.start();

        assertThrows(UnknownBlockTypeException.class, () -> node.accept(unknownBlock()));
        assertEquals(0, node.metrics().blockCounter(BlockKind.STANDARD).count());
    }

    @Test
    void twoNodesCannotShareARegistry() {
        SimpleMeterRegistry shared = new SimpleMeterRegistry();
        new PlatformNode(NodeConfig.defaultLocal(), shared).start();
        PlatformNode second = new PlatformNode(NodeConfig.defaultLocal(), shared);

        RegistrationException e = assertThrows(RegistrationException.class, second::start);
        assertEquals(16, e.failures().size());
        assertTrue(second.metrics().isInitialized());
    }
}
