package io.platformvm.core.protocol;

import java.util.List;

/** Option block that rejects the proposal of its parent. */
public final class AbortBlock extends PlatformBlock {

    public AbortBlock(Hash parentId, long height) {
        super(parentId, height, List.of());
    }

    @Override
    public BlockKind kind() {
        return BlockKind.ABORT;
    }
}
