package io.platformvm.core.protocol;

import java.util.List;

/** Option block that commits the proposal of its parent. */
public final class CommitBlock extends PlatformBlock {

    public CommitBlock(Hash parentId, long height) {
        super(parentId, height, List.of());
    }

    @Override
    public BlockKind kind() {
        return BlockKind.COMMIT;
    }
}
