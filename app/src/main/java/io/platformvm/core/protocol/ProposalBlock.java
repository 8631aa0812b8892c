package io.platformvm.core.protocol;

import java.util.List;

/** Carries exactly one proposal transaction; its children are a commit and an abort option. */
public final class ProposalBlock extends PlatformBlock {
    private final SignedTx tx;

    public ProposalBlock(Hash parentId, long height, SignedTx tx) {
        super(parentId, height, List.of(AtomicBlock.requireTx(tx)));
        this.tx = tx;
    }

    public SignedTx tx() { return tx; }

    @Override
    public BlockKind kind() {
        return BlockKind.PROPOSAL;
    }
}
