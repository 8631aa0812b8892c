package io.platformvm.core.protocol;

import java.util.List;

/** Carries exactly one atomic (cross-chain import/export) transaction. */
public final class AtomicBlock extends PlatformBlock {
    private final SignedTx tx;

    public AtomicBlock(Hash parentId, long height, SignedTx tx) {
        super(parentId, height, List.of(requireTx(tx)));
        this.tx = tx;
    }

    public SignedTx tx() { return tx; }

    @Override
    public BlockKind kind() {
        return BlockKind.ATOMIC;
    }

    static SignedTx requireTx(SignedTx tx) {
        if (tx == null) throw new IllegalArgumentException("missing transaction");
        return tx;
    }
}
