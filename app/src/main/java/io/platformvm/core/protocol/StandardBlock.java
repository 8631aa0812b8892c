package io.platformvm.core.protocol;

import java.util.List;

/** Carries an ordered, possibly empty, list of decision transactions. */
public final class StandardBlock extends PlatformBlock {
    private final List<SignedTx> transactions;

    public StandardBlock(Hash parentId, long height, List<SignedTx> txs) {
        super(parentId, height, copyOf(txs));
        this.transactions = copyOf(txs);
    }

    public List<SignedTx> transactions() { return transactions; }

    @Override
    public BlockKind kind() {
        return BlockKind.STANDARD;
    }

    private static List<SignedTx> copyOf(List<SignedTx> txs) {
        return txs != null ? List.copyOf(txs) : List.of();
    }

    @Override public String toString() {
        return "StandardBlock{height=" + height() + ", txs=" + transactions.size() + "}";
    }
}
