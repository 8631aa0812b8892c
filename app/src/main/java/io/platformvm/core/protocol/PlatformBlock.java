package io.platformvm.core.protocol;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Base of the platform chain's block kinds. The id commits to the kind, parent,
 * height and the ids of every embedded transaction in order.
 */
public abstract sealed class PlatformBlock implements Block
        permits AbortBlock, AtomicBlock, CommitBlock, ProposalBlock, StandardBlock {

    private final Hash parentId;
    private final long height;
    private final Hash id;

    PlatformBlock(Hash parentId, long height, List<SignedTx> embedded) {
        if (parentId == null) throw new IllegalArgumentException("missing parent id");
        if (height < 0) throw new IllegalArgumentException("height must be >= 0");
        this.parentId = parentId;
        this.height = height;
        this.id = computeId(embedded);
    }

    public abstract BlockKind kind();

    @Override public Hash id() { return id; }
    @Override public Hash parentId() { return parentId; }
    @Override public long height() { return height; }

    private Hash computeId(List<SignedTx> embedded) {
        byte[] kindName = kind().metricName().getBytes(StandardCharsets.UTF_8);
        ByteBuffer buf = ByteBuffer.allocate(4 + kindName.length + Hash.LENGTH + 8 + 4 + embedded.size() * Hash.LENGTH);
        buf.putInt(kindName.length);
        buf.put(kindName);
        buf.put(parentId.bytes());
        buf.putLong(height);
        buf.putInt(embedded.size());
        for (SignedTx tx : embedded) {
            buf.put(tx.id().bytes());
        }
        return Hash.sha256(buf.array());
    }

    @Override public String toString() {
        return getClass().getSimpleName() + "{height=" + height + ", id=" + id + "}";
    }
}
