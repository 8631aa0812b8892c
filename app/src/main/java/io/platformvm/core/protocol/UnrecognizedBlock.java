package io.platformvm.core.protocol;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * A block whose type name this node does not know, kept as-is by the
 * acceptance log decoder so the acceptance path can report it.
 */
public final class UnrecognizedBlock implements Block {
    private final String typeName;
    private final Hash parentId;
    private final long height;
    private final Hash id;

    public UnrecognizedBlock(String typeName, Hash parentId, long height) {
        this.typeName = typeName == null ? "" : typeName;
        this.parentId = parentId == null ? Hash.ZERO : parentId;
        this.height = height;
        byte[] name = this.typeName.getBytes(StandardCharsets.UTF_8);
        this.id = Hash.sha256(ByteBuffer.allocate(name.length + Hash.LENGTH + 8)
                .put(name)
                .put(this.parentId.bytes())
                .putLong(height)
                .array());
    }

    public String typeName() { return typeName; }

    @Override public Hash id() { return id; }
    @Override public Hash parentId() { return parentId; }
    @Override public long height() { return height; }

    @Override public String toString() {
        return "UnrecognizedBlock{type=" + typeName + ", height=" + height + "}";
    }
}
