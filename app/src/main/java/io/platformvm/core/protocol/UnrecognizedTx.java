package io.platformvm.core.protocol;

import java.nio.charset.StandardCharsets;

/** An unsigned payload whose type name this node does not know. */
public record UnrecognizedTx(String typeName) implements UnsignedTx {

    public UnrecognizedTx {
        typeName = typeName == null ? "" : typeName;
    }

    @Override
    public byte[] bytes() {
        return typeName.getBytes(StandardCharsets.UTF_8);
    }
}
