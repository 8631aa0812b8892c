package io.platformvm.core.acceptance;

import io.platformvm.core.protocol.Block;

public class UnknownBlockTypeException extends UnknownTypeException {

    public UnknownBlockTypeException(Block block) {
        super("block", block);
    }
}
