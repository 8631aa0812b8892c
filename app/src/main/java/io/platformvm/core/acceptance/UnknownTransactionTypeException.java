package io.platformvm.core.acceptance;

import io.platformvm.core.protocol.UnsignedTx;

public class UnknownTransactionTypeException extends UnknownTypeException {

    public UnknownTransactionTypeException(UnsignedTx tx) {
        super("transaction", tx);
    }
}
