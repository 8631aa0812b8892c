package io.platformvm.core.protocol;

import java.util.Objects;

/** Moves funds out of the platform chain into {@code destinationChain}'s shared memory. */
public record ExportTx(Hash destinationChain, long amount, String to) implements PlatformTx {

    public ExportTx {
        Objects.requireNonNull(destinationChain, "destinationChain");
        Objects.requireNonNull(to, "to");
    }

    @Override
    public TxKind kind() {
        return TxKind.EXPORT;
    }

    @Override
    public byte[] bytes() {
        return TxEncoder.of(kind())
                .putHash(destinationChain)
                .putLong(amount)
                .putStr(to)
                .toBytes();
    }
}
