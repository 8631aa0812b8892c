package io.platformvm.core.protocol;

/** Proposes moving chain time forward to {@code time} (unix seconds). */
public record AdvanceTimeTx(long time) implements PlatformTx {

    @Override
    public TxKind kind() {
        return TxKind.ADVANCE_TIME;
    }

    @Override
    public byte[] bytes() {
        return TxEncoder.of(kind()).putLong(time).toBytes();
    }
}
