package io.platformvm.core.protocol;

import java.util.Objects;

/** Proposes removing the staker added by {@code stakerTxId} and paying its reward. */
public record RewardValidatorTx(Hash stakerTxId) implements PlatformTx {

    public RewardValidatorTx {
        Objects.requireNonNull(stakerTxId, "stakerTxId");
    }

    @Override
    public TxKind kind() {
        return TxKind.REWARD_VALIDATOR;
    }

    @Override
    public byte[] bytes() {
        return TxEncoder.of(kind()).putHash(stakerTxId).toBytes();
    }
}
