package io.platformvm.core.protocol;

import java.util.Objects;

/** Adds a primary network validator staking {@code stakeAmount} between the two times. */
public record AddValidatorTx(String nodeId,
                             long startTime,
                             long endTime,
                             long stakeAmount,
                             String rewardAddress,
                             int delegationShares) implements PlatformTx {

    public AddValidatorTx {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(rewardAddress, "rewardAddress");
    }

    @Override
    public TxKind kind() {
        return TxKind.ADD_VALIDATOR;
    }

    @Override
    public byte[] bytes() {
        return TxEncoder.of(kind())
                .putStr(nodeId)
                .putLong(startTime)
                .putLong(endTime)
                .putLong(stakeAmount)
                .putStr(rewardAddress)
                .putInt(delegationShares)
                .toBytes();
    }
}
