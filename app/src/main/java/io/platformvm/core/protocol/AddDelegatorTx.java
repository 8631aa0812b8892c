package io.platformvm.core.protocol;

import java.util.Objects;

/** Delegates stake to an existing primary network validator. */
public record AddDelegatorTx(String nodeId,
                             long startTime,
                             long endTime,
                             long stakeAmount,
                             String rewardAddress) implements PlatformTx {

    public AddDelegatorTx {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(rewardAddress, "rewardAddress");
    }

    @Override
    public TxKind kind() {
        return TxKind.ADD_DELEGATOR;
    }

    @Override
    public byte[] bytes() {
        return TxEncoder.of(kind())
                .putStr(nodeId)
                .putLong(startTime)
                .putLong(endTime)
                .putLong(stakeAmount)
                .putStr(rewardAddress)
                .toBytes();
    }
}
