package io.platformvm.core.protocol;

/** The platform chain's own unsigned transaction payloads. */
public sealed interface PlatformTx extends UnsignedTx
        permits AddDelegatorTx,
                AddSubnetValidatorTx,
                AddValidatorTx,
                AdvanceTimeTx,
                CreateChainTx,
                CreateSubnetTx,
                ExportTx,
                ImportTx,
                RewardValidatorTx {

    TxKind kind();
}
