package io.platformvm.core.protocol;

import java.util.Objects;

public record CreateChainTx(Hash subnetId,
                            String chainName,
                            Hash vmId,
                            String genesisData) implements PlatformTx {

    public CreateChainTx {
        Objects.requireNonNull(subnetId, "subnetId");
        Objects.requireNonNull(chainName, "chainName");
        Objects.requireNonNull(vmId, "vmId");
        genesisData = genesisData == null ? "" : genesisData;
    }

    @Override
    public TxKind kind() {
        return TxKind.CREATE_CHAIN;
    }

    @Override
    public byte[] bytes() {
        return TxEncoder.of(kind())
                .putHash(subnetId)
                .putStr(chainName)
                .putHash(vmId)
                .putStr(genesisData)
                .toBytes();
    }
}
