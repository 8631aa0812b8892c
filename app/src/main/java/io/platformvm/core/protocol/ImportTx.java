package io.platformvm.core.protocol;

import java.util.List;
import java.util.Objects;

/** Consumes UTXOs that {@code sourceChain} exported to the platform chain. */
public record ImportTx(Hash sourceChain, List<Hash> importedUtxos, String to) implements PlatformTx {

    public ImportTx {
        Objects.requireNonNull(sourceChain, "sourceChain");
        Objects.requireNonNull(to, "to");
        importedUtxos = importedUtxos == null ? List.of() : List.copyOf(importedUtxos);
    }

    @Override
    public TxKind kind() {
        return TxKind.IMPORT;
    }

    @Override
    public byte[] bytes() {
        TxEncoder encoder = TxEncoder.of(kind()).putHash(sourceChain).putInt(importedUtxos.size());
        for (Hash utxo : importedUtxos) {
            encoder.putHash(utxo);
        }
        return encoder.putStr(to).toBytes();
    }
}
