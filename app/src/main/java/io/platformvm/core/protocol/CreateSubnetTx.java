package io.platformvm.core.protocol;

import java.util.List;

/** Creates a subnet controlled by {@code threshold} of the listed keys. */
public record CreateSubnetTx(List<String> controlKeys, int threshold) implements PlatformTx {

    public CreateSubnetTx {
        controlKeys = controlKeys == null ? List.of() : List.copyOf(controlKeys);
    }

    @Override
    public TxKind kind() {
        return TxKind.CREATE_SUBNET;
    }

    @Override
    public byte[] bytes() {
        TxEncoder encoder = TxEncoder.of(kind()).putInt(controlKeys.size());
        for (String key : controlKeys) {
            encoder.putStr(key);
        }
        return encoder.putInt(threshold).toBytes();
    }
}
