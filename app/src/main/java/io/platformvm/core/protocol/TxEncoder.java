package io.platformvm.core.protocol;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Deterministic length-prefixed writer for unsigned transaction bytes.
 * Every encoding starts with the kind name so two kinds never share bytes.
 */
final class TxEncoder {
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    private TxEncoder() {}

    static TxEncoder of(TxKind kind) {
        return new TxEncoder().putStr(kind.metricName());
    }

    TxEncoder putInt(int v) {
        out.writeBytes(ByteBuffer.allocate(4).putInt(v).array());
        return this;
    }

    TxEncoder putLong(long v) {
        out.writeBytes(ByteBuffer.allocate(8).putLong(v).array());
        return this;
    }

    TxEncoder putStr(String s) {
        byte[] b = s == null ? new byte[0] : s.getBytes(StandardCharsets.UTF_8);
        return putBytes(b);
    }

    TxEncoder putHash(Hash h) {
        out.writeBytes(h.bytes());
        return this;
    }

    TxEncoder putBytes(byte[] b) {
        putInt(b.length);
        out.writeBytes(b);
        return this;
    }

    byte[] toBytes() {
        return out.toByteArray();
    }
}
