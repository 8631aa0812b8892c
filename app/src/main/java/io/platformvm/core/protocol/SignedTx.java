package io.platformvm.core.protocol;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * An unsigned payload together with the credentials that authorize it.
 * The id covers the unsigned bytes only, so re-signing does not change it.
 */
public final class SignedTx {

    private final UnsignedTx unsignedTx;
    private final List<byte[]> credentials;
    private final Hash id;

    private SignedTx(UnsignedTx unsignedTx, List<byte[]> credentials) {
        if (unsignedTx == null) {
            throw new IllegalArgumentException("Missing unsigned transaction");
        }
        this.unsignedTx = unsignedTx;
        List<byte[]> copy = new ArrayList<>(credentials.size());
        for (byte[] credential : credentials) {
            copy.add(credential.clone());
        }
        this.credentials = List.copyOf(copy);
        this.id = Hash.sha256(unsignedTx.bytes());
    }

    public static SignedTx of(UnsignedTx unsignedTx) {
        return builder().unsignedTx(unsignedTx).build();
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private UnsignedTx unsignedTx;
        private final List<byte[]> credentials = new ArrayList<>();

        public Builder unsignedTx(UnsignedTx tx) { this.unsignedTx = tx; return this; }
        public Builder credential(byte[] c) {
            if (c == null) throw new IllegalArgumentException("credential must not be null");
            this.credentials.add(c);
            return this;
        }

        public SignedTx build() {
            return new SignedTx(unsignedTx, credentials);
        }
    }

    public UnsignedTx unsignedTx() { return unsignedTx; }
    int credentialCount() { return credentials.size(); }
    public Hash id() { return id; }

    /** Signed encoding: unsigned bytes || count || credential[i]. */
    byte[] bytes() {
        byte[] unsigned = unsignedTx.bytes();
        int size = 4 + unsigned.length + 4;
        for (byte[] c : credentials) size += 4 + c.length;

        ByteBuffer buf = ByteBuffer.allocate(size);
        buf.putInt(unsigned.length);
        buf.put(unsigned);
        buf.putInt(credentials.size());
        for (byte[] c : credentials) {
            buf.putInt(c.length);
            buf.put(c);
        }
        return buf.array();
    }

    @Override public String toString() {
        return "SignedTx{type=" + unsignedTx.getClass().getSimpleName() + ", id=" + id + "}";
    }
}
