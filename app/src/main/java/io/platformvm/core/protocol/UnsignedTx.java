package io.platformvm.core.protocol;

/**
 * Unsigned transaction payload. Platform chain payloads implement {@link PlatformTx};
 * other implementations come from transaction kinds this node does not know.
 */
public interface UnsignedTx {
    /** Canonical unsigned encoding; the transaction id is derived from it. */
    byte[] bytes();
}
