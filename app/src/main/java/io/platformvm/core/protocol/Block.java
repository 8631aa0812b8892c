package io.platformvm.core.protocol;

/**
 * A block as the consensus engine hands it over after acceptance.
 * The platform chain's own kinds extend {@link PlatformBlock}; anything else
 * reaching the acceptance path is a block kind this node does not know.
 */
public interface Block {
    Hash id();
    Hash parentId();
    long height();
}
