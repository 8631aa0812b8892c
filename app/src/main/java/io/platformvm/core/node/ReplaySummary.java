package io.platformvm.core.node;

import io.platformvm.core.acceptance.UnknownTypeException;

/**
 * Outcome of an acceptance-log replay.
 *
 * @param accepted   blocks fully accounted
 * @param failedLine line of the block that stopped the replay, or -1
 * @param failure    why it stopped, or null when every block was accounted
 */
public record ReplaySummary(int accepted, long failedLine, UnknownTypeException failure) {

    public static ReplaySummary complete(int accepted) {
        return new ReplaySummary(accepted, -1, null);
    }

    public boolean isComplete() {
        return failure == null;
    }
}
