package io.platformvm.core.node;

import io.platformvm.core.acceptance.BlockAcceptanceDispatcher;
import io.platformvm.core.acceptance.UnknownTypeException;
import io.platformvm.core.protocol.Block;
import io.platformvm.core.protocol.BlockJson;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Feeds a JSON-lines log of accepted blocks, in acceptance order, through the block
 * dispatcher. Blank lines and lines starting with {@code #} are skipped.
 */
public final class AcceptanceReplayer {
    private static final Logger LOG = Logger.getLogger(AcceptanceReplayer.class.getName());

    private AcceptanceReplayer(){}

    public static ReplaySummary replay(Path file, BlockAcceptanceDispatcher dispatcher) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return replay(reader, dispatcher);
        }
    }

    /**
     * Stops at the first block that cannot be accounted and reports it in the summary.
     *
     * @throws IllegalArgumentException if a line is not a valid block; the message names the line
     */
    public static ReplaySummary replay(BufferedReader reader, BlockAcceptanceDispatcher dispatcher) throws IOException {
        int accepted = 0;
        long lineNumber = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            Block block;
            try {
                block = BlockJson.parse(trimmed);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("line " + lineNumber + ": " + e.getMessage(), e);
            }
            try {
                dispatcher.acceptBlock(block);
            } catch (UnknownTypeException e) {
                LOG.log(Level.WARNING, "Replay stopped at line " + lineNumber + " after " + accepted + " block(s)", e);
                return new ReplaySummary(accepted, lineNumber, e);
            }
            accepted++;
        }
        final int total = accepted;
        LOG.info(() -> "Replayed " + total + " accepted block(s)");
        return ReplaySummary.complete(accepted);
    }
}
