package io.platformvm.core.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JSON form of accepted blocks, one object per block:
 * <pre>
 * {"type":"proposal","parentId":"&lt;hex&gt;","height":7,"tx":{"type":"advance_time","time":1700000000}}
 * {"type":"standard","parentId":"&lt;hex&gt;","height":8,"txs":[{"type":"export", ...}]}
 * </pre>
 * Type names are the {@link BlockKind} / {@link TxKind} metric names. Unknown type names
 * decode to {@link UnrecognizedBlock} / {@link UnrecognizedTx} instead of failing here.
 */
public final class BlockJson {
    private static final ObjectMapper JSON = new ObjectMapper();

    private BlockJson() {}

    public static Block parse(String json) {
        try {
            return decodeBlock(JSON.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed block JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static Block decodeBlock(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Block must be a JSON object");
        }
        String type = requiredText(node, "type");
        Hash parentId = Hash.fromHex(requiredText(node, "parentId"));
        long height = requiredLong(node, "height");

        Optional<BlockKind> kind = BlockKind.fromName(type);
        if (kind.isEmpty()) {
            return new UnrecognizedBlock(type, parentId, height);
        }
        return switch (kind.get()) {
            case ABORT -> new AbortBlock(parentId, height);
            case ATOMIC -> new AtomicBlock(parentId, height, decodeTx(required(node, "tx")));
            case COMMIT -> new CommitBlock(parentId, height);
            case PROPOSAL -> new ProposalBlock(parentId, height, decodeTx(required(node, "tx")));
            case STANDARD -> {
                JsonNode txs = node.path("txs");
                if (!txs.isMissingNode() && !txs.isArray()) {
                    throw new IllegalArgumentException("'txs' must be an array");
                }
                List<SignedTx> decoded = new ArrayList<>();
                for (JsonNode tx : txs) {
                    decoded.add(decodeTx(tx));
                }
                yield new StandardBlock(parentId, height, decoded);
            }
        };
    }

    public static SignedTx decodeTx(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Transaction must be a JSON object");
        }
        String type = requiredText(node, "type");
        UnsignedTx unsigned = TxKind.fromName(type)
                .<UnsignedTx>map(kind -> decodeUnsigned(kind, node))
                .orElseGet(() -> new UnrecognizedTx(type));

        SignedTx.Builder builder = SignedTx.builder().unsignedTx(unsigned);
        for (JsonNode credential : node.path("credentials")) {
            builder.credential(parseHex(credential.asText()));
        }
        return builder.build();
    }

    private static PlatformTx decodeUnsigned(TxKind kind, JsonNode n) {
        return switch (kind) {
            case ADD_DELEGATOR -> new AddDelegatorTx(
                    requiredText(n, "nodeId"),
                    requiredLong(n, "startTime"),
                    requiredLong(n, "endTime"),
                    requiredLong(n, "stakeAmount"),
                    requiredText(n, "rewardAddress"));
            case ADD_SUBNET_VALIDATOR -> new AddSubnetValidatorTx(
                    requiredText(n, "nodeId"),
                    requiredLong(n, "startTime"),
                    requiredLong(n, "endTime"),
                    requiredLong(n, "weight"),
                    Hash.fromHex(requiredText(n, "subnetId")));
            case ADD_VALIDATOR -> new AddValidatorTx(
                    requiredText(n, "nodeId"),
                    requiredLong(n, "startTime"),
                    requiredLong(n, "endTime"),
                    requiredLong(n, "stakeAmount"),
                    requiredText(n, "rewardAddress"),
                    requiredInt(n, "delegationShares"));
            case ADVANCE_TIME -> new AdvanceTimeTx(requiredLong(n, "time"));
            case CREATE_CHAIN -> new CreateChainTx(
                    Hash.fromHex(requiredText(n, "subnetId")),
                    requiredText(n, "chainName"),
                    Hash.fromHex(requiredText(n, "vmId")),
                    n.path("genesisData").asText(""));
            case CREATE_SUBNET -> {
                List<String> keys = new ArrayList<>();
                for (JsonNode key : n.path("controlKeys")) {
                    keys.add(key.asText());
                }
                yield new CreateSubnetTx(keys, requiredInt(n, "threshold"));
            }
            case EXPORT -> new ExportTx(
                    Hash.fromHex(requiredText(n, "destinationChain")),
                    requiredLong(n, "amount"),
                    requiredText(n, "to"));
            case IMPORT -> {
                List<Hash> utxos = new ArrayList<>();
                for (JsonNode utxo : n.path("importedUtxos")) {
                    utxos.add(Hash.fromHex(utxo.asText()));
                }
                yield new ImportTx(Hash.fromHex(requiredText(n, "sourceChain")), utxos, requiredText(n, "to"));
            }
            case REWARD_VALIDATOR -> new RewardValidatorTx(Hash.fromHex(requiredText(n, "stakerTxId")));
        };
    }

    private static JsonNode required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Missing field '" + field + "'");
        }
        return value;
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = required(node, field);
        if (!value.isTextual() || value.asText().isBlank()) {
            throw new IllegalArgumentException("Field '" + field + "' must be a non-empty string");
        }
        return value.asText();
    }

    private static long requiredLong(JsonNode node, String field) {
        JsonNode value = required(node, field);
        if (!value.isIntegralNumber()) {
            throw new IllegalArgumentException("Field '" + field + "' must be an integer");
        }
        return value.asLong();
    }

    private static int requiredInt(JsonNode node, String field) {
        JsonNode value = required(node, field);
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new IllegalArgumentException("Field '" + field + "' must be a 32-bit integer");
        }
        return value.intValue();
    }

    private static byte[] parseHex(String hex) {
        if (hex == null || hex.isBlank()) {
            return new byte[0];
        }
        String normalized = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (normalized.length() % 2 != 0) {
            normalized = "0" + normalized;
        }
        int len = normalized.length();
        byte[] out = new byte[len / 2];
        for (int i = 0; i < len; i += 2) {
            int hi = Character.digit(normalized.charAt(i), 16);
            int lo = Character.digit(normalized.charAt(i + 1), 16);
            if (hi < 0 || lo < 0) {
                throw new IllegalArgumentException("credentials must be hexadecimal");
            }
            out[i / 2] = (byte) ((hi << 4) + lo);
        }
        return out;
    }
}
