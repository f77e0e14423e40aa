package com.ethindexer.ingestion.adapter.evm;

import com.ethindexer.common.HexUtils;
import com.ethindexer.domain.ChainBlock;
import com.ethindexer.domain.ChainTransaction;
import com.ethindexer.domain.TransactionReceipt;
import com.ethindexer.ingestion.adapter.RpcException;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps JSON-RPC result objects to domain records. Block-level fields are mandatory; transaction fields
 * are kept nullable so the decoder can skip a malformed transaction without failing the block.
 */
final class EvmJsonParser {

    private EvmJsonParser() {
    }

    static ChainBlock toBlock(JsonNode result, long requestedHeight) {
        if (result == null || result.isMissingNode() || result.isNull()) {
            throw new RpcException("Block " + requestedHeight + " not available on node");
        }
        long number = requiredQuantity(result, "number", "block " + requestedHeight).longValueExact();
        String hash = requiredText(result, "hash", "block " + requestedHeight);
        String parentHash = requiredText(result, "parentHash", "block " + requestedHeight);
        long timestamp = requiredQuantity(result, "timestamp", "block " + requestedHeight).longValueExact();
        List<ChainTransaction> txs = new ArrayList<>();
        JsonNode transactions = result.path("transactions");
        if (transactions.isArray()) {
            for (JsonNode tx : transactions) {
                if (tx.isObject()) {
                    txs.add(toTransaction(tx, number));
                }
            }
        }
        return new ChainBlock(number, hash, parentHash, timestamp, txs);
    }

    static ChainTransaction toTransaction(JsonNode tx, long blockNumber) {
        JsonNode toNode = tx.get("to");
        boolean contractCreation = toNode != null && toNode.isNull();
        String to = toNode != null && !toNode.isNull() ? toNode.asText() : null;
        String input = textOrNull(tx, "input");
        if (input == null) {
            input = textOrNull(tx, "data");
        }
        return new ChainTransaction(
                textOrNull(tx, "hash"),
                textOrNull(tx, "from"),
                to,
                contractCreation,
                optionalQuantity(tx, "value", BigInteger.ZERO),
                optionalQuantity(tx, "gasPrice", null),
                input != null ? input : "0x",
                blockNumber);
    }

    static TransactionReceipt toReceipt(JsonNode result, String txHash) {
        if (result == null || result.isMissingNode() || result.isNull()) {
            throw new RpcException("Receipt not available for " + txHash);
        }
        JsonNode statusNode = result.get("status");
        Boolean status = null;
        if (statusNode != null && !statusNode.isNull()) {
            status = parseQuantity(statusNode.asText(), "status of " + txHash).signum() != 0;
        }
        return new TransactionReceipt(
                txHash,
                requiredQuantity(result, "gasUsed", "receipt " + txHash),
                status,
                optionalQuantity(result, "effectiveGasPrice", null));
    }

    static long toQuantity(JsonNode result, String what) {
        if (result == null || !result.isTextual()) {
            throw new RpcException(what + " invalid result: " + result);
        }
        return parseQuantity(result.asText(), what).longValueExact();
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }

    private static String requiredText(JsonNode node, String field, String context) {
        String v = textOrNull(node, field);
        if (v == null || v.isBlank()) {
            throw new RpcException(context + ": missing field '" + field + "'");
        }
        return v;
    }

    private static BigInteger requiredQuantity(JsonNode node, String field, String context) {
        return parseQuantity(requiredText(node, field, context), context + " field " + field);
    }

    private static BigInteger optionalQuantity(JsonNode node, String field, BigInteger fallback) {
        String v = textOrNull(node, field);
        return v == null ? fallback : parseQuantity(v, field);
    }

    private static BigInteger parseQuantity(String hex, String context) {
        try {
            return HexUtils.toBigInteger(hex);
        } catch (NumberFormatException e) {
            throw new RpcException("Invalid hex quantity for " + context + ": " + hex, e);
        }
    }
}
