package com.ethindexer.ingestion.adapter.evm;

import com.ethindexer.common.HexUtils;
import com.ethindexer.common.Sleeper;
import com.ethindexer.domain.ChainBlock;
import com.ethindexer.domain.TransactionReceipt;
import com.ethindexer.ingestion.adapter.ChainReader;
import com.ethindexer.ingestion.adapter.RpcEndpointRotator;
import com.ethindexer.ingestion.adapter.RpcException;
import com.ethindexer.ingestion.config.RpcProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * {@link ChainReader} over EVM JSON-RPC. Every call is rate limited, bounded by the configured timeout and
 * retried with exponential backoff across the rotated endpoints. Receipts of a block are fetched in
 * JSON-RPC batches; endpoints that reject batches fall back to sequential calls for a cool-down period.
 */
@Slf4j
@Component
public class EvmChainReader implements ChainReader {

    static final int MAX_BATCH_SIZE = 100;
    private static final long RATE_LIMIT_COOLDOWN_MS = 30_000L;
    private static final long BATCH_UNSUPPORTED_COOLDOWN_MS = 300_000L;

    private final Map<String, Long> batchUnsupportedUntilMs = new ConcurrentHashMap<>();

    private final EvmRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final RateLimiter evmRpcRateLimiter;
    private final RpcProperties rpcProperties;
    private final ObjectMapper objectMapper;
    private final Sleeper sleeper;

    public EvmChainReader(
            EvmRpcClient rpcClient,
            RpcEndpointRotator rotator,
            @Qualifier("evmRpcRateLimiter") RateLimiter evmRpcRateLimiter,
            RpcProperties rpcProperties,
            ObjectMapper objectMapper,
            Sleeper sleeper
    ) {
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.evmRpcRateLimiter = evmRpcRateLimiter;
        this.rpcProperties = rpcProperties;
        this.objectMapper = objectMapper;
        this.sleeper = sleeper;
    }

    @Override
    public ChainBlock getBlock(long height, boolean includeTransactions) {
        return withRetry("eth_getBlockByNumber(" + height + ")", endpoint -> {
            JsonNode result = callRpc(endpoint, "eth_getBlockByNumber", List.of(HexUtils.toHex(height), includeTransactions));
            return EvmJsonParser.toBlock(result, height);
        });
    }

    @Override
    public TransactionReceipt getTransactionReceipt(String txHash) {
        return withRetry("eth_getTransactionReceipt(" + txHash + ")",
                endpoint -> fetchReceipt(endpoint, txHash));
    }

    @Override
    public Map<String, TransactionReceipt> getTransactionReceipts(List<String> txHashes) {
        if (txHashes.isEmpty()) {
            return Map.of();
        }
        Map<String, TransactionReceipt> result = new LinkedHashMap<>();
        for (int i = 0; i < txHashes.size(); i += MAX_BATCH_SIZE) {
            List<String> chunk = txHashes.subList(i, Math.min(i + MAX_BATCH_SIZE, txHashes.size()));
            result.putAll(withRetry("eth_getTransactionReceipt(batch of " + chunk.size() + ")",
                    endpoint -> fetchReceipts(endpoint, chunk)));
        }
        return result;
    }

    @Override
    public long getChainHeadHeight() {
        return withRetry("eth_blockNumber", endpoint ->
                EvmJsonParser.toQuantity(callRpc(endpoint, "eth_blockNumber", Collections.emptyList()), "eth_blockNumber"));
    }

    @Override
    public boolean isSyncing() {
        return withRetry("eth_syncing", endpoint -> {
            JsonNode result = callRpc(endpoint, "eth_syncing", Collections.emptyList());
            if (result.isBoolean()) {
                return result.asBoolean();
            }
            return result.isObject();
        });
    }

    private Map<String, TransactionReceipt> fetchReceipts(String endpoint, List<String> txHashes) {
        Map<String, TransactionReceipt> receipts = new HashMap<>();
        if (txHashes.size() > 1 && isBatchSupported(endpoint)) {
            try {
                receipts.putAll(batchFetchReceipts(endpoint, txHashes));
            } catch (RpcException e) {
                if (isRateLimitOrTransient(e)) {
                    throw e;
                }
                markBatchUnsupported(endpoint, e);
            }
        }
        Map<String, TransactionReceipt> ordered = new LinkedHashMap<>();
        for (String hash : txHashes) {
            TransactionReceipt receipt = receipts.get(hash);
            ordered.put(hash, receipt != null ? receipt : fetchReceipt(endpoint, hash));
        }
        return ordered;
    }

    private Map<String, TransactionReceipt> batchFetchReceipts(String endpoint, List<String> txHashes) {
        List<RpcRequest> requests = txHashes.stream()
                .map(hash -> new RpcRequest("eth_getTransactionReceipt", Collections.singletonList(hash)))
                .toList();
        JsonNode root = readTree(batchCallRpc(endpoint, requests), "batch eth_getTransactionReceipt");
        if (!root.isArray()) {
            throw new RpcException("Batch receipt: expected JSON array response, got: " + abbreviate(root.toString()));
        }
        Map<Integer, JsonNode> byId = new HashMap<>();
        for (JsonNode resp : root) {
            byId.put(resp.path("id").asInt(), resp);
        }
        Map<String, TransactionReceipt> receipts = new HashMap<>();
        for (int i = 0; i < txHashes.size(); i++) {
            JsonNode resp = byId.get(i + 1);
            if (resp == null || !resp.path("error").isMissingNode()) {
                continue;
            }
            JsonNode receipt = resp.path("result");
            if (receipt.isMissingNode() || receipt.isNull()) {
                continue;
            }
            receipts.put(txHashes.get(i), EvmJsonParser.toReceipt(receipt, txHashes.get(i)));
        }
        return receipts;
    }

    private TransactionReceipt fetchReceipt(String endpoint, String txHash) {
        JsonNode result = callRpc(endpoint, "eth_getTransactionReceipt", Collections.singletonList(txHash));
        return EvmJsonParser.toReceipt(result, txHash);
    }

    private <T> T withRetry(String operation, Function<String, T> call) {
        RpcException lastException = null;
        for (int attempt = 0; attempt < rotator.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                long delayMs = rotator.retryDelayMs(attempt - 1);
                log.debug("Retrying {} in {} ms (attempt {}/{})", operation, delayMs, attempt + 1, rotator.getMaxAttempts());
                try {
                    sleeper.sleep(Duration.ofMillis(delayMs));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RpcException("Interrupted during retry of " + operation, e);
                }
            }
            String endpoint = rotator.getNextEndpoint();
            try {
                return call.apply(endpoint);
            } catch (RpcException e) {
                lastException = e;
                if (isRateLimited(e)) {
                    rotator.markCoolingDown(endpoint, RATE_LIMIT_COOLDOWN_MS, "suspected RPC rate-limit");
                }
                log.debug("{} failed on {}: {}", operation, endpoint, e.getMessage());
            }
        }
        String msg = operation + " failed after " + rotator.getMaxAttempts() + " attempts";
        if (lastException != null && lastException.getMessage() != null && !lastException.getMessage().isBlank()) {
            msg += ": " + lastException.getMessage();
        }
        throw new RpcException(msg, lastException);
    }

    private JsonNode callRpc(String endpoint, String method, Object params) {
        acquirePermit(method, endpoint);
        String json;
        try {
            json = rpcClient.call(endpoint, method, params)
                    .timeout(rpcProperties.getTimeout())
                    .onErrorMap(TimeoutException.class,
                            e -> new RpcException(method + " timed out after " + rpcProperties.getTimeout().toMillis() + " ms", e))
                    .block();
        } catch (RpcException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RpcException(method + " on " + endpoint + " failed: " + e.getMessage(), e);
        }
        if (json == null) {
            throw new RpcException(method + " returned empty body");
        }
        JsonNode root = readTree(json, method);
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new RpcException(method + " error: " + error);
        }
        return root.path("result");
    }

    private String batchCallRpc(String endpoint, List<RpcRequest> requests) {
        acquirePermit("batch " + requests.get(0).method(), endpoint);
        String json;
        try {
            json = rpcClient.batchCall(endpoint, requests)
                    .timeout(rpcProperties.getTimeout())
                    .onErrorMap(TimeoutException.class,
                            e -> new RpcException("batch timed out after " + rpcProperties.getTimeout().toMillis() + " ms", e))
                    .block();
        } catch (RpcException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RpcException("batch call on " + endpoint + " failed: " + e.getMessage(), e);
        }
        if (json == null) {
            throw new RpcException("batch call returned empty body");
        }
        return json;
    }

    private void acquirePermit(String method, String endpoint) {
        if (!evmRpcRateLimiter.acquirePermission()) {
            throw new RpcException("Local limiter timeout before " + method + " on " + endpoint);
        }
    }

    private JsonNode readTree(String json, String what) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException("Failed to parse " + what + " response", e);
        }
    }

    private void markBatchUnsupported(String endpoint, Exception cause) {
        long now = System.currentTimeMillis();
        Long previous = batchUnsupportedUntilMs.put(endpoint, now + BATCH_UNSUPPORTED_COOLDOWN_MS);
        if (previous == null || previous <= now) {
            log.info("Batch receipts disabled on {} for {} ms (fallback to sequential). cause={}",
                    endpoint, BATCH_UNSUPPORTED_COOLDOWN_MS, cause.getMessage());
        }
    }

    private boolean isBatchSupported(String endpoint) {
        Long until = batchUnsupportedUntilMs.get(endpoint);
        return until == null || until <= System.currentTimeMillis();
    }

    static boolean isRateLimited(Exception e) {
        if (e == null || e.getMessage() == null) return false;
        String msg = e.getMessage().toLowerCase();
        return msg.contains("429") || msg.contains("too many requests")
                || msg.contains("rate limit") || msg.contains("limit exceeded")
                || msg.contains("-32005");
    }

    /**
     * True for errors worth retrying on the same request shape. Anything else on a batch request is taken
     * as the endpoint not supporting batches.
     */
    static boolean isRateLimitOrTransient(Exception e) {
        if (e == null || e.getMessage() == null) return false;
        String msg = e.getMessage().toLowerCase();
        return isRateLimited(e)
                || msg.contains("503") || msg.contains("502") || msg.contains("504")
                || msg.contains("timeout") || msg.contains("timed out")
                || msg.contains("connection refused") || msg.contains("failed to resolve")
                || msg.contains("temporary");
    }

    private static String abbreviate(String s) {
        return s.length() <= 200 ? s : s.substring(0, 200) + "...";
    }
}
