package com.ethindexer.ingestion.adapter.evm;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * EVM JSON-RPC transport. Retries, timeouts and endpoint rotation are handled by {@link EvmChainReader}.
 */
public interface EvmRpcClient {

    /**
     * Perform a single JSON-RPC call.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_getBlockByNumber"
     * @param params      positional params
     * @return response body as string (JSON); errors on HTTP failure
     */
    Mono<String> call(String endpointUrl, String method, Object params);

    /**
     * JSON-RPC batch call: several requests in one HTTP request. Request ids are 1-based positions.
     *
     * @return response body as string (JSON array); errors on HTTP failure
     */
    Mono<String> batchCall(String endpointUrl, List<RpcRequest> requests);
}
