package com.ethindexer.ingestion.adapter.evm;

import com.ethindexer.ingestion.adapter.RpcException;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * EVM JSON-RPC client over HTTP using WebClient.
 */
public class WebClientEvmRpcClient implements EvmRpcClient {

    private static final int MAX_RESPONSE_BYTES = 64 * 1024 * 1024;

    private final WebClient webClient;

    public WebClientEvmRpcClient(WebClient.Builder builder) {
        this.webClient = builder
                .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES))
                .build();
    }

    @Override
    public Mono<String> call(String endpointUrl, String method, Object params) {
        return post(endpointUrl, envelope(1, method, params));
    }

    @Override
    public Mono<String> batchCall(String endpointUrl, List<RpcRequest> requests) {
        List<Map<String, Object>> batch = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            RpcRequest req = requests.get(i);
            batch.add(envelope(i + 1, req.method(), req.params()));
        }
        return post(endpointUrl, batch);
    }

    private Mono<String> post(String endpointUrl, Object body) {
        return webClient.post()
                .uri(endpointUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .onErrorMap(WebClientResponseException.class, e -> new RpcException(e.getMessage(), e))
                .onErrorMap(WebClientRequestException.class, e -> new RpcException(e.getMessage(), e));
    }

    private static Map<String, Object> envelope(int id, String method, Object params) {
        return Map.of(
                "jsonrpc", "2.0",
                "id", id,
                "method", method,
                "params", params != null ? params : new Object[]{}
        );
    }
}
