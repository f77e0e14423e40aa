package com.ethindexer.ingestion.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * JSON-RPC endpoint, per-call timeout and local throttling.
 */
@ConfigurationProperties(prefix = "ethindexer.rpc")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class RpcProperties {

    /** HTTP(S) JSON-RPC endpoints (ETH_URL). At least one is required. */
    @NotEmpty(message = "ethindexer.rpc.urls is required (set ETH_URL)")
    private List<String> urls = new ArrayList<>();

    /** Upper bound for a single JSON-RPC round trip. */
    @NotNull
    private Duration timeout = Duration.ofSeconds(30);

    /** Local RPC budget (requests per second) for this process. */
    @Min(1)
    private int maxRequestsPerSecond = 50;

    /** How long the local limiter may wait for a permit before failing the call. */
    private long localLimiterTimeoutMs = 5_000;

    public void setUrls(List<String> urls) {
        this.urls = urls == null ? new ArrayList<>() : urls.stream()
                .filter(u -> u != null && !u.isBlank())
                .map(String::trim)
                .collect(Collectors.toCollection(ArrayList::new));
    }
}
