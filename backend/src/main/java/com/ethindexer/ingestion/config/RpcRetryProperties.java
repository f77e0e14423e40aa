package com.ethindexer.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * RPC retry policy (exponential backoff ± jitter). Documented in application.yml.
 */
@ConfigurationProperties(prefix = "ethindexer.rpc.retry")
@NoArgsConstructor
@Getter
@Setter
public class RpcRetryProperties {

    /** Base delay in ms for first retry; doubles each attempt. Default 1000. */
    private long baseDelayMs = 1000L;

    /** Jitter factor 0..1 (e.g. 0.2 = ±20%). Default 0.2. */
    private double jitterFactor = 0.2;

    /** Attempts per call including the first one. Default 5. */
    private int maxAttempts = 5;

    /** Ceiling for a single backoff delay. */
    private long maxDelayMs = 60_000L;
}
