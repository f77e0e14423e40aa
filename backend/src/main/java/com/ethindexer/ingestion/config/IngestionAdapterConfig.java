package com.ethindexer.ingestion.config;

import com.ethindexer.common.RetryPolicy;
import com.ethindexer.common.Sleeper;
import com.ethindexer.ingestion.adapter.RpcEndpointRotator;
import com.ethindexer.ingestion.adapter.evm.EvmRpcClient;
import com.ethindexer.ingestion.adapter.evm.WebClientEvmRpcClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * RPC client, endpoint rotation and local rate limiting for the chain reader.
 */
@Configuration
@EnableConfigurationProperties({ RpcProperties.class, RpcRetryProperties.class, SyncProperties.class, DatabaseProperties.class })
public class IngestionAdapterConfig {

    @Bean
    public RetryPolicy rpcRetryPolicy(RpcRetryProperties retryProperties) {
        return new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getJitterFactor(),
                retryProperties.getMaxAttempts(),
                retryProperties.getMaxDelayMs());
    }

    @Bean
    public RpcEndpointRotator evmRpcEndpointRotator(RpcProperties rpcProperties, RetryPolicy rpcRetryPolicy) {
        return new RpcEndpointRotator(rpcProperties.getUrls(), rpcRetryPolicy);
    }

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientEvmRpcClient(webClientBuilder);
    }

    @Bean(name = "evmRpcRateLimiter")
    public RateLimiter evmRpcRateLimiter(RpcProperties rpcProperties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, rpcProperties.getMaxRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, rpcProperties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("evm-rpc", config);
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleeper();
    }
}
