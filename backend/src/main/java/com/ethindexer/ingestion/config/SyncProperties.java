package com.ethindexer.ingestion.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Sync engine settings: where to start, how far behind the head to stay, how deep to roll back.
 */
@ConfigurationProperties(prefix = "ethindexer.sync")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class SyncProperties {

    /** Start the engine thread once the application is ready. Tests switch this off. */
    private boolean autoStart = true;

    /** Cursor used when ethtxs is empty; indexing starts at startBlock + 1 (START_BLOCK). */
    @Min(0)
    private long startBlock = 1;

    /** Blocks withheld behind the chain head (CONFIRMATIONS_BLOCK). */
    @Min(0)
    private int confirmations = 0;

    /** Blocks deleted and re-fetched when a reorg is detected (REORG_BLOCKS). */
    @Min(1)
    private int reorgDepth = 10;

    /** Pause between cycles once the cursor has reached the safe head (PERIOD, seconds). */
    @NotNull
    private Duration pollingPeriod = Duration.ofSeconds(20);

    /** Pause between eth_syncing checks while the node is still syncing. */
    @NotNull
    private Duration nodeSyncBackoff = Duration.ofMinutes(5);

    @NotNull
    private ReorgCheckMode reorgCheckMode = ReorgCheckMode.EVERY_BLOCK;

    /** Extra blocks below the stored maximum to delete and re-index at startup. 0 = tail-trim only. */
    @Min(0)
    private int startupReverifyBlocks = 0;

    /** Consecutive failed cycles after which the engine reports itself degraded. */
    @Min(1)
    private int degradedAfterFailures = 5;

    public enum ReorgCheckMode {
        /** Compare every fetched block's parent hash with the previous block's hash. */
        EVERY_BLOCK,
        /** Compare only at the safe-head block of each cycle. */
        BOUNDARY_ONLY
    }
}
