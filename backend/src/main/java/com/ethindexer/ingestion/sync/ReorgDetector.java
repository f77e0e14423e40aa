package com.ethindexer.ingestion.sync;

import com.ethindexer.domain.ChainBlock;
import com.ethindexer.ingestion.config.SyncProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Detects a broken parent link between the last processed block and the next fetched one.
 */
@Component
@RequiredArgsConstructor
public class ReorgDetector {

    private final SyncProperties syncProperties;

    /**
     * True if {@code block} does not extend the block recorded in the context.
     * In {@link SyncProperties.ReorgCheckMode#BOUNDARY_ONLY} mode only the safe-head block is checked.
     * An unknown last hash never reports a reorg.
     */
    public boolean isReorg(SyncContext context, ChainBlock block, long safeHead) {
        if (syncProperties.getReorgCheckMode() == SyncProperties.ReorgCheckMode.BOUNDARY_ONLY
                && block.number() != safeHead) {
            return false;
        }
        String lastSeenHash = context.getLastSeenHash();
        if (lastSeenHash == null) {
            return false;
        }
        return !lastSeenHash.equalsIgnoreCase(block.parentHash());
    }
}
