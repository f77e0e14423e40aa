package com.ethindexer.ingestion.sync;

import com.ethindexer.common.Sleeper;
import com.ethindexer.ingestion.adapter.ChainReader;
import com.ethindexer.ingestion.adapter.RpcException;
import com.ethindexer.ingestion.config.SyncProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Blocks until the node stops reporting itself as syncing. Indexing a half-synced node would look like
 * a chain that is far behind.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NodeReadinessGate {

    private final ChainReader chainReader;
    private final SyncProperties syncProperties;
    private final Sleeper sleeper;

    public void awaitSynced() throws InterruptedException {
        while (true) {
            try {
                if (!chainReader.isSyncing()) {
                    log.info("Ethereum node is synced.");
                    return;
                }
                log.info("Waiting Ethereum node to be in sync...");
            } catch (RpcException e) {
                log.warn("Cannot query node sync status: {}", e.getMessage());
            }
            sleeper.sleep(syncProperties.getNodeSyncBackoff());
        }
    }
}
