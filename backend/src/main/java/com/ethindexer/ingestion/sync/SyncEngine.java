package com.ethindexer.ingestion.sync;

import com.ethindexer.common.Sleeper;
import com.ethindexer.domain.ChainBlock;
import com.ethindexer.domain.LedgerStore;
import com.ethindexer.ingestion.adapter.ChainReader;
import com.ethindexer.ingestion.adapter.RpcException;
import com.ethindexer.ingestion.config.SyncProperties;
import com.ethindexer.ingestion.pipeline.BlockIngestResult;
import com.ethindexer.ingestion.pipeline.BlockIngestor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.OptionalLong;

/**
 * Single-writer indexing loop. Walks the chain from the stored cursor to the safe head one block at a time,
 * rolls back a fixed window when a parent-hash mismatch shows the local tip was orphaned, and sleeps when
 * caught up or after a failed cycle. A block is either committed with all its rows or not at all, so the
 * cursor derived from the store on restart is always consistent.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SyncEngine {

    private final ChainReader chainReader;
    private final LedgerStore ledgerStore;
    private final ConfirmationPolicy confirmationPolicy;
    private final ReorgDetector reorgDetector;
    private final BlockIngestor blockIngestor;
    private final NodeReadinessGate nodeReadinessGate;
    private final SyncProperties syncProperties;
    private final Sleeper sleeper;

    private volatile boolean running;
    private volatile boolean stopRequested;

    /**
     * Waits for the node, restores the cursor and loops until {@link #stop()} or interruption.
     */
    public void run() throws InterruptedException {
        running = true;
        stopRequested = false;
        try {
            nodeReadinessGate.awaitSynced();
            SyncContext context = initialize();
            while (!stopRequested && !Thread.currentThread().isInterrupted()) {
                step(context);
            }
            log.info("Sync engine stopped at block {}", context.getLastIndexed());
        } finally {
            running = false;
        }
    }

    public void stop() {
        stopRequested = true;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Startup recovery: drops the highest stored block (possibly written by an interrupted run), optionally
     * rewinds a few more blocks, and derives the cursor from what is left.
     */
    public SyncContext initialize() {
        long startBlock = syncProperties.getStartBlock();
        int trimmed = ledgerStore.trimTail();
        if (trimmed > 0) {
            log.info("Removed {} row(s) of the last stored block before resuming", trimmed);
        }
        OptionalLong maxBlock = ledgerStore.findMaxBlock();
        long lastIndexed = maxBlock.isPresent() ? maxBlock.getAsLong() : startBlock;
        long floor = Math.min(startBlock, lastIndexed);

        int reverify = syncProperties.getStartupReverifyBlocks();
        if (maxBlock.isPresent() && reverify > 0) {
            long rewound = Math.max(floor, lastIndexed - reverify);
            int deleted = ledgerStore.deleteRange(rewound, lastIndexed);
            log.info("Deleted blocks {} to {} for re-verification ({} rows)", rewound + 1, lastIndexed, deleted);
            lastIndexed = rewound;
        }

        SyncContext context = new SyncContext(floor, lastIndexed);
        context.setState(SyncState.CATCH_UP);
        log.info("Sync cursor initialised at block {}", lastIndexed);
        return context;
    }

    /**
     * Executes one state of the loop.
     *
     * @throws InterruptedException if interrupted while waiting in {@link SyncState#IDLE_WAIT}
     */
    public void step(SyncContext context) throws InterruptedException {
        switch (context.getState()) {
            case CATCH_UP -> catchUp(context);
            case REORG_RECOVERY -> recoverFromReorg(context);
            case IDLE_WAIT -> idle(context);
        }
    }

    private void catchUp(SyncContext context) {
        CycleTotals totals = new CycleTotals();
        try {
            long head = chainReader.getChainHeadHeight();
            long safeHead = confirmationPolicy.safeHead(head);
            log.info("Current best block in index: {}; in chain: {}", context.getLastIndexed(), head);

            for (long height = context.getLastIndexed() + 1; height <= safeHead; height++) {
                if (stopRequested || Thread.currentThread().isInterrupted()) {
                    return;
                }
                ensureLastSeenHash(context);
                ChainBlock block = chainReader.getBlock(height, true);
                if (block.number() != height) {
                    throw new RpcException("Requested block " + height + " but node returned " + block.number());
                }
                if (reorgDetector.isReorg(context, block, safeHead)) {
                    log.warn("Reorganisation! Block {} parent {} does not match hash {} of block {}",
                            height, block.parentHash(), context.getLastSeenHash(), context.getLastIndexed());
                    context.setState(SyncState.REORG_RECOVERY);
                    return;
                }
                totals.add(blockIngestor.ingest(block));
                context.advance(block);
            }
            context.recordSuccess();
            context.setState(SyncState.IDLE_WAIT);
        } catch (RuntimeException e) {
            onCycleFailure(context, e);
        } finally {
            if (totals.blocks > 0) {
                log.info("Cycle indexed {} block(s) up to {}: {} stored, {} zero-value skipped, {} malformed skipped",
                        totals.blocks, context.getLastIndexed(), totals.stored, totals.skippedZeroValue,
                        totals.skippedMalformed);
            }
        }
    }

    private void recoverFromReorg(SyncContext context) {
        long end = context.getLastIndexed();
        long rewound = Math.max(context.getFloorBlock(), end - syncProperties.getReorgDepth());
        try {
            int deleted = ledgerStore.deleteRange(rewound, end);
            context.rewindTo(rewound);
            log.info("Deleted blocks {} to {} ({} rows), reorganisation #{} in this run",
                    rewound + 1, end, deleted, context.getReorgCount());
            context.setState(SyncState.CATCH_UP);
        } catch (RuntimeException e) {
            // Hash is kept, so the next cycle detects the same reorg again.
            onCycleFailure(context, e);
        }
    }

    private void idle(SyncContext context) throws InterruptedException {
        sleeper.sleep(syncProperties.getPollingPeriod());
        context.setState(SyncState.CATCH_UP);
    }

    private void ensureLastSeenHash(SyncContext context) {
        if (context.getLastSeenHash() == null) {
            ChainBlock header = chainReader.getBlock(context.getLastIndexed(), false);
            context.setLastSeenHash(header.hash());
            log.debug("Last seen hash of block {} loaded: {}", header.number(), header.hash());
        }
    }

    private void onCycleFailure(SyncContext context, RuntimeException e) {
        int failures = context.recordFailure();
        log.warn("Sync cycle failed at block {} (attempt {}): {}", context.getLastIndexed() + 1, failures, e.getMessage());
        if (failures >= syncProperties.getDegradedAfterFailures()) {
            log.error("Sync engine degraded: {} consecutive failed cycles, still at block {}",
                    failures, context.getLastIndexed(), e);
        }
        context.setState(SyncState.IDLE_WAIT);
    }

    private static final class CycleTotals {
        private int blocks;
        private int stored;
        private int skippedZeroValue;
        private int skippedMalformed;

        void add(BlockIngestResult result) {
            blocks++;
            stored += result.stored();
            skippedZeroValue += result.skippedZeroValue();
            skippedMalformed += result.skippedMalformed();
        }
    }
}
