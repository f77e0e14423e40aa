package com.ethindexer.ingestion.sync;

import com.ethindexer.domain.ChainBlock;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Mutable cursor state owned by one engine run. {@code lastSeenHash} is the hash of block {@code lastIndexed}
 * as observed by this run, or null when it has to be looked up again (fresh start, after a rollback).
 */
@Getter
@ToString
public class SyncContext {

    /** Lowest height the cursor may be rewound to. */
    private final long floorBlock;
    private long lastIndexed;
    @Setter
    private String lastSeenHash;
    @Setter
    private SyncState state = SyncState.CATCH_UP;
    private int consecutiveFailures;
    private long reorgCount;

    public SyncContext(long floorBlock, long lastIndexed) {
        this.floorBlock = floorBlock;
        this.lastIndexed = lastIndexed;
    }

    void advance(ChainBlock block) {
        if (block.number() != lastIndexed + 1) {
            throw new IllegalStateException("Cursor at " + lastIndexed + " cannot advance to block " + block.number());
        }
        lastIndexed = block.number();
        lastSeenHash = block.hash();
    }

    void rewindTo(long height) {
        lastIndexed = height;
        lastSeenHash = null;
        reorgCount++;
    }

    int recordFailure() {
        return ++consecutiveFailures;
    }

    void recordSuccess() {
        consecutiveFailures = 0;
    }
}
