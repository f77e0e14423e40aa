package com.ethindexer.ingestion.sync;

/**
 * States of the sync engine loop. There is no terminal state.
 */
public enum SyncState {
    /** Fetch and persist blocks from the cursor up to the safe head. */
    CATCH_UP,
    /** Parent-hash mismatch seen; delete the rollback window and rewind the cursor. */
    REORG_RECOVERY,
    /** Nothing new or the last cycle failed; sleep one polling period. */
    IDLE_WAIT
}
