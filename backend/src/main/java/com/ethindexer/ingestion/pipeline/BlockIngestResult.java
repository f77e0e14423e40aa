package com.ethindexer.ingestion.pipeline;

/**
 * Per-block counters reported after a block has been committed.
 */
public record BlockIngestResult(long blockNumber, int transactions, int stored, int skippedZeroValue, int skippedMalformed) {
}
