package com.ethindexer.ingestion.decoder;

/**
 * Why a transaction was not persisted.
 */
public enum SkipReason {
    /** Zero native value and not a transfer(address,uint256) call. */
    ZERO_VALUE_CALL,
    /** Missing hash, from, or to (when not a contract creation). */
    MALFORMED
}
