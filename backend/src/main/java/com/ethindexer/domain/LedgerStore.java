package com.ethindexer.domain;

import java.util.List;
import java.util.OptionalLong;

/**
 * Block-scoped persistence for ethtxs. Every mutating operation is atomic.
 */
public interface LedgerStore {

    /**
     * Highest block with at least one stored row.
     */
    OptionalLong findMaxBlock();

    /**
     * Replaces all rows of one block with the given records in a single transaction.
     * A failure leaves the previously committed state of the block untouched.
     *
     * @return number of rows inserted
     */
    int writeBlock(long blockNumber, List<EthTx> records);

    /**
     * Deletes the rows of the highest stored block, which a previous run may have written only partially.
     *
     * @return number of rows deleted
     */
    int trimTail();

    /**
     * Deletes rows with {@code beginExclusive < block <= endInclusive}.
     *
     * @return number of rows deleted
     */
    int deleteRange(long beginExclusive, long endInclusive);
}
