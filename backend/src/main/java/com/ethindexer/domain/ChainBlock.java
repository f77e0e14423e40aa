package com.ethindexer.domain;

import java.util.List;

/**
 * Block as returned by eth_getBlockByNumber. Transactions are empty when the block was fetched
 * without bodies (header-only lookups).
 */
public record ChainBlock(
        long number,
        String hash,
        String parentHash,
        long timestamp,
        List<ChainTransaction> transactions
) {

    public ChainBlock {
        transactions = transactions != null ? List.copyOf(transactions) : List.of();
    }

    public boolean hasTransactions() {
        return !transactions.isEmpty();
    }
}
