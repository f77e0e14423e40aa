package com.ethindexer.ingestion.adapter;

import com.ethindexer.domain.ChainBlock;
import com.ethindexer.domain.TransactionReceipt;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of the chain consumed by the sync engine. Implementations retry transient failures
 * and throw {@link RpcException} once they give up.
 */
public interface ChainReader {

    /**
     * Block at the given height.
     *
     * @param includeTransactions fetch full transaction bodies; false returns a header-only block
     * @throws RpcException if the node does not have the block or the call fails
     */
    ChainBlock getBlock(long height, boolean includeTransactions);

    /**
     * @throws RpcException if the receipt is unavailable
     */
    TransactionReceipt getTransactionReceipt(String txHash);

    /**
     * Receipts for all given hashes, keyed by hash in request order.
     *
     * @throws RpcException if any receipt is unavailable
     */
    default Map<String, TransactionReceipt> getTransactionReceipts(List<String> txHashes) {
        Map<String, TransactionReceipt> receipts = new LinkedHashMap<>();
        for (String hash : txHashes) {
            receipts.put(hash, getTransactionReceipt(hash));
        }
        return receipts;
    }

    long getChainHeadHeight();

    /**
     * True while the node reports itself as syncing (eth_syncing returns an object).
     */
    boolean isSyncing();
}
