package com.ethindexer.ingestion.adapter;

import com.ethindexer.domain.ChainBlock;
import com.ethindexer.domain.ChainTransaction;
import com.ethindexer.domain.TransactionReceipt;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Scriptable in-memory chain. Each block at height h carries one value transfer with hash derived from
 * the block hash, so re-indexing a replaced branch produces different rows.
 */
public class FakeChainReader implements ChainReader {

    private final Map<Long, ChainBlock> blocks = new HashMap<>();
    private final Map<String, TransactionReceipt> receipts = new HashMap<>();
    private final List<Long> fullFetches = new ArrayList<>();
    private final Deque<Boolean> syncingAnswers = new ArrayDeque<>();
    private long head;
    private int headFailures;
    private int blockFailures;
    private int syncingFailures;

    /** Builds blocks {@code from..to} on the given branch, linked to the block below {@code from} if present. */
    public FakeChainReader extend(long from, long to, String branch) {
        for (long h = from; h <= to; h++) {
            ChainBlock parent = blocks.get(h - 1);
            String parentHash = parent != null ? parent.hash() : hash(h - 1, "genesis");
            String hash = hash(h, branch);
            String txHash = "0x" + Long.toHexString(h) + "-tx-" + branch;
            ChainTransaction tx = new ChainTransaction(txHash, "0xsender", "0xreceiver", false,
                    BigInteger.valueOf(h), BigInteger.ONE, "0x", h);
            blocks.put(h, new ChainBlock(h, hash, parentHash, 1_600_000_000L + h, List.of(tx)));
            receipts.put(txHash, new TransactionReceipt(txHash, BigInteger.valueOf(21_000), true, null));
        }
        head = Math.max(head, to);
        return this;
    }

    public FakeChainReader putBlock(ChainBlock block) {
        blocks.put(block.number(), block);
        head = Math.max(head, block.number());
        return this;
    }

    public FakeChainReader putReceipt(TransactionReceipt receipt) {
        receipts.put(receipt.transactionHash(), receipt);
        return this;
    }

    public static String hash(long height, String branch) {
        return "0x" + Long.toHexString(height) + "-" + branch;
    }

    @Override
    public ChainBlock getBlock(long height, boolean includeTransactions) {
        if (blockFailures > 0) {
            blockFailures--;
            throw new RpcException("Simulated failure fetching block " + height);
        }
        if (height > head) {
            throw new RpcException("Block " + height + " above head " + head);
        }
        ChainBlock block = blocks.get(height);
        if (block == null) {
            block = new ChainBlock(height, hash(height, "genesis"), hash(height - 1, "genesis"), 0L, List.of());
        }
        if (!includeTransactions) {
            return new ChainBlock(block.number(), block.hash(), block.parentHash(), block.timestamp(), List.of());
        }
        fullFetches.add(height);
        return block;
    }

    @Override
    public TransactionReceipt getTransactionReceipt(String txHash) {
        TransactionReceipt receipt = receipts.get(txHash);
        if (receipt == null) {
            throw new RpcException("Receipt not available for " + txHash);
        }
        return receipt;
    }

    @Override
    public long getChainHeadHeight() {
        if (headFailures > 0) {
            headFailures--;
            throw new RpcException("Simulated eth_blockNumber failure");
        }
        return head;
    }

    @Override
    public boolean isSyncing() {
        if (syncingFailures > 0) {
            syncingFailures--;
            throw new RpcException("Simulated eth_syncing failure");
        }
        Boolean answer = syncingAnswers.poll();
        return answer != null && answer;
    }

    public void setHead(long head) {
        this.head = head;
    }

    public void failNextHeadCalls(int times) {
        this.headFailures = times;
    }

    public void failNextBlockFetches(int times) {
        this.blockFailures = times;
    }

    public void failNextSyncingCalls(int times) {
        this.syncingFailures = times;
    }

    public void answerSyncing(Boolean... answers) {
        syncingAnswers.addAll(List.of(answers));
    }

    public List<Long> getFullFetches() {
        return fullFetches;
    }

    public void clearFetches() {
        fullFetches.clear();
    }
}
