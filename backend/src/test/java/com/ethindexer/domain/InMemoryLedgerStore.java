package com.ethindexer.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.OptionalLong;
import java.util.TreeMap;

/**
 * Ledger backed by a sorted map. Mirrors the JDBC store: blocks with no rows are not remembered.
 */
public class InMemoryLedgerStore implements LedgerStore {

    private final NavigableMap<Long, List<EthTx>> rowsByBlock = new TreeMap<>();
    private final List<Long> writes = new ArrayList<>();
    private Long failOnBlock;

    @Override
    public synchronized OptionalLong findMaxBlock() {
        return rowsByBlock.isEmpty() ? OptionalLong.empty() : OptionalLong.of(rowsByBlock.lastKey());
    }

    @Override
    public synchronized int writeBlock(long blockNumber, List<EthTx> records) {
        if (failOnBlock != null && failOnBlock == blockNumber) {
            failOnBlock = null;
            throw new IllegalStateException("Simulated store failure at block " + blockNumber);
        }
        writes.add(blockNumber);
        rowsByBlock.remove(blockNumber);
        if (!records.isEmpty()) {
            rowsByBlock.put(blockNumber, List.copyOf(records));
        }
        return records.size();
    }

    @Override
    public synchronized int trimTail() {
        if (rowsByBlock.isEmpty()) {
            return 0;
        }
        return rowsByBlock.pollLastEntry().getValue().size();
    }

    @Override
    public synchronized int deleteRange(long beginExclusive, long endInclusive) {
        if (endInclusive <= beginExclusive) {
            return 0;
        }
        Map<Long, List<EthTx>> range = rowsByBlock.subMap(beginExclusive, false, endInclusive, true);
        int deleted = range.values().stream().mapToInt(List::size).sum();
        range.clear();
        return deleted;
    }

    public synchronized List<EthTx> findByBlock(long blockNumber) {
        return rowsByBlock.getOrDefault(blockNumber, List.of());
    }

    public synchronized void put(long blockNumber, EthTx... records) {
        rowsByBlock.put(blockNumber, List.of(records));
    }

    public synchronized NavigableMap<Long, List<EthTx>> snapshot() {
        return new TreeMap<>(rowsByBlock);
    }

    public synchronized List<Long> getWrites() {
        return new ArrayList<>(writes);
    }

    public synchronized void failOnceAtBlock(long blockNumber) {
        this.failOnBlock = blockNumber;
    }
}
