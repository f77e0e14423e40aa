package com.ethindexer.domain;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.OptionalLong;

/**
 * JdbcTemplate-backed ledger on PostgreSQL. Inserts are idempotent on txhash.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class JdbcLedgerStore implements LedgerStore {

    private static final String INSERT_SQL = """
            INSERT INTO ethtxs (time, txfrom, txto, value, gas, gasprice, block, txhash, contract_to, contract_value, status)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (txhash) DO NOTHING
            """;

    private final JdbcTemplate jdbcTemplate;

    @Override
    public OptionalLong findMaxBlock() {
        Long max = jdbcTemplate.queryForObject("SELECT max(block) FROM ethtxs", Long.class);
        return max != null ? OptionalLong.of(max) : OptionalLong.empty();
    }

    @Override
    @Transactional
    public int writeBlock(long blockNumber, List<EthTx> records) {
        int replaced = jdbcTemplate.update("DELETE FROM ethtxs WHERE block = ?", blockNumber);
        if (replaced > 0) {
            log.debug("Replacing {} existing row(s) of block {}", replaced, blockNumber);
        }
        if (records.isEmpty()) {
            return 0;
        }
        for (EthTx tx : records) {
            if (tx.getBlock() != blockNumber) {
                throw new IllegalArgumentException("Record " + tx.getTxHash() + " belongs to block "
                        + tx.getBlock() + ", not " + blockNumber);
            }
        }
        int[][] counts = jdbcTemplate.batchUpdate(INSERT_SQL, records, records.size(), (ps, tx) -> {
            ps.setObject(1, toUtcDateTime(tx.getTime()), Types.TIMESTAMP);
            ps.setString(2, tx.getTxFrom());
            ps.setString(3, tx.getTxTo());
            ps.setBigDecimal(4, toDecimal(tx.getValue()));
            ps.setBigDecimal(5, toDecimal(tx.getGas()));
            ps.setBigDecimal(6, toDecimal(tx.getGasPrice()));
            ps.setLong(7, tx.getBlock());
            ps.setString(8, tx.getTxHash());
            ps.setString(9, tx.getContractTo());
            ps.setString(10, tx.getContractValue());
            ps.setBoolean(11, tx.isStatus());
        });
        int inserted = 0;
        for (int[] batch : counts) {
            for (int c : batch) {
                inserted += Math.max(c, 0);
            }
        }
        if (inserted < records.size()) {
            log.warn("Block {}: {} of {} transaction(s) already stored under another block, kept existing rows",
                    blockNumber, records.size() - inserted, records.size());
        }
        return inserted;
    }

    @Override
    @Transactional
    public int trimTail() {
        return jdbcTemplate.update("DELETE FROM ethtxs WHERE block = (SELECT max(block) FROM ethtxs)");
    }

    @Override
    @Transactional
    public int deleteRange(long beginExclusive, long endInclusive) {
        if (endInclusive <= beginExclusive) {
            return 0;
        }
        return jdbcTemplate.update("DELETE FROM ethtxs WHERE block > ? AND block <= ?", beginExclusive, endInclusive);
    }

    /** The time column has no zone; it always holds UTC wall-clock time, whatever the JVM zone. */
    private static LocalDateTime toUtcDateTime(Instant time) {
        return time != null ? LocalDateTime.ofInstant(time, ZoneOffset.UTC) : null;
    }

    private static BigDecimal toDecimal(BigInteger value) {
        return value != null ? new BigDecimal(value) : null;
    }
}
