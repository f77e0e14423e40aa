package com.ethindexer.ingestion.pipeline;

import com.ethindexer.domain.ChainBlock;
import com.ethindexer.domain.ChainTransaction;
import com.ethindexer.domain.EthTx;
import com.ethindexer.domain.LedgerStore;
import com.ethindexer.domain.TransactionReceipt;
import com.ethindexer.ingestion.adapter.ChainReader;
import com.ethindexer.ingestion.adapter.RpcException;
import com.ethindexer.ingestion.decoder.DecodeResult;
import com.ethindexer.ingestion.decoder.SkipReason;
import com.ethindexer.ingestion.decoder.TransactionDecoder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns one fetched block into ethtxs rows: fetch receipts for candidate transactions, decode each,
 * then hand the whole set to {@link LedgerStore#writeBlock} as one unit.
 * Any RPC or store failure propagates and nothing of the block is committed.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BlockIngestor {

    private final ChainReader chainReader;
    private final TransactionDecoder transactionDecoder;
    private final LedgerStore ledgerStore;

    public BlockIngestResult ingest(ChainBlock block) {
        if (!block.hasTransactions()) {
            log.info("Block {} does not contain transactions", block.number());
            return new BlockIngestResult(block.number(), 0, 0, 0, 0);
        }

        List<ChainTransaction> candidates = block.transactions().stream()
                .filter(transactionDecoder::isCandidate)
                .toList();
        List<String> hashes = candidates.stream()
                .map(ChainTransaction::hash)
                .filter(Objects::nonNull)
                .distinct()
                .toList();
        Map<String, TransactionReceipt> receipts = hashes.isEmpty() ? Map.of() : chainReader.getTransactionReceipts(hashes);

        List<EthTx> records = new ArrayList<>(candidates.size());
        int zeroValue = block.transactions().size() - candidates.size();
        int malformed = 0;
        for (ChainTransaction tx : candidates) {
            TransactionReceipt receipt = tx.hash() == null ? null : receipts.get(tx.hash());
            if (tx.hash() != null && receipt == null) {
                throw new RpcException("Receipt missing for tx " + tx.hash() + " in block " + block.number());
            }
            DecodeResult result = transactionDecoder.decode(block, tx, receipt);
            if (result.isStored()) {
                records.add(result.record());
            } else if (result.skipReason() == SkipReason.MALFORMED) {
                malformed++;
            } else {
                zeroValue++;
            }
        }

        int inserted = ledgerStore.writeBlock(block.number(), records);
        log.info("Block {} with {} transactions is processed ({} stored)", block.number(), block.transactions().size(), inserted);
        if (malformed > 0) {
            log.warn("Block {}: {} malformed transaction(s) skipped", block.number(), malformed);
        }
        return new BlockIngestResult(block.number(), block.transactions().size(), inserted, zeroValue, malformed);
    }
}
