package com.ethindexer.ingestion.decoder;

import com.ethindexer.common.HexUtils;
import com.ethindexer.domain.ChainBlock;
import com.ethindexer.domain.ChainTransaction;
import com.ethindexer.domain.EthTx;
import com.ethindexer.domain.TransactionReceipt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Optional;

/**
 * Classifies a transaction and extracts its ethtxs row. Plain value transfers and transfer(address,uint256)
 * calls are kept; zero-value calls to anything else are noise and are skipped.
 */
@Component
@Slf4j
public class TransactionDecoder {

    /** transfer(address,uint256) selector. */
    public static final String TRANSFER_SELECTOR = "a9059cbb";

    private static final int SELECTOR_HEX_LENGTH = 8;
    private static final int SLOT_HEX_LENGTH = 64;
    private static final int ADDRESS_HEX_LENGTH = 40;
    private static final int ADDRESS_PADDING_HEX_LENGTH = SLOT_HEX_LENGTH - ADDRESS_HEX_LENGTH;

    public DecodeResult decode(ChainBlock block, ChainTransaction tx, TransactionReceipt receipt) {
        if (tx.hash() == null || tx.hash().isBlank()) {
            log.error("Cannot get 'hash' item from transaction in block {}", block.number());
            return DecodeResult.skipped(SkipReason.MALFORMED, "missing hash");
        }
        boolean tokenTransfer = isTokenTransfer(tx.input());
        BigInteger value = tx.value() != null ? tx.value() : BigInteger.ZERO;
        if (value.signum() == 0 && !tokenTransfer) {
            return DecodeResult.skipped(SkipReason.ZERO_VALUE_CALL, "zero value, not a token transfer");
        }
        if (tx.from() == null || tx.from().isBlank()) {
            log.error("Cannot get 'from' item from transaction. txhash: {}", tx.hash());
            return DecodeResult.skipped(SkipReason.MALFORMED, "missing from");
        }
        if (tx.to() == null && !tx.contractCreation()) {
            log.error("Cannot get 'to' item from transaction. txhash: {}", tx.hash());
            return DecodeResult.skipped(SkipReason.MALFORMED, "missing to");
        }

        EthTx record = new EthTx();
        record.setTime(Instant.ofEpochSecond(block.timestamp()));
        record.setTxFrom(tx.from());
        record.setTxTo(tx.to());
        record.setValue(value);
        record.setGas(receipt.gasUsed());
        record.setGasPrice(resolveGasPrice(tx, receipt));
        record.setBlock(block.number());
        record.setTxHash(tx.hash());
        Optional<TokenTransferCall> transferCall = tokenTransfer ? parseTransferCall(tx.input(), tx.hash()) : Optional.empty();
        transferCall.ifPresent(call -> {
            record.setContractTo(call.recipient());
            record.setContractValue(call.rawAmount());
        });
        // Pre-Byzantium receipts carry no status; stored as false.
        record.setStatus(Boolean.TRUE.equals(receipt.status()));
        return DecodeResult.stored(record);
    }

    /**
     * Cheap pre-check used before fetching receipts: true if the transaction can produce a stored row.
     */
    public boolean isCandidate(ChainTransaction tx) {
        if (tx.value() != null && tx.value().signum() > 0) {
            return true;
        }
        return isTokenTransfer(tx.input());
    }

    /**
     * True if the calldata starts with the transfer(address,uint256) selector, whatever its length.
     */
    public static boolean isTokenTransfer(String input) {
        return input != null && hasTransferSelector(HexUtils.strip0x(input));
    }

    /**
     * Parses transfer(address,uint256) arguments from calldata. Empty if the selector does not match or the
     * input is too short to hold both argument slots; such a call is still a token transfer, stored without
     * recipient and amount.
     */
    public Optional<TokenTransferCall> parseTransferCall(String input, String txHash) {
        if (input == null) {
            return Optional.empty();
        }
        String data = HexUtils.strip0x(input);
        if (!hasTransferSelector(data)) {
            return Optional.empty();
        }
        if (data.length() < SELECTOR_HEX_LENGTH + 2 * SLOT_HEX_LENGTH) {
            log.warn("Transfer input too short to hold recipient and amount ({} hex chars). Txhash: {}",
                    data.length(), txHash);
            return Optional.empty();
        }
        int argsStart = SELECTOR_HEX_LENGTH;
        String addressSlot = data.substring(argsStart, argsStart + SLOT_HEX_LENGTH);
        String padding = addressSlot.substring(0, ADDRESS_PADDING_HEX_LENGTH);
        boolean cleanPadding = HexUtils.isAllZeros(padding);
        if (!cleanPadding) {
            log.warn("Address input part doesn't have {} leading zeros: {}. Txhash: {}",
                    ADDRESS_PADDING_HEX_LENGTH, padding, txHash);
        }
        String recipient = "0x" + addressSlot.substring(ADDRESS_PADDING_HEX_LENGTH);
        String rawAmount = data.substring(argsStart + SLOT_HEX_LENGTH, argsStart + 2 * SLOT_HEX_LENGTH);
        return Optional.of(new TokenTransferCall(recipient, rawAmount, cleanPadding));
    }

    private static boolean hasTransferSelector(String data) {
        return data.length() >= SELECTOR_HEX_LENGTH
                && data.regionMatches(true, 0, TRANSFER_SELECTOR, 0, SELECTOR_HEX_LENGTH);
    }

    private static BigInteger resolveGasPrice(ChainTransaction tx, TransactionReceipt receipt) {
        if (tx.gasPrice() != null) {
            return tx.gasPrice();
        }
        if (receipt.effectiveGasPrice() != null) {
            return receipt.effectiveGasPrice();
        }
        return BigInteger.ZERO;
    }
}
