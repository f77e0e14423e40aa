package com.ethindexer.domain;

import java.math.BigInteger;

/**
 * Subset of eth_getTransactionReceipt used for storage.
 *
 * @param status null on pre-Byzantium chains that do not report a status field
 */
public record TransactionReceipt(
        String transactionHash,
        BigInteger gasUsed,
        Boolean status,
        BigInteger effectiveGasPrice
) {
}
