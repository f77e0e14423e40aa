package com.ethindexer.domain;

import java.math.BigInteger;

/**
 * Raw transaction body from a block. {@code from}/{@code to} are null when the node omitted the field;
 * {@code contractCreation} is true only when {@code to} was explicitly null.
 */
public record ChainTransaction(
        String hash,
        String from,
        String to,
        boolean contractCreation,
        BigInteger value,
        BigInteger gasPrice,
        String input,
        long blockNumber
) {
}
