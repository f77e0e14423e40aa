package com.ethindexer.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.math.BigInteger;
import java.time.Instant;

/**
 * One row of the ethtxs table. Created once per qualifying transaction and never updated;
 * removed only by rollback or the startup tail-trim.
 */
@NoArgsConstructor
@Getter
@Setter
@ToString
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class EthTx {

    private Instant time;
    private String txFrom;
    /** Null for contract creation. */
    private String txTo;
    private BigInteger value;
    /** Gas used, from the receipt. */
    private BigInteger gas;
    private BigInteger gasPrice;
    private long block;
    @EqualsAndHashCode.Include
    private String txHash;
    /** Token recipient for transfer(address,uint256) calls; empty otherwise. */
    private String contractTo = "";
    /** Raw 32-byte hex amount for transfer(address,uint256) calls; empty otherwise. */
    private String contractValue = "";
    private boolean status;
}
