package com.ethindexer.ingestion.decoder;

import com.ethindexer.domain.EthTx;

/**
 * Outcome of decoding one transaction: either a record to store or a skip with its reason.
 */
public record DecodeResult(EthTx record, SkipReason skipReason, String detail) {

    public static DecodeResult stored(EthTx record) {
        return new DecodeResult(record, null, null);
    }

    public static DecodeResult skipped(SkipReason reason, String detail) {
        return new DecodeResult(null, reason, detail);
    }

    public boolean isStored() {
        return record != null;
    }
}
