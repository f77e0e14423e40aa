package com.ethindexer.ingestion.decoder;

/**
 * Arguments of a transfer(address,uint256) call.
 *
 * @param recipient     0x-prefixed 40 hex char address taken from the low bytes of the first slot
 * @param rawAmount     64 hex chars of the second slot, without 0x
 * @param cleanPadding  whether the 12 high bytes of the first slot were zero
 */
public record TokenTransferCall(String recipient, String rawAmount, boolean cleanPadding) {
}
