package com.ethindexer.ingestion.sync;

import com.ethindexer.ingestion.config.SyncProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Highest height considered final enough to index: chain head minus the confirmation depth.
 */
@Component
@RequiredArgsConstructor
public class ConfirmationPolicy {

    private final SyncProperties syncProperties;

    public long safeHead(long chainHead) {
        return safeHead(chainHead, syncProperties.getConfirmations());
    }

    public static long safeHead(long chainHead, int confirmations) {
        if (confirmations < 0) {
            throw new IllegalArgumentException("confirmations must be >= 0");
        }
        return chainHead - confirmations;
    }
}
