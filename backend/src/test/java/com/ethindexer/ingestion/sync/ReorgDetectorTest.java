package com.ethindexer.ingestion.sync;

import com.ethindexer.domain.ChainBlock;
import com.ethindexer.ingestion.config.SyncProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReorgDetectorTest {

    private SyncProperties props;
    private ReorgDetector detector;

    @BeforeEach
    void setUp() {
        props = new SyncProperties();
        detector = new ReorgDetector(props);
    }

    @Test
    void matchingParent_isNotReorg() {
        SyncContext ctx = context("0xAAAA");
        assertThat(detector.isReorg(ctx, block(101, "0xaaaa"), 200)).isFalse();
    }

    @Test
    void mismatchingParent_isReorg() {
        SyncContext ctx = context("0xaaaa");
        assertThat(detector.isReorg(ctx, block(101, "0xbbbb"), 200)).isTrue();
    }

    @Test
    void unknownLastHash_isNotReorg() {
        SyncContext ctx = context(null);
        assertThat(detector.isReorg(ctx, block(101, "0xbbbb"), 200)).isFalse();
    }

    @Test
    void boundaryOnly_checksSafeHeadBlockOnly() {
        props.setReorgCheckMode(SyncProperties.ReorgCheckMode.BOUNDARY_ONLY);
        SyncContext ctx = context("0xaaaa");

        assertThat(detector.isReorg(ctx, block(101, "0xbbbb"), 105)).isFalse();
        assertThat(detector.isReorg(ctx, block(105, "0xbbbb"), 105)).isTrue();
    }

    private static SyncContext context(String lastSeenHash) {
        SyncContext ctx = new SyncContext(0L, 100L);
        ctx.setLastSeenHash(lastSeenHash);
        return ctx;
    }

    private static ChainBlock block(long number, String parentHash) {
        return new ChainBlock(number, "0x" + number, parentHash, 0L, List.of());
    }
}
