package com.ethindexer.ingestion.job;

import com.ethindexer.config.AsyncConfig;
import com.ethindexer.ingestion.config.SyncProperties;
import com.ethindexer.ingestion.sync.SyncEngine;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Starts the sync engine on its dedicated thread once the context is ready, and stops it on shutdown.
 * An engine that dies with an unexpected error takes the application down with a non-zero exit code.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SyncEngineRunner {

    private final AtomicBoolean started = new AtomicBoolean(false);

    private final SyncEngine syncEngine;
    private final SyncProperties syncProperties;
    private final ConfigurableApplicationContext applicationContext;
    @Qualifier(AsyncConfig.SYNC_EXECUTOR)
    private final Executor syncExecutor;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!syncProperties.isAutoStart()) {
            log.info("Sync engine auto-start disabled");
            return;
        }
        start();
    }

    void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        log.info("Starting sync engine from start block {} (confirmations={}, reorg depth={})",
                syncProperties.getStartBlock(), syncProperties.getConfirmations(), syncProperties.getReorgDepth());
        syncExecutor.execute(this::runEngine);
    }

    void runEngine() {
        try {
            syncEngine.run();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Sync engine interrupted");
        } catch (RuntimeException e) {
            log.error("Sync engine failed: {}", e.getMessage(), e);
            exitWithFailure();
        }
    }

    void exitWithFailure() {
        System.exit(SpringApplication.exit(applicationContext, () -> 1));
    }

    @PreDestroy
    public void shutdown() {
        if (started.get()) {
            log.info("Stopping sync engine");
            syncEngine.stop();
        }
    }
}
