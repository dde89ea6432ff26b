package com.pgost.migration.replay;

import com.pgost.migration.exception.MigrationAbortedException;
import com.pgost.migration.infrastructure.database.DatabaseSession;
import com.pgost.migration.orchestration.MigrationContext;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Background worker that keeps the shadow table caught up with the change log.
 * Runs on its own session until stopped, aborted or failed; a failure is kept for the orchestrator to pick up.
 */
@Slf4j
public class ReplayLoop implements Runnable {
    
    private final ReplayEngine engine;
    private final DatabaseSession session;
    private final MigrationContext context;
    private final long pollIntervalMs;
    private final CountDownLatch finished = new CountDownLatch(1);
    
    private volatile boolean running = true;
    private volatile RuntimeException failure;
    
    public ReplayLoop(ReplayEngine engine, DatabaseSession session, MigrationContext context, long pollIntervalMs) {
        this.engine = engine;
        this.session = session;
        this.context = context;
        this.pollIntervalMs = pollIntervalMs;
    }
    
    @Override
    public void run() {
        log.info("[Migration-{}] Replay loop started", context.getRunId());
        try {
            while (running && !context.isAbortRequested()) {
                int applied = engine.applyBatch(session, context);
                if (applied == 0) {
                    Thread.sleep(pollIntervalMs);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("[Migration-{}] Replay loop interrupted", context.getRunId());
        } catch (MigrationAbortedException e) {
            log.info("[Migration-{}] Replay loop gave up on abort: {}", context.getRunId(), e.getMessage());
        } catch (RuntimeException e) {
            failure = e;
            log.error("[Migration-{}] Replay loop failed: {}", context.getRunId(), e.getMessage(), e);
        } finally {
            session.close();
            finished.countDown();
            log.info("[Migration-{}] Replay loop stopped (watermark {}, {} change(s) applied)",
                    context.getRunId(), context.getReplayWatermark(), context.getChangesApplied());
        }
    }
    
    public void stop() {
        running = false;
    }
    
    /**
     * Stop the loop and wait for the batch in flight to finish.
     *
     * @return false when the loop did not stop within the timeout
     */
    public boolean stopAndAwait(long timeoutMs) throws InterruptedException {
        stop();
        return finished.await(timeoutMs, TimeUnit.MILLISECONDS);
    }
    
    public boolean isFinished() {
        return finished.getCount() == 0;
    }
    
    /**
     * The error that ended the loop, or null.
     */
    public RuntimeException getFailure() {
        return failure;
    }
}
