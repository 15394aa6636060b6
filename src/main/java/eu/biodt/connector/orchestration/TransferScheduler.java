package eu.biodt.connector.orchestration;

import eu.biodt.connector.config.ConnectorConfig;
import eu.biodt.connector.domain.RunRecord;
import eu.biodt.connector.domain.RunSummary;
import eu.biodt.connector.domain.WorkflowRun;
import eu.biodt.connector.source.RunNotFoundException;
import eu.biodt.connector.source.SourceUnavailableException;
import eu.biodt.connector.tracker.RunTracker;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs transfers on a fixed worker pool so notifications return immediately.
 * Each submitted run moves through the tracker as pending → in progress → completed or failed.
 */
@ApplicationScoped
public class TransferScheduler {

    private static final Logger LOG = Logger.getLogger(TransferScheduler.class);
    private static final long SHUTDOWN_GRACE_SECONDS = 30;

    private final TransferOrchestrator orchestrator;
    private final RunTracker tracker;
    private final ExecutorService executor;

    @Inject
    public TransferScheduler(TransferOrchestrator orchestrator, RunTracker tracker, ConnectorConfig config) {
        this(orchestrator, tracker, Executors.newFixedThreadPool(config.transfer().workers(), workerThreads()));
    }

    TransferScheduler(TransferOrchestrator orchestrator, RunTracker tracker, ExecutorService executor) {
        this.orchestrator = orchestrator;
        this.tracker = tracker;
        this.executor = executor;
    }

    /**
     * Queue the transfer of a freshly registered run.
     *
     * @throws RejectedExecutionException when the pool is shutting down; the run is then
     *                                    marked failed so it does not stay pending
     */
    public Future<?> submit(RunRecord registration) {
        WorkflowRun run = registration.run();
        long attempt = registration.attempt();
        LOG.debugf("Scheduling transfer for run %s (attempt %d)", run.id(), attempt);
        try {
            return executor.submit(() -> execute(run, attempt));
        } catch (RejectedExecutionException e) {
            LOG.errorf("Cannot schedule transfer for run %s: worker pool is shut down", run.id());
            tracker.markFailed(run, attempt, "Transfer not scheduled: connector is shutting down");
            throw e;
        }
    }

    void execute(WorkflowRun run, long attempt) {
        tracker.markInProgress(run, attempt);
        try {
            RunSummary summary = orchestrator.run(run);
            tracker.markCompleted(run, attempt, summary);
        } catch (RunNotFoundException e) {
            LOG.errorf("Transfer for run %s failed: %s", run.id(), e.getMessage());
            tracker.markFailed(run, attempt, e.getMessage());
        } catch (SourceUnavailableException e) {
            LOG.errorf(e, "Transfer for run %s failed: %s", run.id(), e.getMessage());
            tracker.markFailed(run, attempt, e.getMessage());
        } catch (RuntimeException e) {
            LOG.errorf(e, "Unexpected failure in transfer for run %s", run.id());
            tracker.markFailed(run, attempt, e.toString());
        }
    }

    @PreDestroy
    void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                LOG.warnf("Transfers still running after %d seconds, interrupting", SHUTDOWN_GRACE_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "transfer-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
