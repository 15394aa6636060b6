package eu.biodt.connector.tracker;

import eu.biodt.connector.config.ConnectorConfig;
import eu.biodt.connector.domain.RunRecord;
import eu.biodt.connector.domain.RunRecord.RunState;
import eu.biodt.connector.domain.RunSummary;
import eu.biodt.connector.domain.WorkflowRun;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * In-memory run tracker.
 * Not persistent - state is lost on restart. Keeps at most {@code maxRuns} records; the oldest
 * finished runs are evicted first, pending and in-progress runs are never evicted.
 */
@ApplicationScoped
public class InMemoryRunTracker implements RunTracker {

    private static final Logger LOG = Logger.getLogger(InMemoryRunTracker.class);

    private final Map<String, RunRecord> runsById = new ConcurrentHashMap<>();
    private final int maxRuns;

    @Inject
    public InMemoryRunTracker(ConnectorConfig config) {
        this(config.tracker().maxRuns());
    }

    public InMemoryRunTracker(int maxRuns) {
        if (maxRuns < 1) {
            throw new IllegalArgumentException("maxRuns must be positive");
        }
        this.maxRuns = maxRuns;
    }

    @Override
    public Optional<RunRecord> register(WorkflowRun run, boolean allowExisting) {
        RunRecord[] fresh = new RunRecord[1];
        RunRecord stored = runsById.compute(run.id(), (id, existing) -> {
            if (existing != null && !allowExisting && existing.state() != RunState.FAILED) {
                return existing;
            }
            fresh[0] = RunRecord.pending(run, existing != null ? existing.attempt() + 1 : 1);
            return fresh[0];
        });

        if (stored != fresh[0]) {
            LOG.debugf("Run %s already tracked as %s", run.id(), stored.state());
            return Optional.empty();
        }
        LOG.debugf("Registered run %s (attempt %d)", run.id(), stored.attempt());
        evictFinished();
        return Optional.of(stored);
    }

    @Override
    public Optional<RunRecord> find(WorkflowRun run) {
        return Optional.ofNullable(runsById.get(run.id()));
    }

    @Override
    public List<RunRecord> findAll() {
        return runsById.values().stream()
                .sorted(Comparator.comparing(RunRecord::notifiedAt))
                .toList();
    }

    @Override
    public void markInProgress(WorkflowRun run, long attempt) {
        update(run, attempt, RunRecord::inProgress);
    }

    @Override
    public void markCompleted(WorkflowRun run, long attempt, RunSummary summary) {
        update(run, attempt, rec -> rec.completed(summary));
    }

    @Override
    public void markFailed(WorkflowRun run, long attempt, String failure) {
        update(run, attempt, rec -> rec.failed(failure));
    }

    private void update(WorkflowRun run, long attempt, UnaryOperator<RunRecord> transition) {
        RunRecord updated = runsById.computeIfPresent(run.id(), (id, existing) ->
                existing.attempt() == attempt ? transition.apply(existing) : existing);

        if (updated == null || updated.attempt() != attempt) {
            LOG.debugf("Ignoring update of run %s from superseded attempt %d", run.id(), attempt);
            return;
        }
        LOG.debugf("Updated run %s to %s", run.id(), updated.state());
    }

    private void evictFinished() {
        int excess = runsById.size() - maxRuns;
        if (excess <= 0) {
            return;
        }
        runsById.values().stream()
                .filter(RunRecord::isFinished)
                .sorted(Comparator.comparing(RunRecord::finishedAt))
                .limit(excess)
                .forEach(rec -> {
                    if (runsById.remove(rec.run().id(), rec)) {
                        LOG.debugf("Evicted finished run %s", rec.run().id());
                    }
                });
    }
}
