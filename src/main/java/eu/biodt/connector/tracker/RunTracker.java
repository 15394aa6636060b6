package eu.biodt.connector.tracker;

import eu.biodt.connector.domain.RunRecord;
import eu.biodt.connector.domain.RunSummary;
import eu.biodt.connector.domain.WorkflowRun;

import java.util.List;
import java.util.Optional;

/**
 * Interface for tracking the state of notified runs.
 * Backs the status query and the re-notification policy.
 */
public interface RunTracker {

    /**
     * Record a run as pending under a new attempt number. With {@code allowExisting} false, a run
     * that is already pending, in progress or completed is left untouched and empty is returned.
     */
    Optional<RunRecord> register(WorkflowRun run, boolean allowExisting);

    Optional<RunRecord> find(WorkflowRun run);

    List<RunRecord> findAll();

    /**
     * State changes apply only while {@code attempt} is the run's current attempt; updates from a
     * superseded registration are ignored.
     */
    void markInProgress(WorkflowRun run, long attempt);

    void markCompleted(WorkflowRun run, long attempt, RunSummary summary);

    void markFailed(WorkflowRun run, long attempt, String failure);
}
