package eu.biodt.connector.domain;

import java.time.Instant;

/**
 * Tracker record for a notified run. {@code attempt} counts the registrations of the run, so a
 * transfer started by an earlier notification cannot update the record of a later one.
 */
public record RunRecord(
        WorkflowRun run,
        long attempt,
        RunState state,
        Instant notifiedAt,
        Instant finishedAt,
        RunSummary summary,
        String failure
) {
    public RunRecord {
        if (run == null) {
            throw new IllegalArgumentException("run cannot be null");
        }
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be positive");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
    }

    public static RunRecord pending(WorkflowRun run, long attempt) {
        return new RunRecord(run, attempt, RunState.PENDING, Instant.now(), null, null, null);
    }

    public RunRecord inProgress() {
        return new RunRecord(run, attempt, RunState.IN_PROGRESS, notifiedAt, null, null, null);
    }

    public RunRecord completed(RunSummary summary) {
        return new RunRecord(run, attempt, RunState.COMPLETED, notifiedAt, Instant.now(), summary, null);
    }

    public RunRecord failed(String failure) {
        return new RunRecord(run, attempt, RunState.FAILED, notifiedAt, Instant.now(), null, failure);
    }

    public boolean isFinished() {
        return state == RunState.COMPLETED || state == RunState.FAILED;
    }

    public enum RunState {
        PENDING,
        IN_PROGRESS,
        COMPLETED,
        FAILED
    }
}
