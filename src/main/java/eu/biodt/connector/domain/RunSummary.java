package eu.biodt.connector.domain;

import eu.biodt.connector.domain.TransferOutcome.Status;

import java.util.List;

/**
 * Aggregate result of transferring every artifact of one run.
 * {@code datasetId} is set when the stored objects were grouped into a dataset.
 */
public record RunSummary(
        WorkflowRun run,
        List<TransferOutcome> outcomes,
        int stored,
        int skipped,
        int failed,
        String datasetId,
        String datasetError
) {
    public RunSummary {
        if (run == null) {
            throw new IllegalArgumentException("run cannot be null");
        }
        outcomes = outcomes != null ? List.copyOf(outcomes) : List.of();
    }

    public static RunSummary of(WorkflowRun run, List<TransferOutcome> outcomes) {
        return new RunSummary(
                run,
                outcomes,
                count(outcomes, Status.STORED),
                count(outcomes, Status.SKIPPED),
                count(outcomes, Status.FAILED),
                null,
                null
        );
    }

    public List<String> storedObjectIds() {
        return outcomes.stream()
                .filter(o -> o.status() == Status.STORED)
                .map(TransferOutcome::objectId)
                .toList();
    }

    public RunSummary withDataset(String datasetId, String datasetError) {
        return new RunSummary(run, outcomes, stored, skipped, failed, datasetId, datasetError);
    }

    private static int count(List<TransferOutcome> outcomes, Status status) {
        return (int) outcomes.stream().filter(o -> o.status() == status).count();
    }
}
