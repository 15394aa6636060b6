package eu.biodt.connector.source;

import eu.biodt.connector.domain.TransferException;
import eu.biodt.connector.domain.WorkflowRun;

public class RunNotFoundException extends TransferException {

    private final WorkflowRun run;

    public RunNotFoundException(WorkflowRun run) {
        super("Workflow run not found: " + run.id());
        this.run = run;
    }

    public WorkflowRun run() {
        return run;
    }
}
