package eu.biodt.connector.source;

import eu.biodt.connector.domain.TransferException;
import eu.biodt.connector.domain.WorkflowRun;

/**
 * The workflow engine could not be reached or did not answer usefully.
 */
public class SourceUnavailableException extends TransferException {

    private final WorkflowRun run;

    public SourceUnavailableException(WorkflowRun run, String message) {
        super(message);
        this.run = run;
    }

    public SourceUnavailableException(WorkflowRun run, String message, Throwable cause) {
        super(message, cause);
        this.run = run;
    }

    public WorkflowRun run() {
        return run;
    }
}
