package eu.biodt.connector.sink;

import eu.biodt.connector.domain.TransferException;
import eu.biodt.connector.domain.TransferOutcome.ErrorKind;

/**
 * A single write to the object repository failed. Never fatal for the run.
 */
public abstract class SinkException extends TransferException {

    protected SinkException(String message) {
        super(message);
    }

    protected SinkException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();
}
