package eu.biodt.connector.domain;

/**
 * Base type for failures talking to the workflow engine or the object repository.
 */
public abstract class TransferException extends Exception {

    protected TransferException(String message) {
        super(message);
    }

    protected TransferException(String message, Throwable cause) {
        super(message, cause);
    }
}
