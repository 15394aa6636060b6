package eu.biodt.connector.sink;

import eu.biodt.connector.domain.TransferOutcome.ErrorKind;

/**
 * The repository refused the object, e.g. because its metadata failed schema validation.
 */
public class SinkRejectedException extends SinkException {

    public SinkRejectedException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.SINK_REJECTED;
    }
}
