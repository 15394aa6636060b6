package eu.biodt.connector.sink;

import eu.biodt.connector.domain.TransferOutcome.ErrorKind;

public class SinkUnavailableException extends SinkException {

    public SinkUnavailableException(String message) {
        super(message);
    }

    public SinkUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.SINK_UNAVAILABLE;
    }
}
