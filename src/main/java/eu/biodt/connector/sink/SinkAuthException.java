package eu.biodt.connector.sink;

import eu.biodt.connector.domain.TransferOutcome.ErrorKind;

public class SinkAuthException extends SinkException {

    public SinkAuthException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.SINK_AUTH;
    }
}
