package eu.biodt.connector.domain;

/**
 * Result of transferring a single artifact.
 */
public record TransferOutcome(
        String artifactName,
        Status status,
        String objectId,
        long bytesTransferred,
        SkipReason skipReason,
        ErrorKind errorKind,
        String errorMessage
) {
    public enum Status {
        STORED,
        SKIPPED,
        FAILED
    }

    public enum SkipReason {
        SIZE_EXCEEDED
    }

    public enum ErrorKind {
        SOURCE_READ,
        SINK_AUTH,
        SINK_UNAVAILABLE,
        SINK_REJECTED,
        INTERNAL
    }

    public TransferOutcome {
        if (artifactName == null || artifactName.isBlank()) {
            throw new IllegalArgumentException("artifactName cannot be blank");
        }
        if (status == Status.STORED && (objectId == null || objectId.isBlank())) {
            throw new IllegalArgumentException("Stored outcome requires an object id");
        }
    }

    public static TransferOutcome stored(String artifactName, String objectId, long bytes) {
        return new TransferOutcome(artifactName, Status.STORED, objectId, bytes, null, null, null);
    }

    public static TransferOutcome skipped(String artifactName, SkipReason reason) {
        return new TransferOutcome(artifactName, Status.SKIPPED, null, 0, reason, null, null);
    }

    public static TransferOutcome failed(String artifactName, ErrorKind kind, String error) {
        return new TransferOutcome(artifactName, Status.FAILED, null, 0, null, kind, error);
    }
}
