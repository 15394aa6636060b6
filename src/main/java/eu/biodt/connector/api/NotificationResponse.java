package eu.biodt.connector.api;

import eu.biodt.connector.domain.WorkflowRun;

public record NotificationResponse(
        String namespace,
        String name,
        Status status
) {
    public enum Status {
        ACCEPTED,
        DUPLICATE
    }

    public static NotificationResponse accepted(WorkflowRun run) {
        return new NotificationResponse(run.namespace(), run.name(), Status.ACCEPTED);
    }

    public static NotificationResponse duplicate(WorkflowRun run) {
        return new NotificationResponse(run.namespace(), run.name(), Status.DUPLICATE);
    }
}
