package eu.biodt.connector.api;

/**
 * Body of a "workflow finished" notification. The namespace may be omitted.
 */
public record NotificationRequest(
        String namespace,
        String name
) {
}
