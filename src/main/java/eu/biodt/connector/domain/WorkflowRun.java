package eu.biodt.connector.domain;

import java.util.regex.Pattern;

/**
 * Identifies one completed workflow run in Argo.
 */
public record WorkflowRun(
        String namespace,
        String name
) {
    private static final Pattern OBJECT_NAME = Pattern.compile("[a-z0-9]([-a-z0-9.]*[a-z0-9])?");
    private static final int MAX_NAME_LENGTH = 253;

    public WorkflowRun {
        requireObjectName("namespace", namespace);
        requireObjectName("name", name);
    }

    /**
     * Stable identifier used in logs and as tracker key.
     */
    public String id() {
        return namespace + "/" + name;
    }

    private static void requireObjectName(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Workflow " + field + " cannot be blank");
        }
        if (value.length() > MAX_NAME_LENGTH || !OBJECT_NAME.matcher(value).matches()) {
            throw new IllegalArgumentException("Workflow " + field + " is not a valid object name: " + value);
        }
    }

    @Override
    public String toString() {
        return id();
    }
}
