package eu.biodt.connector.source;

/**
 * Result of probing the workflow engine.
 */
public record SourceHealth(
        boolean reachable,
        String message
) {
    public static SourceHealth up() {
        return new SourceHealth(true, null);
    }

    public static SourceHealth down(String message) {
        return new SourceHealth(false, message);
    }
}
