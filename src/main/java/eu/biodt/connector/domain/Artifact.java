package eu.biodt.connector.domain;

import java.io.IOException;

/**
 * One output file of a workflow run, as handed out by a source.
 * The name is the path relative to the run, e.g. {@code step-1/results/model.tif}.
 * {@code sizeBytes} is null when the source did not announce a size.
 */
public record Artifact(
        String name,
        Long sizeBytes,
        String contentType,
        ArtifactContent content
) implements AutoCloseable {

    public Artifact {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Artifact name cannot be blank");
        }
        if (sizeBytes != null && sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes cannot be negative");
        }
        if (content == null) {
            throw new IllegalArgumentException("Artifact content cannot be null");
        }
    }

    /**
     * Last path segment of the name.
     */
    public String fileName() {
        int lastSep = name.lastIndexOf('/');
        return lastSep >= 0 ? name.substring(lastSep + 1) : name;
    }

    @Override
    public void close() throws IOException {
        content.close();
    }
}
