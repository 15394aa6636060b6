package eu.biodt.connector.sink;

import java.nio.file.Path;

/**
 * A fully spooled artifact ready to be written as a file object.
 */
public record ArtifactUpload(
        String relativePath,
        Path file,
        long sizeBytes,
        String encodingFormat
) {
    public ArtifactUpload {
        if (relativePath == null || relativePath.isBlank()) {
            throw new IllegalArgumentException("relativePath cannot be blank");
        }
        if (file == null) {
            throw new IllegalArgumentException("file cannot be null");
        }
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes cannot be negative");
        }
    }

    public String fileName() {
        int lastSep = relativePath.lastIndexOf('/');
        return lastSep >= 0 ? relativePath.substring(lastSep + 1) : relativePath;
    }
}
