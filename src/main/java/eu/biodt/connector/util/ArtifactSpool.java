package eu.biodt.connector.util;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Temporary file holding one artifact body. The copy stops once more than {@code limit} bytes
 * have been read, in which case {@link #exceeded()} is true and the file is incomplete.
 * Closing deletes the file.
 */
public final class ArtifactSpool implements Closeable {

    private static final int BUFFER_SIZE = 64 * 1024;

    private final Path file;
    private final long sizeBytes;
    private final boolean exceeded;

    private ArtifactSpool(Path file, long sizeBytes, boolean exceeded) {
        this.file = file;
        this.sizeBytes = sizeBytes;
        this.exceeded = exceeded;
    }

    public static ArtifactSpool spool(InputStream in, Path directory, String fileName, long limit)
            throws IOException {
        Path file = Files.createTempFile(directory, "argo-artifact-", "-" + sanitize(fileName));

        try (OutputStream out = Files.newOutputStream(file)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            long total = 0;
            int bytesRead;

            while ((bytesRead = in.read(buffer)) != -1) {
                total += bytesRead;
                if (total > limit) {
                    return new ArtifactSpool(file, total, true);
                }
                out.write(buffer, 0, bytesRead);
            }
            return new ArtifactSpool(file, total, false);
        } catch (IOException e) {
            Files.deleteIfExists(file);
            throw e;
        }
    }

    public Path file() {
        return file;
    }

    /**
     * Bytes read from the source; when exceeded, a lower bound of the real size.
     */
    public long sizeBytes() {
        return sizeBytes;
    }

    public boolean exceeded() {
        return exceeded;
    }

    @Override
    public void close() throws IOException {
        Files.deleteIfExists(file);
    }

    private static String sanitize(String fileName) {
        String cleaned = fileName.replaceAll("[^A-Za-z0-9._-]", "_");
        return cleaned.length() > 64 ? cleaned.substring(cleaned.length() - 64) : cleaned;
    }
}
