package eu.biodt.connector.domain;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;

/**
 * One-shot handle to the bytes of an artifact.
 * Closing releases the underlying connection whether or not the stream was opened.
 */
public interface ArtifactContent extends Closeable {

    InputStream open() throws IOException;

    static ArtifactContent of(InputStream in) {
        return new ArtifactContent() {
            private boolean opened;

            @Override
            public InputStream open() throws IOException {
                if (opened) {
                    throw new IOException("Artifact content already consumed");
                }
                opened = true;
                return in;
            }

            @Override
            public void close() throws IOException {
                in.close();
            }
        };
    }

    /**
     * Content whose fetch already failed; opening it rethrows the cause.
     */
    static ArtifactContent failed(IOException cause) {
        return new ArtifactContent() {
            @Override
            public InputStream open() throws IOException {
                throw cause;
            }

            @Override
            public void close() {
            }
        };
    }
}
