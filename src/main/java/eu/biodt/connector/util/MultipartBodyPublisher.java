package eu.biodt.connector.util;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.SequenceInputStream;
import java.io.UncheckedIOException;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Streams a {@code multipart/form-data} body. File parts are read from disk only when the
 * request body is sent.
 */
public final class MultipartBodyPublisher {

    private final String boundary = "----connector-" + UUID.randomUUID();
    private final List<Supplier<InputStream>> parts = new ArrayList<>();
    private long contentLength;

    public MultipartBodyPublisher addPart(String name, String value, String contentType) {
        byte[] header = partHeader(name, null, contentType);
        byte[] body = value.getBytes(StandardCharsets.UTF_8);
        byte[] bytes = concat(header, body, crlf());
        parts.add(() -> new ByteArrayInputStream(bytes));
        contentLength += bytes.length;
        return this;
    }

    public MultipartBodyPublisher addFile(String name, String filename, Path file, String contentType)
            throws IOException {
        byte[] header = partHeader(name, filename, contentType != null ? contentType : "application/octet-stream");
        parts.add(() -> new ByteArrayInputStream(header));
        parts.add(() -> {
            try {
                return Files.newInputStream(file);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
        byte[] trailer = crlf();
        parts.add(() -> new ByteArrayInputStream(trailer));
        contentLength += header.length + Files.size(file) + trailer.length;
        return this;
    }

    public String getContentType() {
        return "multipart/form-data; boundary=" + boundary;
    }

    public HttpRequest.BodyPublisher build() {
        byte[] closing = ("--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8);
        List<Supplier<InputStream>> all = new ArrayList<>(parts);
        all.add(() -> new ByteArrayInputStream(closing));
        long length = contentLength + closing.length;

        return HttpRequest.BodyPublishers.fromPublisher(
                HttpRequest.BodyPublishers.ofInputStream(() -> new SequenceInputStream(lazily(all))),
                length);
    }

    // SequenceInputStream pulls the next element only after the previous one is exhausted
    private static Enumeration<InputStream> lazily(List<Supplier<InputStream>> suppliers) {
        Iterator<Supplier<InputStream>> it = suppliers.iterator();
        return new Enumeration<>() {
            @Override
            public boolean hasMoreElements() {
                return it.hasNext();
            }

            @Override
            public InputStream nextElement() {
                return it.next().get();
            }
        };
    }

    private byte[] partHeader(String name, String filename, String contentType) {
        StringBuilder header = new StringBuilder()
                .append("--").append(boundary).append("\r\n")
                .append("Content-Disposition: form-data; name=\"").append(escape(name)).append('"');
        if (filename != null) {
            header.append("; filename=\"").append(escape(filename)).append('"');
        }
        header.append("\r\n");
        if (contentType != null) {
            header.append("Content-Type: ").append(contentType).append("\r\n");
        }
        header.append("\r\n");
        return header.toString().getBytes(StandardCharsets.UTF_8);
    }

    private static String escape(String value) {
        return value.replace("\"", "%22").replace("\r", "%0D").replace("\n", "%0A");
    }

    private static byte[] crlf() {
        return "\r\n".getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] concat(byte[]... chunks) {
        int total = 0;
        for (byte[] chunk : chunks) {
            total += chunk.length;
        }
        byte[] out = new byte[total];
        int pos = 0;
        for (byte[] chunk : chunks) {
            System.arraycopy(chunk, 0, out, pos, chunk.length);
            pos += chunk.length;
        }
        return out;
    }
}
