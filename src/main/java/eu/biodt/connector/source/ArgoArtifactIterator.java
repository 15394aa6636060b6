package eu.biodt.connector.source;

import eu.biodt.connector.domain.Artifact;
import eu.biodt.connector.domain.ArtifactContent;
import org.jboss.logging.Logger;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpHeaders;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Walks the artifact-files tree of a run depth first. A response with a
 * {@code Content-Disposition} header is a file; anything else is an HTML directory listing
 * whose links are expanded in place. At most one response body is open at a time.
 */
final class ArgoArtifactIterator implements Iterator<Artifact>, Closeable {

    private static final Logger LOG = Logger.getLogger(ArgoArtifactIterator.class);
    private static final Pattern FILENAME = Pattern.compile("filename\\*?=\"?(?:UTF-8'')?([^\";]+)\"?");

    @FunctionalInterface
    interface Fetcher {
        HttpResponse<InputStream> get(String url) throws IOException, InterruptedException;
    }

    private record Entry(String url, String path) {
    }

    private final Fetcher fetcher;
    private final Deque<Entry> pending = new ArrayDeque<>();
    private Artifact next;

    private ArgoArtifactIterator(Fetcher fetcher, List<Entry> roots) {
        this.fetcher = fetcher;
        this.pending.addAll(roots);
    }

    static ArgoArtifactIterator forRefs(Fetcher fetcher, String artifactFilesUrl, List<ArtifactRef> refs) {
        List<Entry> roots = new ArrayList<>(refs.size());
        for (ArtifactRef ref : refs) {
            String url = artifactFilesUrl + "/" + ref.nodeId() + "/outputs/" + ref.artifactName();
            roots.add(new Entry(url, ref.relativePath()));
        }
        return new ArgoArtifactIterator(fetcher, roots);
    }

    @Override
    public boolean hasNext() {
        while (next == null && !pending.isEmpty()) {
            next = resolve(pending.pollFirst());
        }
        return next != null;
    }

    @Override
    public Artifact next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Artifact artifact = next;
        next = null;
        return artifact;
    }

    @Override
    public void close() throws IOException {
        pending.clear();
        if (next != null) {
            next.close();
            next = null;
        }
    }

    /**
     * Returns the artifact for a file entry, or null after queueing a directory's children.
     */
    private Artifact resolve(Entry entry) {
        HttpResponse<InputStream> response;
        try {
            response = fetcher.get(entry.url());
        } catch (IOException e) {
            LOG.warnf("Failed to fetch artifact %s: %s", entry.path(), e.getMessage());
            return failed(entry, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failed(entry, new IOException("Interrupted while fetching " + entry.url(), e));
        } catch (RuntimeException e) {
            LOG.warnf("Cannot request artifact %s from %s: %s", entry.path(), entry.url(), e.getMessage());
            return failed(entry, new IOException("Invalid artifact URL " + entry.url() + ": " + e.getMessage(), e));
        }

        if (response.statusCode() != 200) {
            closeQuietly(response.body(), entry);
            return failed(entry, new IOException(
                    "Argo returned HTTP " + response.statusCode() + " for " + entry.url()));
        }

        HttpHeaders headers = response.headers();
        Optional<String> disposition = headers.firstValue("Content-Disposition");
        if (disposition.isPresent()) {
            String name = rewritePath(entry.path(), disposition.get());
            OptionalLong length = headers.firstValueAsLong("Content-Length");
            Long size = length.isPresent() ? length.getAsLong() : null;
            String contentType = headers.firstValue("Content-Type").orElse(null);
            LOG.debugf("Yielding file from %s as %s", entry.url(), name);
            return new Artifact(name, size, contentType, ArtifactContent.of(response.body()));
        }

        LOG.debugf("Expanding directory listing %s", entry.url());
        try (InputStream body = response.body()) {
            String html = new String(body.readAllBytes(), StandardCharsets.UTF_8);
            queueChildren(entry, html);
            return null;
        } catch (IOException e) {
            LOG.warnf("Failed to read directory listing %s: %s", entry.url(), e.getMessage());
            return failed(entry, e);
        }
    }

    private void queueChildren(Entry parent, String html) throws IOException {
        String baseUrl = parent.url().endsWith("/") ? parent.url() : parent.url() + "/";
        String basePath = parent.path().endsWith("/") ? parent.path() : parent.path() + "/";
        URI base;
        try {
            base = new URI(baseUrl).normalize();
        } catch (URISyntaxException e) {
            throw new IOException("Invalid directory URL " + baseUrl, e);
        }

        List<Entry> children = new ArrayList<>();
        for (Element link : Jsoup.parse(html).select("a[href]")) {
            String href = link.attr("href");
            Optional<URI> child = childOf(base, href);
            if (child.isEmpty()) {
                LOG.debugf("Ignoring link %s in listing %s", href, baseUrl);
                continue;
            }
            String name = base.relativize(child.get()).getPath();
            if (name.endsWith("/")) {
                name = name.substring(0, name.length() - 1);
            }
            children.add(new Entry(child.get().toString(), basePath + name));
        }

        // keep listing order: push in reverse onto the front
        for (int i = children.size() - 1; i >= 0; i--) {
            pending.addFirst(children.get(i));
        }
    }

    /**
     * Resolves a listing link against its directory. Only links that point strictly below the
     * directory are children; parent, self, sort-order and off-site links yield empty.
     * Hrefs that are not valid URIs (a raw space, say) are percent-encoded first.
     */
    static Optional<URI> childOf(URI base, String href) {
        if (href.isBlank() || href.startsWith("?") || href.startsWith("#")) {
            return Optional.empty();
        }
        URI ref;
        try {
            ref = new URI(href);
        } catch (URISyntaxException e) {
            try {
                ref = new URI(null, null, href, null);
            } catch (URISyntaxException unencodable) {
                return Optional.empty();
            }
        }

        URI resolved = base.resolve(ref).normalize();
        if (resolved.getRawQuery() != null || resolved.getRawFragment() != null) {
            return Optional.empty();
        }
        String prefix = base.toString();
        String target = resolved.toString();
        if (!target.startsWith(prefix) || target.length() == prefix.length()) {
            return Optional.empty();
        }
        return Optional.of(resolved);
    }

    /**
     * Argo may serve an archived file under a different name (x.txt as x.tgz); the downloaded
     * name replaces the last path segment.
     */
    static String rewritePath(String path, String contentDisposition) {
        Matcher matcher = FILENAME.matcher(contentDisposition);
        if (!matcher.find()) {
            return path;
        }
        String fileName = matcher.group(1).trim();
        int lastSep = path.lastIndexOf('/');
        return lastSep >= 0 ? path.substring(0, lastSep + 1) + fileName : fileName;
    }

    private static Artifact failed(Entry entry, IOException cause) {
        return new Artifact(entry.path(), null, null, ArtifactContent.failed(cause));
    }

    private static void closeQuietly(InputStream body, Entry entry) {
        try {
            body.close();
        } catch (IOException e) {
            LOG.debugf(e, "Failed to close response for %s", entry.url());
        }
    }
}
