package eu.biodt.connector.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import eu.biodt.connector.config.ConnectorConfig;
import eu.biodt.connector.domain.Artifact;
import eu.biodt.connector.domain.WorkflowRun;
import eu.biodt.connector.util.HttpClients;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Reads output artifacts of finished workflow runs from the Argo server API.
 */
@ApplicationScoped
public class ArgoArtifactSource implements ArtifactSource {

    private static final Logger LOG = Logger.getLogger(ArgoArtifactSource.class);

    private final HttpClient client;
    private final ObjectMapper mapper;
    private final String baseUrl;
    private final String token;
    private final String defaultNamespace;
    private final Duration requestTimeout;

    @Inject
    public ArgoArtifactSource(ConnectorConfig config, ObjectMapper mapper) {
        this(
                HttpClients.create(config.argo().verifyTls()),
                mapper,
                config.argo().url(),
                config.argo().token(),
                config.argo().namespace(),
                config.transfer().requestTimeout()
        );
    }

    ArgoArtifactSource(HttpClient client, ObjectMapper mapper, String baseUrl, String token,
                       String defaultNamespace, Duration requestTimeout) {
        this.client = client;
        this.mapper = mapper;
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.token = token;
        this.defaultNamespace = defaultNamespace;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public Stream<Artifact> list(WorkflowRun run) throws RunNotFoundException, SourceUnavailableException {
        JsonNode workflow = fetchWorkflow(run);
        List<ArtifactRef> refs = ArgoWorkflowParser.listArtifacts(workflow);
        LOG.infof("Workflow %s has %d archivable artifacts", run.id(), refs.size());

        String artifactFilesUrl = baseUrl + "/artifact-files/" + run.namespace() + "/workflows/" + run.name();
        ArgoArtifactIterator iterator = ArgoArtifactIterator.forRefs(this::download, artifactFilesUrl, refs);

        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
                        false)
                .onClose(() -> {
                    try {
                        iterator.close();
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                });
    }

    /**
     * Lists at most one workflow in the default namespace to see whether Argo answers.
     */
    public SourceHealth checkHealth() {
        URI uri = URI.create(baseUrl + "/api/v1/workflows/" + defaultNamespace + "?listOptions.limit=1");
        try {
            HttpResponse<String> response = client.send(request(uri), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 == 2) {
                return SourceHealth.up();
            }
            return SourceHealth.down("Argo returned HTTP " + response.statusCode());
        } catch (IOException e) {
            return SourceHealth.down(e.getMessage() != null ? e.getMessage() : e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SourceHealth.down("Interrupted");
        }
    }

    private JsonNode fetchWorkflow(WorkflowRun run) throws RunNotFoundException, SourceUnavailableException {
        URI uri = URI.create(baseUrl + "/api/v1/workflows/" + run.namespace() + "/" + run.name());
        HttpResponse<String> response;
        try {
            response = client.send(request(uri), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new SourceUnavailableException(run, "Argo unreachable at " + baseUrl + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException(run, "Interrupted while fetching workflow " + run.id(), e);
        }

        if (response.statusCode() == 404) {
            throw new RunNotFoundException(run);
        }
        if (response.statusCode() / 100 != 2) {
            throw new SourceUnavailableException(run,
                    "Argo returned HTTP " + response.statusCode() + " for workflow " + run.id());
        }

        try {
            return mapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new SourceUnavailableException(run, "Argo returned malformed workflow " + run.id(), e);
        }
    }

    private HttpResponse<InputStream> download(String url) throws IOException, InterruptedException {
        return client.send(request(URI.create(url)), HttpResponse.BodyHandlers.ofInputStream());
    }

    private HttpRequest request(URI uri) {
        return HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .header("Authorization", HttpClients.bearer(token))
                .GET()
                .build();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
