package eu.biodt.connector.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import eu.biodt.connector.config.ConnectorConfig;
import eu.biodt.connector.domain.WorkflowRun;
import eu.biodt.connector.util.HttpClients;
import eu.biodt.connector.util.MultipartBodyPublisher;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

/**
 * Writes artifacts into a Cordra repository through its REST API.
 */
@ApplicationScoped
public class CordraObjectSink implements ObjectSink {

    private static final Logger LOG = Logger.getLogger(CordraObjectSink.class);

    static final String FILE_OBJECT_TYPE = "FileObject";
    static final String DATASET_TYPE = "Dataset";

    private final HttpClient client;
    private final ObjectMapper mapper;
    private final String baseUrl;
    private final String authorization;
    private final Duration requestTimeout;

    @Inject
    public CordraObjectSink(ConnectorConfig config, ObjectMapper mapper) {
        this(
                HttpClients.create(config.cordra().verifyTls()),
                mapper,
                config.cordra().url(),
                config.cordra().username(),
                config.cordra().password(),
                config.transfer().requestTimeout()
        );
    }

    CordraObjectSink(HttpClient client, ObjectMapper mapper, String baseUrl, String username, String password,
                     Duration requestTimeout) {
        this.client = client;
        this.mapper = mapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.authorization = HttpClients.basicAuth(username, password);
        this.requestTimeout = requestTimeout;
    }

    @Override
    public String create(ArtifactUpload upload) throws SinkException {
        ObjectNode content = mapper.createObjectNode()
                .put("name", upload.fileName())
                .put("contentSize", upload.sizeBytes())
                .put("encodingFormat", upload.encodingFormat())
                .put("contentUrl", upload.relativePath());

        MultipartBodyPublisher body = new MultipartBodyPublisher();
        try {
            body.addPart("content", mapper.writeValueAsString(content), "application/json")
                    .addFile(upload.relativePath(), upload.relativePath(), upload.file(), upload.encodingFormat());
        } catch (IOException e) {
            throw new SinkUnavailableException("Cannot read spooled artifact " + upload.file(), e);
        }

        LOG.debugf("Creating %s for %s (%d bytes)", FILE_OBJECT_TYPE, upload.relativePath(), upload.sizeBytes());
        return post(FILE_OBJECT_TYPE, body.getContentType(), body.build(), upload.relativePath());
    }

    @Override
    public String createDataset(WorkflowRun run, List<String> partIds) throws SinkException {
        ObjectNode content = mapper.createObjectNode()
                .put("name", "Results of workflow " + run.id())
                .put("description", "Output artifacts of Argo workflow run " + run.id());
        ArrayNode hasPart = content.putArray("hasPart");
        partIds.forEach(hasPart::add);

        String json;
        try {
            json = mapper.writeValueAsString(content);
        } catch (JsonProcessingException e) {
            throw new SinkRejectedException("Cannot serialise dataset for " + run.id() + ": " + e.getMessage());
        }

        LOG.debugf("Creating %s for %s with %d parts", DATASET_TYPE, run.id(), partIds.size());
        return post(DATASET_TYPE, "application/json",
                HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8), run.id());
    }

    /**
     * Adds the dataset id to the object's {@code partOf} list with a read-modify-write of its
     * JSON content. Payloads are kept by Cordra on a JSON-only update.
     */
    @Override
    public void linkToDataset(String objectId, String datasetId) throws SinkException {
        URI objectUri = objectUri(objectId);
        HttpRequest get = HttpRequest.newBuilder(objectUri)
                .timeout(requestTimeout)
                .header("Authorization", authorization)
                .GET()
                .build();

        JsonNode current;
        try {
            current = mapper.readTree(execute(get, objectId));
        } catch (JsonProcessingException e) {
            throw new SinkRejectedException("Cordra returned malformed content for " + objectId);
        }
        if (!current.isObject()) {
            throw new SinkRejectedException("Cordra content of " + objectId + " is not a JSON object");
        }

        ObjectNode content = (ObjectNode) current;
        JsonNode partOf = content.get("partOf");
        if (partOf == null || partOf.isNull()) {
            content.putArray("partOf").add(datasetId);
        } else if (partOf.isArray()) {
            for (JsonNode existing : partOf) {
                if (datasetId.equals(existing.asText())) {
                    LOG.debugf("%s already part of %s", objectId, datasetId);
                    return;
                }
            }
            ((ArrayNode) partOf).add(datasetId);
        } else {
            throw new SinkRejectedException("Cordra content of " + objectId + " has a non-array partOf");
        }

        String json;
        try {
            json = mapper.writeValueAsString(content);
        } catch (JsonProcessingException e) {
            throw new SinkRejectedException("Cannot serialise content of " + objectId + ": " + e.getMessage());
        }

        LOG.debugf("Linking %s to %s %s", objectId, DATASET_TYPE, datasetId);
        HttpRequest put = HttpRequest.newBuilder(objectUri)
                .timeout(requestTimeout)
                .header("Authorization", authorization)
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                .build();
        execute(put, objectId);
    }

    private String post(String type, String contentType, HttpRequest.BodyPublisher body, String subject)
            throws SinkException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/objects?type=" + type + "&full=true"))
                .timeout(requestTimeout)
                .header("Authorization", authorization)
                .header("Content-Type", contentType)
                .POST(body)
                .build();
        return extractId(execute(request, subject), subject);
    }

    private URI objectUri(String objectId) throws SinkRejectedException {
        try {
            return URI.create(baseUrl + "/objects/" + objectId);
        } catch (IllegalArgumentException e) {
            throw new SinkRejectedException("Object id " + objectId + " is not usable in a URL: " + e.getMessage());
        }
    }

    /**
     * Sends the request and returns the body of a 2xx response; other statuses map to the
     * matching {@link SinkException}.
     */
    private String execute(HttpRequest request, String subject) throws SinkException {
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException | UncheckedIOException e) {
            throw new SinkUnavailableException("Cordra unreachable at " + baseUrl + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SinkUnavailableException("Interrupted while writing " + subject, e);
        }

        int status = response.statusCode();
        if (status == 401 || status == 403) {
            throw new SinkAuthException("Cordra rejected credentials (HTTP " + status + ") for " + subject);
        }
        if (status >= 500) {
            throw new SinkUnavailableException("Cordra returned HTTP " + status + " for " + subject + ": "
                    + abbreviate(response.body()));
        }
        if (status / 100 != 2) {
            throw new SinkRejectedException("Cordra rejected " + subject + " (HTTP " + status + "): "
                    + abbreviate(response.body()));
        }
        return response.body();
    }

    private String extractId(String body, String subject) throws SinkRejectedException {
        try {
            JsonNode node = mapper.readTree(body);
            String id = node.path("id").asText(node.path("@id").asText(""));
            if (id.isBlank()) {
                throw new SinkRejectedException("Cordra response for " + subject + " has no object id");
            }
            return id;
        } catch (JsonProcessingException e) {
            throw new SinkRejectedException("Cordra returned malformed response for " + subject);
        }
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 500 ? body.substring(0, 500) + "..." : body;
    }
}
