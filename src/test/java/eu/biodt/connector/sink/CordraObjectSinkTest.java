package eu.biodt.connector.sink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import eu.biodt.connector.domain.TransferOutcome.ErrorKind;
import eu.biodt.connector.domain.WorkflowRun;
import eu.biodt.connector.testing.FakeCordraServer;
import eu.biodt.connector.testing.FakeCordraServer.Received;
import eu.biodt.connector.util.HttpClients;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CordraObjectSinkTest {

    private static final String USER = "admin";
    private static final String PASSWORD = "secret";

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper();
    private FakeCordraServer cordra;
    private Path file;

    @BeforeEach
    void setup() throws IOException {
        cordra = FakeCordraServer.start(USER, PASSWORD);
        file = Files.writeString(dir.resolve("spooled.csv"), "site,count\nA,3\n");
    }

    @AfterEach
    void tearDown() {
        cordra.close();
    }

    @Test
    void shouldCreateFileObjectAndReturnItsId() throws Exception {
        String id = sink(PASSWORD).create(upload("wf-42-1111/tmp/report.csv"));

        assertEquals("test/1", id);
        List<Received> received = cordra.received(CordraObjectSink.FILE_OBJECT_TYPE);
        assertEquals(1, received.size());

        Received request = received.get(0);
        assertTrue(request.contentType().startsWith("multipart/form-data; boundary="));
        assertTrue(request.body().contains("Content-Disposition: form-data; name=\"content\""));
        assertTrue(request.body().contains("\"name\":\"report.csv\""));
        assertTrue(request.body().contains("\"contentSize\":15"));
        assertTrue(request.body().contains("\"encodingFormat\":\"text/csv\""));
        assertTrue(request.body().contains("\"contentUrl\":\"wf-42-1111/tmp/report.csv\""));
        assertTrue(request.body().contains(
                "name=\"wf-42-1111/tmp/report.csv\"; filename=\"wf-42-1111/tmp/report.csv\""));
        assertTrue(request.body().contains("site,count\nA,3\n"));
    }

    @Test
    void shouldMapRejectedCredentialsToAuthFailure() {
        SinkException e = assertThrows(SinkException.class, () -> sink("wrong").create(upload("n/a.csv")));

        assertEquals(ErrorKind.SINK_AUTH, e.kind());
    }

    @Test
    void shouldMapClientErrorToRejection() {
        cordra.rejectWhenBodyContains("\"name\":\"a.csv\"");

        SinkException e = assertThrows(SinkException.class, () -> sink(PASSWORD).create(upload("n/a.csv")));

        assertEquals(ErrorKind.SINK_REJECTED, e.kind());
        assertTrue(e.getMessage().contains("400"));
    }

    @Test
    void shouldMapServerErrorToUnavailable() {
        cordra.forceStatus(503);

        SinkException e = assertThrows(SinkException.class, () -> sink(PASSWORD).create(upload("n/a.csv")));

        assertEquals(ErrorKind.SINK_UNAVAILABLE, e.kind());
    }

    @Test
    void shouldMapConnectionFailureToUnavailable() {
        String url = cordra.url();
        cordra.close();
        CordraObjectSink sink = new CordraObjectSink(HttpClients.create(true), mapper, url, USER, PASSWORD,
                Duration.ofSeconds(5));

        SinkException e = assertThrows(SinkException.class, () -> sink.create(upload("n/a.csv")));

        assertEquals(ErrorKind.SINK_UNAVAILABLE, e.kind());
    }

    @Test
    void shouldCreateDatasetReferencingParts() throws Exception {
        WorkflowRun run = new WorkflowRun("argo", "wf-42");

        String id = sink(PASSWORD).createDataset(run, List.of("test/7", "test/8"));

        assertEquals("test/1", id);
        Received request = cordra.received(CordraObjectSink.DATASET_TYPE).get(0);
        assertTrue(request.contentType().startsWith("application/json"));

        JsonNode dataset = mapper.readTree(request.body());
        assertEquals("Results of workflow argo/wf-42", dataset.path("name").asText());
        assertEquals(2, dataset.path("hasPart").size());
        assertEquals("test/8", dataset.path("hasPart").get(1).asText());
    }

    @Test
    void shouldAddDatasetToPartOfOfStoredObject() throws Exception {
        CordraObjectSink sink = sink(PASSWORD);
        String id = sink.create(upload("wf-42-1111/tmp/report.csv"));

        sink.linkToDataset(id, "test/99");

        JsonNode content = mapper.readTree(cordra.content(id));
        assertEquals("report.csv", content.path("name").asText());
        assertEquals(1, content.path("partOf").size());
        assertEquals("test/99", content.path("partOf").get(0).asText());
        assertTrue(cordra.updates().get(0).contentType().startsWith("application/json"));
    }

    @Test
    void shouldKeepExistingPartOfEntriesAndNotDuplicate() throws Exception {
        cordra.storeContent("test/5", "{\"name\":\"a.csv\",\"partOf\":[\"test/1\"]}");
        CordraObjectSink sink = sink(PASSWORD);

        sink.linkToDataset("test/5", "test/2");
        sink.linkToDataset("test/5", "test/2");

        JsonNode partOf = mapper.readTree(cordra.content("test/5")).path("partOf");
        assertEquals(2, partOf.size());
        assertEquals("test/1", partOf.get(0).asText());
        assertEquals("test/2", partOf.get(1).asText());
        assertEquals(1, cordra.updates().size());
    }

    @Test
    void shouldMapFailedLinkUpdates() {
        cordra.storeContent("test/5", "{\"name\":\"a.csv\"}");

        cordra.failUpdates(503);
        SinkException unavailable = assertThrows(SinkException.class,
                () -> sink(PASSWORD).linkToDataset("test/5", "test/2"));
        assertEquals(ErrorKind.SINK_UNAVAILABLE, unavailable.kind());

        cordra.failUpdates(403);
        SinkException denied = assertThrows(SinkException.class,
                () -> sink(PASSWORD).linkToDataset("test/5", "test/2"));
        assertEquals(ErrorKind.SINK_AUTH, denied.kind());

        SinkException missing = assertThrows(SinkException.class,
                () -> sink(PASSWORD).linkToDataset("test/404", "test/2"));
        assertEquals(ErrorKind.SINK_REJECTED, missing.kind());
        assertTrue(missing.getMessage().contains("404"));
    }

    private CordraObjectSink sink(String password) {
        return new CordraObjectSink(HttpClients.create(true), mapper, cordra.url() + "/", USER, password,
                Duration.ofSeconds(10));
    }

    private ArtifactUpload upload(String relativePath) throws IOException {
        return new ArtifactUpload(relativePath, file, Files.size(file), "text/csv");
    }
}
