package eu.biodt.connector.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArgoWorkflowParserTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void shouldListOnlyArchivableArtifactsInNodeOrder() throws IOException {
        List<ArtifactRef> refs = ArgoWorkflowParser.listArtifacts(fixture());

        assertEquals(List.of(
                new ArtifactRef("wf-42-1111", "report", "tmp/report.csv"),
                new ArtifactRef("wf-42-1111", "model", "tmp/model.tif"),
                new ArtifactRef("wf-42-1111", "main-logs", "main.log"),
                new ArtifactRef("wf-42-2222", "outputs", "tmp/outputs")
        ), refs);
        assertEquals("wf-42-1111/main.log", refs.get(2).relativePath());
    }

    @Test
    void shouldExcludeArtifactsStoredOutsideTheWorkflowKey() throws IOException {
        assertFalse(ArgoWorkflowParser.isArchivable(json("{\"name\":\"c\",\"s3\":{\"key\":\"cache/abc\"}}"), "wf-42"));
        assertFalse(ArgoWorkflowParser.isArchivable(json("{\"name\":\"c\"}"), "wf-42"));
    }

    @Test
    void shouldExcludeDeletedAndGarbageCollectedArtifacts() throws IOException {
        assertFalse(ArgoWorkflowParser.isArchivable(
                json("{\"s3\":{\"key\":\"wf-42/x\"},\"deleted\":true}"), "wf-42"));
        assertFalse(ArgoWorkflowParser.isArchivable(
                json("{\"s3\":{\"key\":\"wf-42/x\"},\"artifactGC\":{\"strategy\":\"OnWorkflowCompletion\"}}"), "wf-42"));
        assertTrue(ArgoWorkflowParser.isArchivable(
                json("{\"s3\":{\"key\":\"wf-42/x\"},\"artifactGC\":{\"strategy\":\"Never\"}}"), "wf-42"));
        assertTrue(ArgoWorkflowParser.isArchivable(
                json("{\"s3\":{\"key\":\"wf-42/x\"},\"deleted\":false}"), "wf-42"));
    }

    @Test
    void shouldReturnNothingForWorkflowWithoutNodes() throws IOException {
        assertTrue(ArgoWorkflowParser.listArtifacts(json("{\"metadata\":{\"name\":\"wf-1\"},\"status\":{}}")).isEmpty());
    }

    private JsonNode fixture() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/workflows/wf-42.json")) {
            return mapper.readTree(in);
        }
    }

    private JsonNode json(String text) throws IOException {
        return mapper.readTree(text);
    }
}
