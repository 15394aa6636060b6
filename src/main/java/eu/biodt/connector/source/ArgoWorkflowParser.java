package eu.biodt.connector.source;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Extracts the archivable output artifacts from an Argo workflow document.
 * <p>
 * Only artifacts stored under the workflow's own key are kept, which leaves out cache entries.
 * Artifacts that were or will be garbage collected are passed between steps and are left out too.
 */
public final class ArgoWorkflowParser {

    static final String MAIN_LOGS = "main-logs";
    static final String MAIN_LOG_PATH = "main.log";
    private static final String GC_NEVER = "Never";

    private ArgoWorkflowParser() {
        // Utility class
    }

    public static List<ArtifactRef> listArtifacts(JsonNode workflow) {
        String workflowName = workflow.path("metadata").path("name").asText("");
        List<ArtifactRef> refs = new ArrayList<>();

        Iterator<Map.Entry<String, JsonNode>> nodes = workflow.path("status").path("nodes").fields();
        while (nodes.hasNext()) {
            Map.Entry<String, JsonNode> node = nodes.next();
            for (JsonNode artifact : node.getValue().path("outputs").path("artifacts")) {
                if (isArchivable(artifact, workflowName)) {
                    refs.add(toRef(node.getKey(), artifact));
                }
            }
        }
        return refs;
    }

    static boolean isArchivable(JsonNode artifact, String workflowName) {
        String key = artifact.path("s3").path("key").asText("");
        if (workflowName.isEmpty() || !key.contains(workflowName)) {
            return false;
        }
        if (artifact.path("deleted").asBoolean(false)) {
            return false;
        }
        JsonNode gc = artifact.get("artifactGC");
        return gc == null || gc.isNull() || GC_NEVER.equals(gc.path("strategy").asText());
    }

    private static ArtifactRef toRef(String nodeId, JsonNode artifact) {
        String name = artifact.path("name").asText();
        String path = MAIN_LOGS.equals(name) ? MAIN_LOG_PATH : artifact.path("path").asText(name);
        return new ArtifactRef(nodeId, name, path);
    }
}
