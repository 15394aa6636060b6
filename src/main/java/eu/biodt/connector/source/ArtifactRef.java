package eu.biodt.connector.source;

/**
 * An output artifact named in a workflow's status, before anything is downloaded.
 */
public record ArtifactRef(
        String nodeId,
        String artifactName,
        String path
) {
    public ArtifactRef {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("nodeId cannot be blank");
        }
        if (artifactName == null || artifactName.isBlank()) {
            throw new IllegalArgumentException("artifactName cannot be blank");
        }
        path = path == null ? artifactName : stripLeadingSlashes(path);
    }

    /**
     * Path of the artifact relative to the run: the node id followed by its path.
     */
    public String relativePath() {
        return nodeId + "/" + path;
    }

    private static String stripLeadingSlashes(String path) {
        int start = 0;
        while (start < path.length() && path.charAt(start) == '/') {
            start++;
        }
        return path.substring(start);
    }
}
