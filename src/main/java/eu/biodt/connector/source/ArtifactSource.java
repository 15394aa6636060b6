package eu.biodt.connector.source;

import eu.biodt.connector.domain.Artifact;
import eu.biodt.connector.domain.WorkflowRun;

import java.util.stream.Stream;

public interface ArtifactSource {
    Stream<Artifact> list(WorkflowRun run) throws RunNotFoundException, SourceUnavailableException;
}
