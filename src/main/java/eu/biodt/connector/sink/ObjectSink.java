package eu.biodt.connector.sink;

import eu.biodt.connector.domain.WorkflowRun;

import java.util.List;

public interface ObjectSink {

    /**
     * Create a file object from the upload and return its repository id.
     */
    String create(ArtifactUpload upload) throws SinkException;

    /**
     * Create a dataset object grouping previously stored objects of a run.
     */
    String createDataset(WorkflowRun run, List<String> partIds) throws SinkException;

    /**
     * Record on a stored object that it is part of the dataset. Linking twice is harmless.
     */
    void linkToDataset(String objectId, String datasetId) throws SinkException;
}
