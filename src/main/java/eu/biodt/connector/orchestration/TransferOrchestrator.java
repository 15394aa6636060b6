package eu.biodt.connector.orchestration;

import eu.biodt.connector.config.ConnectorConfig;
import eu.biodt.connector.domain.Artifact;
import eu.biodt.connector.domain.RunSummary;
import eu.biodt.connector.domain.TransferOutcome;
import eu.biodt.connector.domain.TransferOutcome.ErrorKind;
import eu.biodt.connector.domain.TransferOutcome.SkipReason;
import eu.biodt.connector.domain.WorkflowRun;
import eu.biodt.connector.sink.ArtifactUpload;
import eu.biodt.connector.sink.ObjectSink;
import eu.biodt.connector.sink.SinkException;
import eu.biodt.connector.source.ArtifactSource;
import eu.biodt.connector.source.RunNotFoundException;
import eu.biodt.connector.source.SourceUnavailableException;
import eu.biodt.connector.util.ArtifactSpool;
import eu.biodt.connector.util.MediaTypes;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Orchestrates the transfer of one run's artifacts from source to sink.
 * Handles the main flow: list → size filter → spool → store, one artifact at a time.
 * A failing artifact is recorded and the run moves on to the next one.
 */
@ApplicationScoped
public class TransferOrchestrator {

    private static final Logger LOG = Logger.getLogger(TransferOrchestrator.class);

    private final ArtifactSource source;
    private final ObjectSink sink;
    private final long maxArtifactSizeBytes;
    private final Path spoolDirectory;
    private final boolean createDataset;

    @Inject
    public TransferOrchestrator(ArtifactSource source, ObjectSink sink, ConnectorConfig config) {
        this(
                source,
                sink,
                config.transfer().maxArtifactSize(),
                config.transfer().spoolDir()
                        .map(Path::of)
                        .orElse(Path.of(System.getProperty("java.io.tmpdir"))),
                config.cordra().createDataset()
        );
    }

    TransferOrchestrator(ArtifactSource source, ObjectSink sink, long maxArtifactSizeBytes,
                         Path spoolDirectory, boolean createDataset) {
        this.source = source;
        this.sink = sink;
        this.maxArtifactSizeBytes = maxArtifactSizeBytes;
        this.spoolDirectory = spoolDirectory;
        this.createDataset = createDataset;
    }

    /**
     * Transfer every artifact of the run. Source failures abort the run before any artifact
     * is processed; everything after that ends up as an outcome in the summary.
     */
    public RunSummary run(WorkflowRun run) throws RunNotFoundException, SourceUnavailableException {
        LOG.infof("Starting transfer for run: %s", run.id());
        List<TransferOutcome> outcomes = new ArrayList<>();

        try (Stream<Artifact> artifacts = source.list(run)) {
            artifacts.forEach(artifact -> outcomes.add(processArtifact(run, artifact)));
        }

        RunSummary summary = RunSummary.of(run, outcomes);
        if (createDataset && summary.stored() > 0) {
            summary = groupIntoDataset(summary);
        }

        LOG.infof("Transfer complete for run %s: %d stored, %d skipped, %d failed",
                run.id(), summary.stored(), summary.skipped(), summary.failed());
        return summary;
    }

    private TransferOutcome processArtifact(WorkflowRun run, Artifact artifact) {
        LOG.debugf("Processing artifact %s of run %s", artifact.name(), run.id());
        try {
            return transfer(artifact);
        } catch (SinkException e) {
            LOG.warnf("Failed to store %s of run %s: %s", artifact.name(), run.id(), e.getMessage());
            return TransferOutcome.failed(artifact.name(), e.kind(), e.getMessage());
        } catch (IOException e) {
            LOG.warnf("Failed to read %s of run %s: %s", artifact.name(), run.id(), e.getMessage());
            return TransferOutcome.failed(artifact.name(), ErrorKind.SOURCE_READ, e.getMessage());
        } catch (RuntimeException e) {
            LOG.errorf(e, "Unexpected failure transferring %s of run %s", artifact.name(), run.id());
            return TransferOutcome.failed(artifact.name(), ErrorKind.INTERNAL, e.toString());
        } finally {
            release(artifact);
        }
    }

    private TransferOutcome transfer(Artifact artifact) throws IOException, SinkException {
        // Pre-check when the size is announced, so oversized bodies are never downloaded
        if (!SizeFilter.allow(artifact.sizeBytes(), maxArtifactSizeBytes)) {
            return skipTooLarge(artifact, artifact.sizeBytes());
        }

        // the body stream is released together with the artifact
        ArtifactSpool spool = ArtifactSpool.spool(
                artifact.content().open(), spoolDirectory, artifact.fileName(), maxArtifactSizeBytes);
        try {
            if (spool.exceeded() || !SizeFilter.allow(spool.sizeBytes(), maxArtifactSizeBytes)) {
                return skipTooLarge(artifact, spool.sizeBytes());
            }

            String encodingFormat = MediaTypes.resolve(artifact.contentType(), artifact.fileName(), spool.file());
            ArtifactUpload upload = new ArtifactUpload(artifact.name(), spool.file(), spool.sizeBytes(), encodingFormat);
            String objectId = sink.create(upload);

            LOG.infof("Stored %s → %s (%d bytes)", artifact.name(), objectId, spool.sizeBytes());
            return TransferOutcome.stored(artifact.name(), objectId, spool.sizeBytes());
        } finally {
            discard(spool);
        }
    }

    private TransferOutcome skipTooLarge(Artifact artifact, long sizeBytes) {
        LOG.infof("Skipping %s: %d bytes exceeds maximum of %d bytes",
                artifact.name(), sizeBytes, maxArtifactSizeBytes);
        return TransferOutcome.skipped(artifact.name(), SkipReason.SIZE_EXCEEDED);
    }

    private RunSummary groupIntoDataset(RunSummary summary) {
        String datasetId;
        try {
            datasetId = sink.createDataset(summary.run(), summary.storedObjectIds());
        } catch (SinkException e) {
            LOG.warnf("Failed to create dataset for run %s: %s", summary.run().id(), e.getMessage());
            return summary.withDataset(null, e.getMessage());
        }

        // the dataset lists its parts; each part also points back at the dataset
        int unlinked = 0;
        String lastError = null;
        for (String objectId : summary.storedObjectIds()) {
            try {
                sink.linkToDataset(objectId, datasetId);
            } catch (SinkException e) {
                LOG.warnf("Failed to link %s to dataset %s: %s", objectId, datasetId, e.getMessage());
                unlinked++;
                lastError = e.getMessage();
            }
        }

        LOG.infof("Grouped %d objects of run %s into dataset %s", summary.stored(), summary.run().id(), datasetId);
        if (unlinked > 0) {
            return summary.withDataset(datasetId, String.format("Could not link %d of %d objects to dataset %s: %s",
                    unlinked, summary.stored(), datasetId, lastError));
        }
        return summary.withDataset(datasetId, null);
    }

    private void release(Artifact artifact) {
        try {
            artifact.close();
        } catch (IOException e) {
            LOG.debugf(e, "Failed to release artifact %s", artifact.name());
        }
    }

    private void discard(ArtifactSpool spool) {
        try {
            spool.close();
        } catch (IOException e) {
            LOG.warnf("Failed to delete spool file %s: %s", spool.file(), e.getMessage());
        }
    }
}
