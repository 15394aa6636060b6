package eu.biodt.connector.api;

import eu.biodt.connector.config.ConnectorConfig;
import eu.biodt.connector.config.ConnectorConfig.RenotifyPolicy;
import eu.biodt.connector.domain.RunRecord;
import eu.biodt.connector.domain.WorkflowRun;
import eu.biodt.connector.orchestration.TransferScheduler;
import eu.biodt.connector.tracker.RunTracker;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;

import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;

/**
 * Receives "workflow finished" notifications, typically from an Argo exit handler.
 * The transfer is scheduled in the background; the caller only learns whether the
 * notification was accepted.
 */
@Path("/notifications")
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public class NotificationResource {

    private static final Logger LOG = Logger.getLogger(NotificationResource.class);

    @Inject
    ConnectorConfig config;

    @Inject
    RunTracker tracker;

    @Inject
    TransferScheduler scheduler;

    @POST
    public Response workflowFinished(NotificationRequest request) {
        if (request == null) {
            return badRequest("Notification body is required");
        }

        WorkflowRun run;
        try {
            run = new WorkflowRun(namespaceOrDefault(request.namespace()), request.name());
        } catch (IllegalArgumentException e) {
            LOG.warnf("Rejected notification: %s", e.getMessage());
            return badRequest(e.getMessage());
        }

        boolean reprocess = config.renotifyPolicy() == RenotifyPolicy.REPROCESS;
        Optional<RunRecord> registered = tracker.register(run, reprocess);
        if (registered.isEmpty()) {
            LOG.infof("Ignoring repeated notification for run %s", run.id());
            return Response.ok(NotificationResponse.duplicate(run)).build();
        }

        try {
            scheduler.submit(registered.get());
        } catch (RejectedExecutionException e) {
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                    .entity(new ErrorResponse("Connector is shutting down, notify again later"))
                    .build();
        }
        LOG.infof("Accepted notification for run %s", run.id());
        return Response.accepted(NotificationResponse.accepted(run)).build();
    }

    private String namespaceOrDefault(String namespace) {
        return namespace == null || namespace.isBlank() ? config.argo().namespace() : namespace;
    }

    private static Response badRequest(String message) {
        return Response.status(Response.Status.BAD_REQUEST)
                .entity(new ErrorResponse(message))
                .build();
    }
}
