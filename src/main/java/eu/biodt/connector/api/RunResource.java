package eu.biodt.connector.api;

import eu.biodt.connector.domain.RunRecord;
import eu.biodt.connector.domain.WorkflowRun;
import eu.biodt.connector.tracker.RunTracker;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.List;

/**
 * Read-only view of notified runs and their transfer summaries.
 */
@Path("/runs")
@Produces(MediaType.APPLICATION_JSON)
public class RunResource {

    @Inject
    RunTracker tracker;

    @GET
    public List<RunRecord> list() {
        return tracker.findAll();
    }

    @GET
    @Path("/{namespace}/{name}")
    public Response get(@PathParam("namespace") String namespace, @PathParam("name") String name) {
        WorkflowRun run;
        try {
            run = new WorkflowRun(namespace, name);
        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(new ErrorResponse(e.getMessage()))
                    .build();
        }

        return tracker.find(run)
                .map(rec -> Response.ok(rec).build())
                .orElseGet(() -> Response.status(Response.Status.NOT_FOUND)
                        .entity(new ErrorResponse("Unknown run: " + run.id()))
                        .build());
    }
}
