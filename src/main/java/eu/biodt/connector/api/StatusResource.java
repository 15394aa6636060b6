package eu.biodt.connector.api;

import eu.biodt.connector.source.ArgoArtifactSource;
import eu.biodt.connector.source.SourceHealth;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

@Path("/status")
@Produces(MediaType.APPLICATION_JSON)
public class StatusResource {

    @Inject
    ArgoArtifactSource argo;

    @GET
    public StatusResponse status() {
        return new StatusResponse(argo.checkHealth());
    }

    public record StatusResponse(SourceHealth argo) {
    }
}
