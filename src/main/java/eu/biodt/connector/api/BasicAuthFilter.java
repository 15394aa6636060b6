package eu.biodt.connector.api;

import eu.biodt.connector.config.ConnectorConfig;
import eu.biodt.connector.util.HttpClients;
import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;

/**
 * Requires HTTP Basic credentials on every endpoint when both
 * {@code connector.auth.username} and {@code connector.auth.password} are set.
 */
@Provider
@Priority(Priorities.AUTHENTICATION)
public class BasicAuthFilter implements ContainerRequestFilter {

    private static final Logger LOG = Logger.getLogger(BasicAuthFilter.class);

    @Inject
    ConnectorConfig config;

    @Override
    public void filter(ContainerRequestContext requestContext) {
        Optional<String> username = config.auth().username();
        Optional<String> password = config.auth().password();
        if (username.isEmpty() || password.isEmpty()) {
            return;
        }

        String expected = HttpClients.basicAuth(username.get(), password.get());
        String actual = requestContext.getHeaderString(HttpHeaders.AUTHORIZATION);
        if (actual != null && MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), actual.getBytes(StandardCharsets.UTF_8))) {
            return;
        }

        LOG.debugf("Rejected unauthenticated request to %s", requestContext.getUriInfo().getPath());
        requestContext.abortWith(Response.status(Response.Status.UNAUTHORIZED)
                .header(HttpHeaders.WWW_AUTHENTICATE, "Basic realm=\"argo-cordra-connector\"")
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse("Authentication required"))
                .build());
    }
}
