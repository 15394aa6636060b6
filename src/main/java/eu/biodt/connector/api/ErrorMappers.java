package eu.biodt.connector.api;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

/**
 * Gives request errors raised before a resource method runs the same {@link ErrorResponse}
 * body as the errors the resources return themselves.
 */
public class ErrorMappers {

    private static final Logger LOG = Logger.getLogger(ErrorMappers.class);

    @ServerExceptionMapper({JacksonException.class, MismatchedInputException.class})
    public Response malformedJson(JacksonException e) {
        LOG.debugf("Malformed request body: %s", e.getOriginalMessage());
        return badRequest("Malformed JSON body: " + e.getOriginalMessage());
    }

    @ServerExceptionMapper
    public Response requestFailure(WebApplicationException e) {
        Response response = e.getResponse();
        if (response.getStatus() != Response.Status.BAD_REQUEST.getStatusCode()) {
            return response;
        }
        Throwable cause = e.getCause();
        if (cause instanceof JacksonException) {
            return malformedJson((JacksonException) cause);
        }
        return badRequest(e.getMessage() != null ? e.getMessage() : "Bad request");
    }

    private static Response badRequest(String message) {
        return Response.status(Response.Status.BAD_REQUEST)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(message))
                .build();
    }
}
