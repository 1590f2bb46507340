package gamestream.adapter.in.rest;

import java.io.IOException;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import gamestream.core.port.in.SessionUseCase;

/**
 * Starts streaming sessions.
 *
 * <p>{@code POST /1.0/sessions/} with {@code {"game": "<name>"}} answers with the session
 * metadata returned by the gateway. The body is read raw so that a missing or malformed
 * body is reported as {@code invalid input} rather than a framework error, and only after
 * the gateway-enabled check.
 */
@Path("/1.0/sessions")
@ApplicationScoped
public class SessionResource {

    private static final Logger LOG = Logger.getLogger(SessionResource.class);

    private final SessionUseCase sessionUseCase;
    private final ObjectMapper objectMapper;

    @Inject
    public SessionResource(SessionUseCase sessionUseCase, ObjectMapper objectMapper) {
        this.sessionUseCase = sessionUseCase;
        this.objectMapper = objectMapper;
    }

    @POST
    @Path("/")
    @Produces(MediaType.APPLICATION_JSON)
    public Uni<Response> createSession(byte[] body) {
        return sessionUseCase
                .createSession(parse(body))
                .map(result -> GatewayResults.toResponse(result, session -> session));
    }

    private Optional<JsonNode> parse(byte[] body) {
        if (body == null || body.length == 0) {
            return Optional.empty();
        }

        try {
            return Optional.ofNullable(objectMapper.readTree(body));
        } catch (IOException e) {
            LOG.debugv("Rejecting session request with malformed body: {0}", e.getMessage());
            return Optional.empty();
        }
    }
}
