package gamestream.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;

import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import gamestream.core.model.gateway.GatewayUnavailableException;

/**
 * Global exception mappers so that failures escaping a resource still answer with an
 * {@code error_msg} body instead of a stack trace.
 *
 * <p>{@link IllegalArgumentException} is reserved for rejected client input. Server-side
 * faults use {@link IllegalStateException} or any other runtime exception and answer 500.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);

    static final String INTERNAL_ERROR = "internal error";
    static final String GATEWAY_UNAVAILABLE = "gateway unavailable";
    static final String INVALID_INPUT = "invalid input";

    @ServerExceptionMapper
    public Response mapGatewayUnavailable(GatewayUnavailableException e) {
        LOG.warnv("Gateway unavailable: {0}", e.getMessage());
        return GatewayProblem.badGateway(GATEWAY_UNAVAILABLE);
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return GatewayProblem.badRequest(INVALID_INPUT);
    }

    @ServerExceptionMapper
    public Response mapIllegalStateException(IllegalStateException e) {
        LOG.errorv(e, "Unexpected state: {0}", e.getMessage());
        return GatewayProblem.internalError(INTERNAL_ERROR);
    }

    /**
     * Anything else a resource lets escape. JAX-RS exceptions keep the response they carry,
     * so framework 404/405/415 answers are unchanged.
     */
    @ServerExceptionMapper
    public Response mapUnexpected(RuntimeException e) {
        if (e instanceof WebApplicationException webApplicationException) {
            return webApplicationException.getResponse();
        }
        LOG.errorv(e, "Unexpected error: {0}", e.toString());
        return GatewayProblem.internalError(INTERNAL_ERROR);
    }
}
