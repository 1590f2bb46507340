package gamestream.adapter.in.problem;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.Response.Status;

import gamestream.adapter.in.dto.ErrorResponse;

/**
 * Factory for error responses.
 *
 * <p>Clients read the failure class from the status code and show {@code error_msg}
 * to the user, so the body never carries exception details.
 */
public final class GatewayProblem {

    private GatewayProblem() {
        // Utility class - prevent instantiation
    }

    public static Response badRequest(String message) {
        return of(Status.BAD_REQUEST, message);
    }

    public static Response internalError(String message) {
        return of(Status.INTERNAL_SERVER_ERROR, message);
    }

    public static Response badGateway(String message) {
        return of(Status.BAD_GATEWAY, message);
    }

    public static Response serviceUnavailable(String message) {
        return of(Status.SERVICE_UNAVAILABLE, message);
    }

    private static Response of(Status status, String message) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(message))
                .build();
    }
}
