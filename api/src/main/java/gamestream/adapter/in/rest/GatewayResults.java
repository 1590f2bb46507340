package gamestream.adapter.in.rest;

import java.util.function.Function;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import gamestream.adapter.in.problem.GatewayProblem;
import gamestream.core.model.gateway.GatewayResult;

/**
 * Maps use case outcomes to HTTP responses.
 *
 * <ul>
 *   <li>Success: 200 with the rendered body</li>
 *   <li>GatewayDisabled: 503</li>
 *   <li>InvalidInput: 400</li>
 *   <li>UpstreamFailure: 500</li>
 *   <li>UpstreamUnavailable: 502</li>
 * </ul>
 */
final class GatewayResults {

    private GatewayResults() {}

    static <T> Response toResponse(GatewayResult<T> result, Function<T, Object> body) {
        if (result instanceof GatewayResult.Success<T> success) {
            return Response.ok(body.apply(success.value()), MediaType.APPLICATION_JSON_TYPE)
                    .build();
        }
        if (result instanceof GatewayResult.GatewayDisabled<T> disabled) {
            return GatewayProblem.serviceUnavailable(disabled.reason());
        }
        if (result instanceof GatewayResult.InvalidInput<T> invalid) {
            return GatewayProblem.badRequest(invalid.reason());
        }
        if (result instanceof GatewayResult.UpstreamFailure<T> failure) {
            return GatewayProblem.internalError(failure.reason());
        }
        if (result instanceof GatewayResult.UpstreamUnavailable<T> unavailable) {
            return GatewayProblem.badGateway(unavailable.reason());
        }
        throw new IllegalStateException("Unhandled gateway result: " + result);
    }
}
