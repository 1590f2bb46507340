package gamestream.core.model.gateway;

/**
 * Outcome of a gateway-backed use case.
 *
 * @param <T> the success payload
 */
public sealed interface GatewayResult<T> {

    record Success<T>(T value) implements GatewayResult<T> {}

    /** Gateway URL or token not configured. */
    record GatewayDisabled<T>(String reason) implements GatewayResult<T> {}

    /** Client input rejected before any gateway call. */
    record InvalidInput<T>(String reason) implements GatewayResult<T> {}

    /** Gateway answered, but not with the expected status or shape. */
    record UpstreamFailure<T>(String reason) implements GatewayResult<T> {}

    /** Gateway could not be reached, retries included. */
    record UpstreamUnavailable<T>(String reason) implements GatewayResult<T> {}
}
