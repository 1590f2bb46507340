package gamestream.core.port.out;

import gamestream.core.model.gateway.GatewayResult;

/**
 * Port interface for recording gateway metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface Metrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record a completed gateway call, one per attempt.
     *
     * @param method the HTTP method
     * @param path the gateway path
     * @param statusCode the response status code
     * @param latencyMs latency in milliseconds
     */
    void recordGatewayCall(String method, String path, int statusCode, long latencyMs);

    /**
     * Record a retry of a gateway call.
     *
     * @param method the HTTP method
     * @param path the gateway path
     * @param attempt the retry number, starting at 1
     */
    void recordRetry(String method, String path, int attempt);

    /**
     * Record a transport failure that exhausted the retries.
     *
     * @param method the HTTP method
     * @param path the gateway path
     * @param errorType simple name of the failure
     */
    void recordFailure(String method, String path, String errorType);

    /**
     * Record the outcome of a use case.
     *
     * @param operation the use case name
     * @param result the outcome
     */
    void recordResult(String operation, GatewayResult<?> result);
}
