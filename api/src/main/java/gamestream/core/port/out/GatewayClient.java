package gamestream.core.port.out;

import java.util.Map;

import io.smallrye.mutiny.Uni;

import gamestream.core.model.gateway.GatewayCallResponse;
import gamestream.core.model.gateway.GatewayResponse;
import gamestream.core.model.gateway.GatewaySessionRequest;

/**
 * Port for calling the upstream gateway.
 *
 * <p>Every call carries {@code Authorization: macaroon root=<token>} and
 * {@code Content-Type: application/json}. Safe methods (GET, HEAD, OPTIONS) are
 * retried on transport failures and retryable statuses; POST never is.
 *
 * <p>Transport failures that survive the retries fail the returned {@link Uni} with
 * {@link gamestream.core.model.gateway.GatewayUnavailableException}. Non-2xx statuses
 * are not failures.
 */
public interface GatewayClient {

    /**
     * Send a request to the gateway without interpreting the response.
     *
     * @param method HTTP method
     * @param path path appended to the gateway base URL
     * @param headers extra headers; authorization and content type are always overwritten
     * @param body a value to encode as JSON, raw {@code byte[]}, or null for no body
     * @return the raw response
     */
    Uni<GatewayCallResponse> makeRequest(String method, String path, Map<String, String> headers, Object body);

    /**
     * {@code POST /1.0/sessions}.
     */
    Uni<GatewayResponse> createSession(GatewaySessionRequest request);

    /**
     * {@code GET /1.0/applications/}.
     */
    Uni<GatewayResponse> listApplications();
}
