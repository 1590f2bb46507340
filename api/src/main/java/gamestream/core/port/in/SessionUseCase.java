package gamestream.core.port.in;

import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import io.smallrye.mutiny.Uni;

import gamestream.core.model.gateway.GatewayResult;

/**
 * Use case for starting a streaming session on the gateway.
 */
public interface SessionUseCase {

    /**
     * Create a session for the game named in the request body.
     *
     * @param body the parsed request body, empty if absent or not valid JSON
     * @return the session metadata returned by the gateway, or the reason it could not be created
     */
    Uni<GatewayResult<JsonNode>> createSession(Optional<JsonNode> body);
}
