package gamestream.core.model.gateway;

import java.util.List;
import java.util.Map;

/**
 * Raw transport response from the gateway, before the envelope is decoded.
 */
public record GatewayCallResponse(int statusCode, Map<String, List<String>> headers, byte[] body) {
    public GatewayCallResponse {
        if (headers == null) {
            headers = Map.of();
        }
        if (body == null) {
            body = new byte[0];
        }
    }
}
