package gamestream.core.model.gateway;

/**
 * Thrown when a gateway call fails at the transport level after all retries:
 * connection refused, timeout, TLS handshake failure.
 */
public class GatewayUnavailableException extends RuntimeException {

    public GatewayUnavailableException(String message) {
        super(message);
    }

    public GatewayUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
