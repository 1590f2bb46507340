package gamestream.core.model.gateway;

/**
 * Connection details for the upstream gateway.
 *
 * <p>Built once at startup and shared read-only. The gateway is enabled only when
 * both values are non-blank; otherwise every gateway-backed endpoint answers 503
 * without touching the network.
 *
 * @param baseUrl gateway base URL, without trailing slash
 * @param token macaroon token forwarded verbatim
 */
public record GatewayCredentials(String baseUrl, String token) {

    private static final String AUTHORIZATION_SCHEME = "macaroon root=";

    public GatewayCredentials {
        baseUrl = baseUrl == null ? "" : stripTrailingSlash(baseUrl.strip());
        token = token == null ? "" : token.strip();
    }

    public static GatewayCredentials disabled() {
        return new GatewayCredentials("", "");
    }

    public boolean enabled() {
        return !baseUrl.isEmpty() && !token.isEmpty();
    }

    /**
     * Value of the {@code Authorization} header sent on every gateway call.
     */
    public String authorizationHeader() {
        return AUTHORIZATION_SCHEME + token;
    }

    public String resolve(String path) {
        return baseUrl + path;
    }

    @Override
    public String toString() {
        return "GatewayCredentials[baseUrl=" + baseUrl + ", token=" + (token.isEmpty() ? "<none>" : "<redacted>") + "]";
    }

    private static String stripTrailingSlash(String url) {
        var end = url.length();
        while (end > 0 && url.charAt(end - 1) == '/') {
            end--;
        }
        return url.substring(0, end);
    }
}
