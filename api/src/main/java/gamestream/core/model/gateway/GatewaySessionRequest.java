package gamestream.core.model.gateway;

import java.util.Objects;

/**
 * Body of {@code POST /1.0/sessions} on the gateway.
 *
 * @param app application name as registered on the gateway, never empty
 * @param joinable whether other clients may join the session
 * @param screen display settings of the streamed session
 */
public record GatewaySessionRequest(String app, boolean joinable, Screen screen) {

    public GatewaySessionRequest {
        if (app == null || app.isEmpty()) {
            throw new IllegalArgumentException("Session app must not be empty");
        }
        Objects.requireNonNull(screen, "screen");
    }

    /**
     * Session for a single player with the default screen.
     */
    public static GatewaySessionRequest forGame(String game) {
        return new GatewaySessionRequest(game, false, Screen.DEFAULT);
    }

    public record Screen(int width, int height, int fps) {

        public static final Screen DEFAULT = new Screen(1280, 720, 60);
    }
}
