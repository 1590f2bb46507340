package gamestream.adapter.in.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import gamestream.core.model.gateway.GatewayCredentials;

@DisplayName("GatewayHealthCheck")
class GatewayHealthCheckTest {

    @Test
    @DisplayName("should return UP when the gateway is configured")
    void shouldReturnUpWhenConfigured() {
        var healthCheck = new GatewayHealthCheck(new GatewayCredentials("https://gateway:4000/", "AgEU"));

        HealthCheckResponse response = healthCheck.call();

        assertEquals("gateway", response.getName());
        assertEquals(HealthCheckResponse.Status.UP, response.getStatus());
        var data = response.getData().orElseThrow();
        assertEquals(true, data.get("configured"));
        assertEquals("https://gateway:4000", data.get("base-url"));
    }

    @Test
    @DisplayName("should return DOWN when the token is missing")
    void shouldReturnDownWithoutToken() {
        var healthCheck = new GatewayHealthCheck(new GatewayCredentials("https://gateway:4000", " "));

        HealthCheckResponse response = healthCheck.call();

        assertEquals(HealthCheckResponse.Status.DOWN, response.getStatus());
        assertEquals(false, response.getData().orElseThrow().get("configured"));
    }

    @Test
    @DisplayName("should not report a base URL when none is configured")
    void shouldOmitMissingBaseUrl() {
        var healthCheck = new GatewayHealthCheck(GatewayCredentials.disabled());

        HealthCheckResponse response = healthCheck.call();

        assertEquals(HealthCheckResponse.Status.DOWN, response.getStatus());
        assertTrue(response.getData().isPresent());
        assertFalse(response.getData().get().containsKey("base-url"));
    }
}
