package gamestream.adapter.in.rest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import gamestream.adapter.in.dto.ErrorResponse;
import gamestream.core.model.gateway.GatewayResult;

@DisplayName("GatewayResults")
class GatewayResultsTest {

    @Test
    @DisplayName("should render success as 200 with the mapped body")
    void shouldRenderSuccess() {
        var response = GatewayResults.toResponse(
                new GatewayResult.Success<>(List.of("pong")), games -> games.get(0));

        assertEquals(200, response.getStatus());
        assertEquals("pong", response.getEntity());
    }

    @Test
    @DisplayName("should render a disabled gateway as 503")
    void shouldRenderDisabled() {
        var response = GatewayResults.<String>toResponse(
                new GatewayResult.GatewayDisabled<>("no gateway connected"), value -> value);

        assertEquals(503, response.getStatus());
        assertEquals(new ErrorResponse("no gateway connected"), response.getEntity());
    }

    @Test
    @DisplayName("should render invalid input as 400")
    void shouldRenderInvalidInput() {
        var response = GatewayResults.<String>toResponse(new GatewayResult.InvalidInput<>("invalid input"), v -> v);

        assertEquals(400, response.getStatus());
    }

    @Test
    @DisplayName("should render an upstream failure as 500")
    void shouldRenderUpstreamFailure() {
        var response = GatewayResults.<String>toResponse(
                new GatewayResult.UpstreamFailure<>("failed to create session"), v -> v);

        assertEquals(500, response.getStatus());
        var body = assertInstanceOf(ErrorResponse.class, response.getEntity());
        assertEquals("failed to create session", body.errorMessage());
    }

    @Test
    @DisplayName("should render an unreachable gateway as 502")
    void shouldRenderUnavailable() {
        var response = GatewayResults.<String>toResponse(
                new GatewayResult.UpstreamUnavailable<>("gateway unavailable"), v -> v);

        assertEquals(502, response.getStatus());
    }
}
