package gamestream.adapter.in.problem;

import static org.junit.jupiter.api.Assertions.assertEquals;

import jakarta.ws.rs.NotFoundException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import gamestream.adapter.in.dto.ErrorResponse;
import gamestream.core.model.gateway.GatewayUnavailableException;

@DisplayName("GlobalExceptionMappers")
class GlobalExceptionMappersTest {

    private final GlobalExceptionMappers mappers = new GlobalExceptionMappers();

    @Test
    @DisplayName("should map an unreachable gateway to 502 without leaking the cause")
    void shouldMapGatewayUnavailable() {
        var response = mappers.mapGatewayUnavailable(
                new GatewayUnavailableException("Gateway call GET /1.0/applications/ failed: Connection refused"));

        assertEquals(502, response.getStatus());
        assertEquals(new ErrorResponse("gateway unavailable"), response.getEntity());
    }

    @Test
    @DisplayName("should map illegal arguments to 400")
    void shouldMapIllegalArgument() {
        var response = mappers.mapIllegalArgumentException(new IllegalArgumentException("app must not be empty"));

        assertEquals(400, response.getStatus());
        assertEquals(new ErrorResponse("invalid input"), response.getEntity());
    }

    @Test
    @DisplayName("should map illegal state to 500")
    void shouldMapIllegalState() {
        var response = mappers.mapIllegalStateException(new IllegalStateException("boom"));

        assertEquals(500, response.getStatus());
        assertEquals(new ErrorResponse("internal error"), response.getEntity());
    }

    @Test
    @DisplayName("should map any other runtime exception to 500")
    void shouldMapUnexpectedException() {
        var response = mappers.mapUnexpected(new NullPointerException("metadata"));

        assertEquals(500, response.getStatus());
        assertEquals(new ErrorResponse("internal error"), response.getEntity());
    }

    @Test
    @DisplayName("should keep the response carried by JAX-RS exceptions")
    void shouldKeepWebApplicationResponses() {
        var response = mappers.mapUnexpected(new NotFoundException());

        assertEquals(404, response.getStatus());
    }
}
