package gamestream.core.model.gateway;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("GatewayResponse")
class GatewayResponseTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private GatewayResponse decode(String json) throws Exception {
        return GatewayResponse.fromJson(mapper.readTree(json));
    }

    @Test
    @DisplayName("should decode status code and metadata")
    void shouldDecodeStatusAndMetadata() throws Exception {
        var response = decode("{\"status_code\": 201, \"metadata\": {\"id\": \"abc\"}}");

        assertTrue(response.hasStatus(201));
        assertEquals("abc", response.metadata().orElseThrow().get("id").asText());
    }

    @Test
    @DisplayName("should report missing status code")
    void shouldReportMissingStatus() throws Exception {
        var response = decode("{\"metadata\": []}");

        assertTrue(response.statusCode().isEmpty());
        assertFalse(response.hasStatus(200));
    }

    @Test
    @DisplayName("should not accept a status code given as a string")
    void shouldRejectTextualStatus() throws Exception {
        var response = decode("{\"status_code\": \"200\"}");

        assertTrue(response.statusCode().isEmpty());
    }

    @Test
    @DisplayName("should not accept a status code outside the int range")
    void shouldRejectOversizedStatus() throws Exception {
        // 2^32 + 201 would narrow to 201
        var response = decode("{\"status_code\": 4294967497, \"metadata\": {\"id\": \"abc\"}}");
        var huge = decode("{\"status_code\": 123456789012345678901234567890}");

        assertTrue(response.statusCode().isEmpty());
        assertFalse(response.hasStatus(201));
        assertTrue(huge.statusCode().isEmpty());
    }

    @Test
    @DisplayName("should treat JSON null metadata as absent")
    void shouldTreatNullMetadataAsAbsent() throws Exception {
        var response = decode("{\"status_code\": 200, \"metadata\": null}");

        assertTrue(response.hasStatus(200));
        assertTrue(response.metadata().isEmpty());
    }

    @Test
    @DisplayName("should decode a non-object document as empty")
    void shouldDecodeNonObjectAsEmpty() throws Exception {
        assertEquals(GatewayResponse.empty(), decode("[1, 2, 3]"));
        assertEquals(GatewayResponse.empty(), GatewayResponse.fromJson((JsonNode) null));
    }
}
