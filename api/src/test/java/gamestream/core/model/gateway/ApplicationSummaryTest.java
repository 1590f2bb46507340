package gamestream.core.model.gateway;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ApplicationSummary")
class ApplicationSummaryTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("should keep named entries in order and skip the rest")
    void shouldSkipEntriesWithoutName() throws Exception {
        var metadata = mapper.readTree("[{\"name\": \"a\"}, {\"x\": 1}, {\"name\": \"b\"}]");

        var applications = ApplicationSummary.fromMetadata(metadata);

        assertEquals(List.of(new ApplicationSummary("a"), new ApplicationSummary("b")), applications);
    }

    @Test
    @DisplayName("should keep duplicate names")
    void shouldKeepDuplicates() throws Exception {
        var metadata = mapper.readTree("[{\"name\": \"pong\"}, {\"name\": \"pong\"}]");

        assertEquals(2, ApplicationSummary.fromMetadata(metadata).size());
    }

    @Test
    @DisplayName("should skip non-object entries and null names")
    void shouldSkipMalformedEntries() throws Exception {
        var metadata = mapper.readTree("[\"name\", 42, {\"name\": null}, {\"name\": {\"first\": \"x\"}}]");

        assertTrue(ApplicationSummary.fromMetadata(metadata).isEmpty());
    }

    @Test
    @DisplayName("should return an empty list for an empty array")
    void shouldHandleEmptyArray() throws Exception {
        assertTrue(ApplicationSummary.fromMetadata(mapper.readTree("[]")).isEmpty());
    }
}
