package gamestream.core.model.gateway;

import java.util.Optional;
import java.util.OptionalInt;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Decoded envelope of every gateway response: {@code {"status_code": ..., "metadata": ...}}.
 *
 * <p>Both fields are optional because the gateway contract is not enforced on the wire.
 * {@code metadata} must only be read once {@link #hasStatus(int)} confirmed success.
 *
 * @param statusCode the {@code status_code} field, if present and an integer in {@code int} range
 * @param metadata the {@code metadata} field, if present and not JSON null
 */
public record GatewayResponse(OptionalInt statusCode, Optional<JsonNode> metadata) {

    static final String STATUS_CODE_FIELD = "status_code";
    static final String METADATA_FIELD = "metadata";

    public GatewayResponse {
        if (statusCode == null) {
            statusCode = OptionalInt.empty();
        }
        if (metadata == null) {
            metadata = Optional.empty();
        }
    }

    public static GatewayResponse empty() {
        return new GatewayResponse(OptionalInt.empty(), Optional.empty());
    }

    /**
     * Decode the envelope from a parsed JSON document.
     *
     * <p>Anything other than a JSON object yields {@link #empty()}.
     */
    public static GatewayResponse fromJson(JsonNode root) {
        if (root == null || !root.isObject()) {
            return empty();
        }

        var status = root.get(STATUS_CODE_FIELD);
        var statusCode = status != null && status.isIntegralNumber() && status.canConvertToInt()
                ? OptionalInt.of(status.intValue())
                : OptionalInt.empty();

        var metadata = root.get(METADATA_FIELD);
        return new GatewayResponse(
                statusCode, metadata == null || metadata.isNull() ? Optional.empty() : Optional.of(metadata));
    }

    public boolean hasStatus(int expected) {
        return statusCode.isPresent() && statusCode.getAsInt() == expected;
    }
}
