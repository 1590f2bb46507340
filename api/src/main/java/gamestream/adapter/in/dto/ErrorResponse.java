package gamestream.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body returned by every endpoint: {@code {"error_msg": "..."}}.
 */
public record ErrorResponse(@JsonProperty("error_msg") String errorMessage) {}
