package com.codeheadsystems.hivemind.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param accepted always true; failures are reported as HTTP errors
 * @param message  the stored message
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MessagePostResponse(
    @JsonProperty("accepted") boolean accepted,
    @JsonProperty("message") HiveMessage message) {
}
