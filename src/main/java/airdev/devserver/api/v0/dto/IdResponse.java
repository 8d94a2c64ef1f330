package airdev.devserver.api.v0.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Id of a created prompt or display.
 */
public record IdResponse(@JsonProperty("id") String id) {
}
