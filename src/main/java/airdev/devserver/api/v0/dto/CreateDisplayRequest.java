package airdev.devserver.api.v0.dto;

import airdev.devserver.model.Display;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * POST /v0/displays/create
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CreateDisplayRequest(@JsonProperty("display") Display display) {

    public void validate() {
        if (display == null || display.kind() == null || display.kind().isBlank()) {
            throw new IllegalArgumentException("display.kind is required");
        }
    }
}
