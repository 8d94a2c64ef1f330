package airdev.devserver.api.dev.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Env var override kept in the dev config file.
 * POST /dev/envVars/upsert, POST /dev/envVars/delete (value ignored)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EnvVarDto(
        @JsonProperty("name") String name,
        @JsonProperty("value") String value) {
}
