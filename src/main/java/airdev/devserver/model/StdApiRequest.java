package airdev.devserver.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Request handed to the builtins binary: which builtin function to call and with which arguments.
 */
public record StdApiRequest(
        @JsonProperty("namespace") String namespace,
        @JsonProperty("name") String name,
        @JsonProperty("request") Map<String, Object> request) {
}
