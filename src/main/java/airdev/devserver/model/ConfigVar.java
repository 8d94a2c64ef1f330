package airdev.devserver.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Named config variable, either defined in the dev config file or fetched from a remote env.
 * Remote secrets arrive without their value and are decrypted on demand.
 */
public record ConfigVar(
        @JsonProperty("name") String name,
        @JsonProperty("value") String value,
        @JsonProperty("isSecret") boolean secret,
        @JsonProperty("remote") boolean remote,
        @JsonProperty("envSlug") String envSlug) {

    public static ConfigVar local(String name, String value) {
        return new ConfigVar(name, value, false, false, null);
    }

    public static ConfigVar remote(String name, String value, boolean secret, String envSlug) {
        return new ConfigVar(name, value, secret, true, envSlug);
    }
}
