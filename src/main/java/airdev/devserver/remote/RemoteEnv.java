package airdev.devserver.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Environment on the remote platform, or the single local one.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteEnv(
        @JsonProperty("id") String id,
        @JsonProperty("slug") String slug,
        @JsonProperty("name") String name,
        @JsonProperty("default") boolean isDefault) {

    public static final String STUDIO_ENV_ID = "studio";

    /** The environment every local run executes in. */
    public static RemoteEnv studio() {
        return new RemoteEnv(STUDIO_ENV_ID, STUDIO_ENV_ID, STUDIO_ENV_ID, true);
    }
}
