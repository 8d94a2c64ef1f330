package airdev.devserver.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Declared environment variable: either a literal value or a reference to a config variable.
 * In definition files a bare string is shorthand for a literal.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EnvVarValue(
        @JsonProperty("value") String value,
        @JsonProperty("config") String config) {

    @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
    public EnvVarValue {
        if (value != null && config != null) {
            throw new IllegalArgumentException("env var cannot set both value and config");
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static EnvVarValue of(String value) {
        return new EnvVarValue(value, null);
    }

    public static EnvVarValue fromConfig(String configName) {
        return new EnvVarValue(null, configName);
    }

    public boolean isConfigRef() {
        return config != null;
    }
}
