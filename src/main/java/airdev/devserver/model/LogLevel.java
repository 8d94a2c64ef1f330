package airdev.devserver.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Level attached to each recorded log line.
 */
public enum LogLevel {
    DEBUG("debug"),
    INFO("info"),
    WARN("warn");

    private final String wireName;

    LogLevel(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
