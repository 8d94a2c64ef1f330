package airdev.devserver.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Task runtime kind as declared in a task definition.
 */
public enum TaskKind {
    SHELL("shell"),
    PYTHON("python"),
    NODE("node"),
    SQL("sql"),
    REST("rest"),
    IMAGE("image"),
    /** Platform-provided task addressed by an {@code airplane:} slug */
    BUILTIN("builtin");

    private final String wireName;

    TaskKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static TaskKind fromWireName(String value) {
        for (TaskKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        if ("docker".equalsIgnoreCase(value)) {
            return IMAGE;
        }
        throw new IllegalArgumentException("unknown task kind: " + value);
    }
}
