package airdev.devserver.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Run lifecycle status.
 * A run moves from QUEUED to ACTIVE and ends in exactly one terminal status.
 */
public enum RunStatus {
    /** Run registered, process not started yet */
    QUEUED("Queued"),
    /** Process started (or builtin dispatched) */
    ACTIVE("Active"),
    /** Process exited zero and both output streams drained cleanly */
    SUCCEEDED("Succeeded"),
    /** Non-zero exit, start failure or stream failure */
    FAILED("Failed"),
    /** Cancelled by a user while queued or active */
    CANCELLED("Cancelled");

    private final String wireName;

    RunStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }

    @JsonCreator
    public static RunStatus fromWireName(String value) {
        for (RunStatus status : values()) {
            if (status.wireName.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("unknown run status: " + value);
    }
}
