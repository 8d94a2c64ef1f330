package airdev.devserver.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One line of task output as delivered to log subscribers.
 * Ordered by (timestamp, insertId); insertId is monotonic per run.
 */
public record LogItem(
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("insertID") long insertId,
        @JsonProperty("text") String text,
        @JsonProperty("level") LogLevel level,
        @JsonProperty("taskSlug") String taskSlug) {
}
