package airdev.devserver.model;

import airdev.devserver.util.Json;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RunTest {

    private final Instant now = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void finishStampsMatchingTimestamp() {
        Run run = Run.builder().id("devrun1").createdAt(now).build();
        assertEquals(RunStatus.QUEUED, run.status());

        Run failed = run.finish(RunStatus.FAILED, null, now);
        assertEquals(now, failed.failedAt());
        assertNull(failed.succeededAt());
        assertTrue(failed.isTerminal());

        JsonNode outputs = Json.mapper().createObjectNode().put("a", 1);
        Run succeeded = run.finish(RunStatus.SUCCEEDED, outputs, now);
        assertEquals(now, succeeded.succeededAt());
        assertEquals(outputs, succeeded.outputs());
    }

    @Test
    void finishRejectsNonTerminalStatus() {
        Run run = Run.builder().id("devrun1").createdAt(now).build();
        assertThrows(IllegalArgumentException.class, () -> run.finish(RunStatus.ACTIVE, null, now));
    }

    @Test
    void statusUsesWireNames() throws Exception {
        assertEquals("\"Cancelled\"", Json.mapper().writeValueAsString(RunStatus.CANCELLED));
        assertEquals(RunStatus.ACTIVE, RunStatus.fromWireName("Active"));
        assertEquals(TaskKind.IMAGE, TaskKind.fromWireName("docker"));
    }
}
