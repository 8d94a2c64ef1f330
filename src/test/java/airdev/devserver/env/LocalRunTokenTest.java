package airdev.devserver.env;

import org.junit.jupiter.api.Test;

import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class LocalRunTokenTest {

    @Test
    void tokenCarriesRunId() {
        String token = LocalRunToken.encode("devrun123");
        assertEquals(3, token.split("\\.", -1).length);
        assertEquals("devrun123", LocalRunToken.parseRunId(token).orElseThrow());
        assertEquals("devrun123", LocalRunToken.requireRunId(" " + token + " "));
    }

    @Test
    void tokenIsUnsigned() {
        assertTrue(LocalRunToken.encode("r").endsWith("."));
    }

    @Test
    void malformedTokens() {
        assertTrue(LocalRunToken.parseRunId(null).isEmpty());
        assertTrue(LocalRunToken.parseRunId("").isEmpty());
        assertTrue(LocalRunToken.parseRunId("a.b").isEmpty());
        assertTrue(LocalRunToken.parseRunId("a.!!!.c").isEmpty());

        String noRunId = "x." + Base64.getUrlEncoder().withoutPadding().encodeToString("{\"other\":1}".getBytes()) + ".";
        assertTrue(LocalRunToken.parseRunId(noRunId).isEmpty());
    }

    @Test
    void requireRunIdMessages() {
        IllegalArgumentException missing = assertThrows(IllegalArgumentException.class,
                () -> LocalRunToken.requireRunId(null));
        assertTrue(missing.getMessage().contains(LocalRunToken.HEADER));

        assertThrows(IllegalArgumentException.class, () -> LocalRunToken.requireRunId("garbage"));
    }
}
