package airdev.devserver.outputs;

import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class OutputParserTest {

    private final OutputParser parser = new OutputParser();

    private ParsedLine parse(String line) {
        Optional<ParsedLine> parsed = parser.parse(line);
        assertTrue(parsed.isPresent(), "expected a command for: " + line);
        return parsed.get();
    }

    @Test
    void ordinaryLinesAreNotCommands() {
        assertTrue(parser.parse("hello world").isEmpty());
        assertTrue(parser.parse("").isEmpty());
        assertTrue(parser.parse(" airplane_output 1").isEmpty());
    }

    @Test
    void legacyWithoutNameUsesDefaultOutput() {
        ParsedLine line = parse("airplane_output 42");
        assertEquals(OutputCommand.LEGACY, line.command());
        assertEquals("output", line.name());
        assertEquals(IntNode.valueOf(42), line.value());
    }

    @Test
    void legacyNamedVariants() {
        assertEquals("foo", parse("airplane_output:foo 1").name());
        assertEquals("my name", parse("airplane_output:\"my name\" 1").name());
        assertEquals("single", parse("airplane_output:'single' 1").name());
        assertEquals("output", parse("airplane_output:\"\" 1").name());
    }

    @Test
    @DisplayName("Legacy values that are not JSON are kept as strings")
    void legacyNonJsonValueIsText() {
        assertEquals(TextNode.valueOf("hello there"), parse("airplane_output hello there").value());
        assertEquals(TextNode.valueOf("trimmed"), parse("airplane_output   trimmed  ").value());
    }

    @Test
    void structuredSetAndAppend() {
        ParsedLine set = parse("airplane_output_set:a.b[0] {\"x\":1}");
        assertEquals(OutputCommand.SET, set.command());
        assertEquals("a.b[0]", set.jsonPath());
        assertEquals(1, set.value().get("x").asInt());

        ParsedLine append = parse("airplane_output_append \"v\"");
        assertEquals(OutputCommand.APPEND, append.command());
        assertEquals("", append.jsonPath());
        assertEquals(TextNode.valueOf("v"), append.value());
    }

    @Test
    void structuredValueMustBeJson() {
        OutputProtocolException e = assertThrows(OutputProtocolException.class,
                () -> parser.parse("airplane_output_set:a not-json"));
        assertEquals("output value is not valid JSON: not-json", e.getMessage());
        OutputProtocolException unpathed = assertThrows(OutputProtocolException.class,
                () -> parser.parse("airplane_output_append {oops"));
        assertEquals("output value is not valid JSON: {oops", unpathed.getMessage());
        assertThrows(OutputProtocolException.class, () -> parser.parse("airplane_output_set:a."));
    }

    @Test
    void unknownOutputLineAppendsEmptyString() {
        ParsedLine line = parse("airplane_output_bogus");
        assertEquals(OutputCommand.LEGACY, line.command());
        assertEquals("output", line.name());
        assertEquals(TextNode.valueOf(""), line.value());
        assertEquals(0, line.size());
    }

    @Test
    @DisplayName("Chunks accumulate until their end line, then parse as one line")
    void chunksAssemble() {
        assertTrue(parser.parse("airplane_chunk:k1 airplane_output_set:x ").isEmpty());
        assertTrue(parser.parse("airplane_chunk:k2 ignored").isEmpty());
        assertTrue(parser.parse("airplane_chunk:k1 [1,2,").isEmpty());
        assertTrue(parser.parse("airplane_chunk:k1 3]").isEmpty());
        assertEquals(2, parser.pendingChunks());

        ParsedLine line = parse("airplane_chunk_end:k1");
        assertEquals(OutputCommand.SET, line.command());
        assertEquals("x", line.jsonPath());
        assertEquals(3, line.value().size());
        assertEquals(1, parser.pendingChunks());
    }

    @Test
    void chunkEndWithoutChunksIsEmptyLine() {
        assertTrue(parser.parse("airplane_chunk_end:never").isEmpty());
    }

    @Test
    void malformedChunkLine() {
        assertThrows(OutputProtocolException.class, () -> parser.parse("airplane_chunkfoo"));
    }

    @Test
    void lineLimitAppliesToAssembledLine() {
        OutputParser limited = new OutputParser(20);
        assertTrue(limited.parse("airplane_chunk:k airplane_output ").isEmpty());
        assertTrue(limited.parse("airplane_chunk:k 12345").isEmpty());

        OutputLineTooLongException e = assertThrows(OutputLineTooLongException.class,
                () -> limited.parse("airplane_chunk_end:k"));
        assertNotNull(e.getMessage());
        assertTrue(limited.parse("short").isEmpty());
    }
}
