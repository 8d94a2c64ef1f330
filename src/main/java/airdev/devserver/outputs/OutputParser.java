package airdev.devserver.outputs;

import airdev.devserver.util.Json;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns task output lines into output commands.
 *
 * One parser belongs to one run: it owns the chunk buffers of that run, so it is not thread-safe
 * and callers must serialize access together with the document it feeds.
 *
 * Chunking: {@code airplane_chunk:KEY text} lines accumulate under KEY and read as empty lines;
 * {@code airplane_chunk_end:KEY} yields the concatenation, which is then parsed like any line.
 */
public final class OutputParser {

    static final String OUTPUT_PREFIX = "airplane_output";
    static final String CHUNK_PREFIX = "airplane_chunk";
    static final String DEFAULT_OUTPUT_NAME = "output";

    private static final Pattern LEGACY = Pattern.compile(
            "^airplane_output(?::(?:(\"[^\"]*\")|('[^']*')|([^ ]+))?)? (.*)$", Pattern.DOTALL);
    private static final Pattern STRUCTURED = Pattern.compile(
            "^airplane_output(_set|_append)(:| )(.*)$", Pattern.DOTALL);
    private static final Pattern CHUNK = Pattern.compile(
            "^airplane_chunk(|_end):([^ ]*)(?: (.+)|)$", Pattern.DOTALL);

    private final Map<String, StringBuilder> chunks = new HashMap<>();
    private final int maxLineBytes;

    /**
     * @param maxLineBytes maximum size of an effective line; disabled when &lt;= 0
     */
    public OutputParser(int maxLineBytes) {
        this.maxLineBytes = maxLineBytes;
    }

    public OutputParser() {
        this(0);
    }

    /**
     * Parse one raw line.
     *
     * @return the command, or empty for ordinary log lines and partial chunks
     * @throws OutputLineTooLongException if the effective line is above the limit
     * @throws OutputProtocolException    if the line starts like a command but is malformed
     */
    public Optional<ParsedLine> parse(String rawLine) {
        String text = assembleChunks(rawLine);
        int size = text.getBytes(StandardCharsets.UTF_8).length;

        if (maxLineBytes > 0 && size > maxLineBytes) {
            throw new OutputLineTooLongException(size, maxLineBytes);
        }
        if (!text.startsWith(OUTPUT_PREFIX)) {
            return Optional.empty();
        }

        ParsedLine legacy = parseLegacy(text, size);
        if (legacy != null) {
            return Optional.of(legacy);
        }

        ParsedLine structured;
        try {
            structured = parseStructured(text, size);
        } catch (OutputProtocolException e) {
            throw new OutputProtocolException("line does not match any known airplane_output format", e);
        }
        if (structured != null) {
            return Optional.of(structured);
        }

        // Backwards compatibility: any other airplane_output line appends "" to the default output.
        return Optional.of(ParsedLine.legacy(DEFAULT_OUTPUT_NAME, TextNode.valueOf(""), 0));
    }

    /** Number of chunk keys still waiting for their end line. */
    public int pendingChunks() {
        return chunks.size();
    }

    String assembleChunks(String text) {
        if (!text.startsWith(CHUNK_PREFIX)) {
            return text;
        }
        Matcher m = CHUNK.matcher(text);
        if (!m.matches()) {
            throw new OutputProtocolException("line started with airplane_chunk but was not a valid chunk: " + text);
        }
        String key = m.group(2);
        if ("_end".equals(m.group(1))) {
            StringBuilder chunk = chunks.remove(key);
            return chunk == null ? "" : chunk.toString();
        }
        StringBuilder chunk = chunks.computeIfAbsent(key, k -> new StringBuilder());
        if (m.group(3) != null) {
            chunk.append(m.group(3));
        }
        return "";
    }

    private static ParsedLine parseLegacy(String text, int size) {
        Matcher m = LEGACY.matcher(text);
        if (!m.matches()) {
            return null;
        }
        String name;
        if (m.group(1) != null) {
            name = strip(m.group(1), '"');
        } else if (m.group(2) != null) {
            name = strip(m.group(2), '\'');
        } else if (m.group(3) != null) {
            name = m.group(3);
        } else {
            name = "";
        }
        name = name.strip();
        if (name.isEmpty()) {
            name = DEFAULT_OUTPUT_NAME;
        }

        String raw = m.group(4).strip();
        JsonNode value = Json.parseValue(raw).orElseGet(() -> TextNode.valueOf(raw));
        return ParsedLine.legacy(name, value, size);
    }

    private static ParsedLine parseStructured(String text, int size) {
        Matcher m = STRUCTURED.matcher(text);
        if (!m.matches()) {
            return null;
        }
        OutputCommand command = "_set".equals(m.group(1)) ? OutputCommand.SET : OutputCommand.APPEND;
        String rest = m.group(3);

        String path = "";
        String rawValue = rest;
        if (":".equals(m.group(2))) {
            JsonPath.Partial partial = JsonPath.parsePartial(rest);
            int end = partial.end();
            if (rest.length() <= end || rest.charAt(end) != ' ') {
                throw new OutputProtocolException("invalid output line");
            }
            path = rest.substring(0, end);
            rawValue = rest.substring(end + 1).strip();
        }

        String valueText = rawValue;
        JsonNode value = Json.parseValue(valueText)
                .orElseThrow(() -> new OutputProtocolException("output value is not valid JSON: " + valueText));
        return command == OutputCommand.SET
                ? ParsedLine.set(path, value, size)
                : ParsedLine.append(path, value, size);
    }

    /** Trim every leading and trailing occurrence of {@code c}. */
    private static String strip(String s, char c) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == c) {
            start++;
        }
        while (end > start && s.charAt(end - 1) == c) {
            end--;
        }
        return s.substring(start, end);
    }
}
