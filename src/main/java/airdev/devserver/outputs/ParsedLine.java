package airdev.devserver.outputs;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One parsed output command.
 *
 * @param command  which command
 * @param name     target array name, legacy commands only
 * @param jsonPath raw path text, structured commands only (empty for the root)
 * @param value    value to write
 * @param size     byte length of the effective line, 0 for the backwards-compatible catch-all
 */
public record ParsedLine(
        OutputCommand command,
        String name,
        String jsonPath,
        JsonNode value,
        int size) {

    public static ParsedLine legacy(String name, JsonNode value, int size) {
        return new ParsedLine(OutputCommand.LEGACY, name, "", value, size);
    }

    public static ParsedLine set(String jsonPath, JsonNode value, int size) {
        return new ParsedLine(OutputCommand.SET, "", jsonPath, value, size);
    }

    public static ParsedLine append(String jsonPath, JsonNode value, int size) {
        return new ParsedLine(OutputCommand.APPEND, "", jsonPath, value, size);
    }
}
