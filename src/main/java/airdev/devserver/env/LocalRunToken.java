package airdev.devserver.env;

import airdev.devserver.util.Json;
import com.fasterxml.jackson.databind.JsonNode;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Unsigned run identifier handed to task processes as {@code AIRPLANE_TOKEN}.
 *
 * Shaped like a JWT with {@code alg: none} so SDKs can pass it around unchanged, but it carries no
 * signature and must never be used for authentication. Child processes send it back in the
 * {@code X-Airplane-Token} header so the server can tell which run made a request.
 */
public final class LocalRunToken {

    public static final String HEADER = "X-Airplane-Token";

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();
    private static final String RUN_ID_CLAIM = "runID";

    private LocalRunToken() {
    }

    public static String encode(String runId) {
        Map<String, Object> header = new LinkedHashMap<>();
        header.put("alg", "none");
        header.put("typ", "JWT");
        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put(RUN_ID_CLAIM, runId);
        return segment(header) + "." + segment(claims) + ".";
    }

    /**
     * Run id carried by a token.
     *
     * @return empty for a null, blank or malformed token
     */
    public static Optional<String> parseRunId(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        String[] parts = token.strip().split("\\.", -1);
        if (parts.length != 3) {
            return Optional.empty();
        }
        String claimsJson;
        try {
            claimsJson = new String(DECODER.decode(parts[1]), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        return Json.parseValue(claimsJson)
                .map(claims -> claims.path(RUN_ID_CLAIM))
                .filter(JsonNode::isTextual)
                .map(JsonNode::asText)
                .filter(id -> !id.isEmpty());
    }

    /**
     * Run id carried by a token that must be present.
     *
     * @throws IllegalArgumentException if the token is missing or carries no run id
     */
    public static String requireRunId(String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("expected " + HEADER + " header");
        }
        return parseRunId(token)
                .orElseThrow(() -> new IllegalArgumentException("invalid " + HEADER + " header"));
    }

    private static String segment(Map<String, Object> json) {
        return ENCODER.encodeToString(Json.write(json).getBytes(StandardCharsets.UTF_8));
    }
}
