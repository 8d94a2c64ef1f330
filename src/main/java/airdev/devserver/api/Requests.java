package airdev.devserver.api;

import airdev.devserver.env.LocalRunToken;
import airdev.devserver.util.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.QueryStringDecoder;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Request parsing shared by controllers.
 */
public final class Requests {

    /** Fallback env requested by the studio UI. */
    public static final String ENV_SLUG_HEADER = "X-Airplane-Env-Slug";

    private Requests() {
    }

    /**
     * First value of a query parameter, or null.
     */
    public static String query(FullHttpRequest req, String name) {
        List<String> values = new QueryStringDecoder(req.uri()).parameters().get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    /**
     * Deserialize the JSON body.
     *
     * @throws IllegalArgumentException on an empty or malformed body
     */
    public static <T> T body(FullHttpRequest req, Class<T> type) {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("expected a JSON request body");
        }
        try {
            return Json.mapper().readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid request body: " + e.getOriginalMessage());
        }
    }

    /**
     * Run id carried by the caller's run token, or null when the request is not from a run.
     *
     * @throws IllegalArgumentException if a token is present but malformed
     */
    public static String callerRunId(FullHttpRequest req) {
        String token = req.headers().get(LocalRunToken.HEADER);
        if (token == null || token.isEmpty()) {
            return null;
        }
        return LocalRunToken.requireRunId(token);
    }

    /**
     * Run id from a token the request must carry.
     */
    public static String requireCallerRunId(FullHttpRequest req) {
        return LocalRunToken.requireRunId(req.headers().get(LocalRunToken.HEADER));
    }

    public static String envSlug(FullHttpRequest req) {
        String slug = req.headers().get(ENV_SLUG_HEADER);
        return slug == null || slug.isBlank() ? null : slug;
    }
}
