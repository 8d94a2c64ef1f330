package airdev.devserver.builtins;

import airdev.devserver.model.StdApiRequest;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Slugs of platform-provided tasks: {@code airplane:<namespace>_<name>}.
 */
public final class BuiltinSlug {

    public static final String PREFIX = "airplane";

    public static final String SQL_QUERY = "airplane:sql_query";
    public static final String REST_REQUEST = "airplane:rest_request";

    private BuiltinSlug() {
    }

    public static boolean isBuiltin(String slug) {
        return slug != null && slug.startsWith(PREFIX + ":");
    }

    /**
     * Build the request handed to the builtins binary.
     *
     * @throws IllegalArgumentException if the slug is not a well-formed builtin slug
     */
    public static StdApiRequest request(String slug, Map<String, Object> arguments) {
        String[] parts = slug.split(":", -1);
        if (parts.length != 2 || !PREFIX.equals(parts[0])) {
            throw new IllegalArgumentException("unknown builtin task slug: " + slug);
        }
        String[] function = parts[1].split("_", -1);
        if (function.length != 2 || function[0].isEmpty() || function[1].isEmpty()) {
            throw new IllegalArgumentException("unknown builtin task slug: " + slug);
        }
        Map<String, Object> request = arguments == null ? new LinkedHashMap<>() : new LinkedHashMap<>(arguments);
        return new StdApiRequest(function[0], function[1], request);
    }
}
