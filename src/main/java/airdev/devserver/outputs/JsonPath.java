package airdev.devserver.outputs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * JavaScript-style path into a JSON document: {@code a.b[0]["x y"]['z']}.
 *
 * Components are either object keys or array indices. The empty string is the root path.
 */
public final class JsonPath {

    /** One path step: an object key or an array index. */
    public record Component(String key, int index) {
        public static Component key(String key) {
            return new Component(key, -1);
        }

        public static Component index(int index) {
            return new Component(null, index);
        }

        public boolean isKey() {
            return key != null;
        }

        @Override
        public String toString() {
            return isKey() ? key : "[" + index + "]";
        }
    }

    /** Path parsed from the start of a longer string, with the offset where parsing stopped. */
    public record Partial(JsonPath path, int end) {
    }

    private static final JsonPath ROOT = new JsonPath(List.of());

    private final List<Component> components;

    private JsonPath(List<Component> components) {
        this.components = Collections.unmodifiableList(components);
    }

    public static JsonPath root() {
        return ROOT;
    }

    public List<Component> components() {
        return components;
    }

    public int size() {
        return components.size();
    }

    public boolean isEmpty() {
        return components.isEmpty();
    }

    /**
     * Parse a complete path.
     *
     * @throws OutputProtocolException if the path is malformed or followed by anything
     */
    public static JsonPath parse(String js) {
        Partial partial = parsePartial(js);
        if (partial.end() != js.length()) {
            throw new OutputProtocolException(
                    "invalid path " + quote(js) + ": unexpected character at offset " + partial.end());
        }
        return partial.path();
    }

    /**
     * Parse the longest valid path prefix of {@code s}.
     * Parsing stops at the first character that cannot continue a path.
     *
     * @throws OutputProtocolException if a component is started but not finished, e.g. {@code a.} or {@code [1}
     */
    public static Partial parsePartial(String s) {
        List<Component> out = new ArrayList<>();
        int i = 0;
        int n = s.length();

        // Leading identifier without a dot.
        if (i < n && isIdentStart(s.charAt(i))) {
            int start = i;
            while (i < n && isIdentPart(s.charAt(i))) {
                i++;
            }
            out.add(Component.key(s.substring(start, i)));
        }

        while (i < n) {
            char c = s.charAt(i);
            if (c == '.') {
                int start = ++i;
                if (i >= n || !isIdentStart(s.charAt(i))) {
                    throw new OutputProtocolException("invalid path " + quote(s) + ": expected identifier after '.'");
                }
                while (i < n && isIdentPart(s.charAt(i))) {
                    i++;
                }
                out.add(Component.key(s.substring(start, i)));
            } else if (c == '[') {
                i++;
                if (i >= n) {
                    throw new OutputProtocolException("invalid path " + quote(s) + ": unterminated '['");
                }
                char first = s.charAt(i);
                if (first == '"' || first == '\'') {
                    StringBuilder key = new StringBuilder();
                    i = readQuoted(s, i, key);
                    out.add(Component.key(key.toString()));
                } else if (Character.isDigit(first)) {
                    int start = i;
                    while (i < n && Character.isDigit(s.charAt(i))) {
                        i++;
                    }
                    try {
                        out.add(Component.index(Integer.parseInt(s.substring(start, i))));
                    } catch (NumberFormatException e) {
                        throw new OutputProtocolException("invalid path " + quote(s) + ": index out of range", e);
                    }
                } else {
                    throw new OutputProtocolException(
                            "invalid path " + quote(s) + ": expected index or quoted key after '['");
                }
                if (i >= n || s.charAt(i) != ']') {
                    throw new OutputProtocolException("invalid path " + quote(s) + ": expected ']'");
                }
                i++;
            } else {
                break;
            }
        }
        return new Partial(out.isEmpty() ? ROOT : new JsonPath(out), i);
    }

    /** Reads a quoted key starting at the opening quote; returns the index after the closing quote. */
    private static int readQuoted(String s, int i, StringBuilder out) {
        char quote = s.charAt(i++);
        int n = s.length();
        while (i < n) {
            char c = s.charAt(i++);
            if (c == quote) {
                return i;
            }
            if (c != '\\') {
                out.append(c);
                continue;
            }
            if (i >= n) {
                break;
            }
            char e = s.charAt(i++);
            switch (e) {
                case '"', '\'', '\\', '/' -> out.append(e);
                case 'b' -> out.append('\b');
                case 'f' -> out.append('\f');
                case 'n' -> out.append('\n');
                case 'r' -> out.append('\r');
                case 't' -> out.append('\t');
                case 'u' -> {
                    if (i + 4 > n) {
                        throw new OutputProtocolException("invalid path " + quote(s) + ": bad unicode escape");
                    }
                    try {
                        out.append((char) Integer.parseInt(s.substring(i, i + 4), 16));
                    } catch (NumberFormatException ex) {
                        throw new OutputProtocolException("invalid path " + quote(s) + ": bad unicode escape", ex);
                    }
                    i += 4;
                }
                default -> throw new OutputProtocolException(
                        "invalid path " + quote(s) + ": unknown escape \\" + e);
            }
        }
        throw new OutputProtocolException("invalid path " + quote(s) + ": unterminated string");
    }

    private static boolean isIdentStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentPart(char c) {
        return isIdentStart(c) || Character.isDigit(c);
    }

    private static String quote(String s) {
        return "\"" + s + "\"";
    }

    /** Render back to JavaScript notation. */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Component c : components) {
            if (!c.isKey()) {
                sb.append('[').append(c.index()).append(']');
            } else if (isIdentifier(c.key())) {
                if (sb.length() > 0) {
                    sb.append('.');
                }
                sb.append(c.key());
            } else {
                sb.append("[\"").append(c.key().replace("\\", "\\\\").replace("\"", "\\\"")).append("\"]");
            }
        }
        return sb.toString();
    }

    private static boolean isIdentifier(String key) {
        if (key.isEmpty() || !isIdentStart(key.charAt(0))) {
            return false;
        }
        for (int i = 1; i < key.length(); i++) {
            if (!isIdentPart(key.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof JsonPath other && components.equals(other.components);
    }

    @Override
    public int hashCode() {
        return components.hashCode();
    }
}
