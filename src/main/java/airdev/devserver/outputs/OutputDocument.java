package airdev.devserver.outputs;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.function.Consumer;

/**
 * The structured output of one run, built by applying output commands in arrival order.
 *
 * Not thread-safe; the executor guards it with the same lock as its {@link OutputParser}.
 */
public final class OutputDocument {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private JsonNode root; // null until the first command

    public OutputDocument() {
    }

    public OutputDocument(JsonNode initial) {
        this.root = initial;
    }

    /** True when no command has written anything yet. */
    public boolean isEmpty() {
        return root == null;
    }

    /** Deep copy of the current document, or null when empty. */
    public JsonNode snapshot() {
        return root == null ? null : root.deepCopy();
    }

    /**
     * Apply one parsed command.
     *
     * @throws OutputProtocolException on a path that does not fit the document shape
     */
    public void apply(ParsedLine line) {
        switch (line.command()) {
            case LEGACY -> applyLegacy(line.name(), line.value());
            case SET -> applySet(JsonPath.parse(line.jsonPath()), line.value());
            case APPEND -> applyAppend(JsonPath.parse(line.jsonPath()), line.value());
            default -> throw new OutputProtocolException("unknown command: " + line.command());
        }
    }

    void applyLegacy(String name, JsonNode value) {
        if (isNull(root)) {
            root = NODES.objectNode();
        }
        if (!root.isObject()) {
            throw new OutputProtocolException("expected json object at top level");
        }
        ObjectNode obj = (ObjectNode) root;
        JsonNode target = obj.get(name);
        if (target == null) {
            target = obj.putArray(name);
        }
        if (!target.isArray()) {
            throw new OutputProtocolException("expected array at " + name);
        }
        ((ArrayNode) target).add(value);
    }

    void applySet(JsonPath path, JsonNode value) {
        if (path.isEmpty()) {
            root = value;
            return;
        }
        walk(path, value, false);
    }

    void applyAppend(JsonPath path, JsonNode value) {
        if (path.isEmpty()) {
            if (isNull(root)) {
                root = NODES.arrayNode();
            }
            if (!root.isArray()) {
                throw new OutputProtocolException("expected array at root");
            }
            ((ArrayNode) root).add(value);
            return;
        }
        walk(path, value, true);
    }

    /**
     * Walk the path from the root. Null or missing nodes at key steps become empty objects,
     * index steps never grow arrays.
     */
    private void walk(JsonPath path, JsonNode value, boolean append) {
        List<JsonPath.Component> components = path.components();
        JsonNode cur = root;
        Consumer<JsonNode> slot = node -> root = node;

        for (int i = 0; i < components.size(); i++) {
            JsonPath.Component c = components.get(i);
            boolean last = i == components.size() - 1;

            if (c.isKey()) {
                if (isNull(cur)) {
                    cur = NODES.objectNode();
                    slot.accept(cur);
                }
                if (!cur.isObject()) {
                    throw new OutputProtocolException(
                            "expected object at " + prefix(components, i) + ", found " + cur.getNodeType());
                }
                ObjectNode obj = (ObjectNode) cur;
                String key = c.key();
                if (last) {
                    if (append) {
                        obj.set(key, appended(obj.get(key), value, path));
                    } else {
                        obj.set(key, value);
                    }
                    return;
                }
                slot = node -> obj.set(key, node);
                cur = obj.get(key);
            } else {
                if (cur == null || !cur.isArray()) {
                    throw new OutputProtocolException("expected array at " + prefix(components, i)
                            + ", found " + (cur == null ? "nothing" : cur.getNodeType()));
                }
                ArrayNode arr = (ArrayNode) cur;
                int index = c.index();
                if (index >= arr.size()) {
                    throw new OutputProtocolException("array at " + prefix(components, i) + " had too few elements: "
                            + arr.size() + " <= " + index);
                }
                if (last) {
                    if (append) {
                        arr.set(index, appended(arr.get(index), value, path));
                    } else {
                        arr.set(index, value);
                    }
                    return;
                }
                slot = node -> arr.set(index, node);
                cur = arr.get(index);
            }
        }
    }

    private static JsonNode appended(JsonNode existing, JsonNode value, JsonPath path) {
        ArrayNode arr;
        if (isNull(existing)) {
            arr = NODES.arrayNode();
        } else if (existing.isArray()) {
            arr = (ArrayNode) existing;
        } else {
            throw new OutputProtocolException("expected array at append point " + path);
        }
        arr.add(value);
        return arr;
    }

    private static boolean isNull(JsonNode node) {
        return node == null || node.isNull();
    }

    private static String prefix(List<JsonPath.Component> components, int upTo) {
        if (upTo == 0) {
            return "root";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < upTo; i++) {
            JsonPath.Component c = components.get(i);
            if (c.isKey()) {
                sb.append(sb.length() == 0 ? "" : ".").append(c.key());
            } else {
                sb.append('[').append(c.index()).append(']');
            }
        }
        return sb.toString();
    }
}
