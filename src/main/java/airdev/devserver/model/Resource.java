package airdev.devserver.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * External resource (database, REST endpoint, ...) attached to a task under an alias.
 * Kind-specific connection fields are kept as flat attributes next to id, slug and kind.
 */
public final class Resource {
    private final String id;
    private final String slug;
    private final String name;
    private final String kind;
    private final Map<String, Object> attributes = new LinkedHashMap<>();

    @JsonCreator
    public Resource(
            @JsonProperty("id") String id,
            @JsonProperty("slug") String slug,
            @JsonProperty("name") String name,
            @JsonProperty("kind") String kind) {
        this.id = id;
        this.slug = slug;
        this.name = name;
        this.kind = kind;
    }

    public Resource(String id, String slug, String name, String kind, Map<String, Object> attributes) {
        this(id, slug, name, kind);
        if (attributes != null) {
            this.attributes.putAll(attributes);
        }
    }

    @JsonProperty("id")
    public String id() {
        return id;
    }

    @JsonProperty("slug")
    public String slug() {
        return slug;
    }

    @JsonProperty("name")
    public String name() {
        return name;
    }

    @JsonProperty("kind")
    public String kind() {
        return kind;
    }

    @JsonAnyGetter
    public Map<String, Object> attributes() {
        return attributes;
    }

    @JsonAnySetter
    void setAttribute(String key, Object value) {
        attributes.put(key, value);
    }

    /** Copy with the same identity and replaced attributes */
    public Resource withAttributes(Map<String, Object> newAttributes) {
        return new Resource(id, slug, name, kind, newAttributes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Resource other))
            return false;
        return Objects.equals(id, other.id) && Objects.equals(slug, other.slug)
                && Objects.equals(name, other.name) && Objects.equals(kind, other.kind)
                && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, slug, name, kind, attributes);
    }

    @Override
    public String toString() {
        return "Resource{id='" + id + "', slug='" + slug + "', kind='" + kind + "'}";
    }
}
