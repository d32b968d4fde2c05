package hle.mcp.toolkit.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Describes a readable resource exposed by a server.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ResourceDefinition {

    private final String uri;
    private final String name;
    private final String description;
    private final String mimeType;

    @JsonCreator
    public ResourceDefinition(@JsonProperty("uri") String uri,
                              @JsonProperty("name") String name,
                              @JsonProperty("description") String description,
                              @JsonProperty("mimeType") String mimeType) {
        this.uri = Objects.requireNonNull(uri, "uri cannot be null");
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.description = description;
        this.mimeType = mimeType;
    }

    public static ResourceDefinition of(String uri, String name) {
        return new ResourceDefinition(uri, name, null, null);
    }

    public String getUri() {
        return uri;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getMimeType() {
        return mimeType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResourceDefinition)) {
            return false;
        }
        ResourceDefinition that = (ResourceDefinition) o;
        return uri.equals(that.uri)
                && name.equals(that.name)
                && Objects.equals(description, that.description)
                && Objects.equals(mimeType, that.mimeType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uri, name, description, mimeType);
    }

    @Override
    public String toString() {
        return "ResourceDefinition[uri=" + uri + ", name=" + name + "]";
    }
}
