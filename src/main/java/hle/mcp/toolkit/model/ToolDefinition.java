package hle.mcp.toolkit.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Describes a tool exposed by a server: its name, an optional description
 * and the JSON schema of its input.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ToolDefinition {

    private final String name;
    private final String description;
    private final Map<String, Object> inputSchema;

    @JsonCreator
    public ToolDefinition(@JsonProperty("name") String name,
                          @JsonProperty("description") String description,
                          @JsonProperty("inputSchema") Map<String, Object> inputSchema) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.description = description;
        this.inputSchema = inputSchema == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(inputSchema));
    }

    public static ToolDefinition of(String name, String description) {
        return new ToolDefinition(name, description, null);
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Map<String, Object> getInputSchema() {
        return inputSchema;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ToolDefinition)) {
            return false;
        }
        ToolDefinition that = (ToolDefinition) o;
        return name.equals(that.name)
                && Objects.equals(description, that.description)
                && inputSchema.equals(that.inputSchema);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, inputSchema);
    }

    @Override
    public String toString() {
        return "ToolDefinition[name=" + name + "]";
    }
}
