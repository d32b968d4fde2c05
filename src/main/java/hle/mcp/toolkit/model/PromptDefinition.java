package hle.mcp.toolkit.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Describes a prompt template exposed by a server.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PromptDefinition {

    private final String name;
    private final String description;
    private final List<PromptArgument> arguments;

    @JsonCreator
    public PromptDefinition(@JsonProperty("name") String name,
                            @JsonProperty("description") String description,
                            @JsonProperty("arguments") List<PromptArgument> arguments) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.description = description;
        this.arguments = arguments == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    public static PromptDefinition of(String name, String description) {
        return new PromptDefinition(name, description, null);
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public List<PromptArgument> getArguments() {
        return arguments;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PromptDefinition)) {
            return false;
        }
        PromptDefinition that = (PromptDefinition) o;
        return name.equals(that.name)
                && Objects.equals(description, that.description)
                && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, arguments);
    }

    @Override
    public String toString() {
        return "PromptDefinition[name=" + name + ", arguments=" + arguments.size() + "]";
    }
}
