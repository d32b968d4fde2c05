package hle.mcp.toolkit.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single named argument accepted by a prompt.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PromptArgument {

    private final String name;
    private final String description;
    private final boolean required;

    @JsonCreator
    public PromptArgument(@JsonProperty("name") String name,
                          @JsonProperty("description") String description,
                          @JsonProperty("required") boolean required) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.description = description;
        this.required = required;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public boolean isRequired() {
        return required;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PromptArgument)) {
            return false;
        }
        PromptArgument that = (PromptArgument) o;
        return required == that.required
                && name.equals(that.name)
                && Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, required);
    }
}
