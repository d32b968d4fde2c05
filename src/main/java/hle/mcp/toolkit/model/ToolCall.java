package hle.mcp.toolkit.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A tool name plus its arguments, as handed to a batch executor.
 */
public final class ToolCall {

    private final String name;
    private final Map<String, Object> arguments;

    public ToolCall(String name, Map<String, Object> arguments) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.arguments = arguments == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public static ToolCall of(String name) {
        return new ToolCall(name, null);
    }

    public static ToolCall of(String name, Map<String, Object> arguments) {
        return new ToolCall(name, arguments);
    }

    public String getName() {
        return name;
    }

    public Map<String, Object> getArguments() {
        return arguments;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ToolCall)) {
            return false;
        }
        ToolCall that = (ToolCall) o;
        return name.equals(that.name) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, arguments);
    }

    @Override
    public String toString() {
        return "ToolCall[name=" + name + ", arguments=" + arguments + "]";
    }
}
