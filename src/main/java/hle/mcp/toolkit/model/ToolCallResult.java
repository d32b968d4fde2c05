package hle.mcp.toolkit.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Result of a single tool invocation. A result with {@code isError} set is a
 * tool-level failure reported by the server, not a transport failure.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ToolCallResult {

    private final List<ContentItem> content;
    private final boolean error;

    @JsonCreator
    public ToolCallResult(@JsonProperty("content") List<ContentItem> content,
                          @JsonProperty("isError") boolean error) {
        this.content = content == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(content));
        this.error = error;
    }

    public static ToolCallResult text(String text) {
        return new ToolCallResult(List.of(ContentItem.text(text)), false);
    }

    public static ToolCallResult error(String message) {
        return new ToolCallResult(List.of(ContentItem.text(message)), true);
    }

    public List<ContentItem> getContent() {
        return content;
    }

    @JsonProperty("isError")
    public boolean isError() {
        return error;
    }

    /**
     * Concatenates the text of every text content item, one per line.
     */
    @JsonIgnore
    public String getText() {
        return content.stream()
                .filter(item -> item.getType() == ContentItem.Type.TEXT && item.getText() != null)
                .map(ContentItem::getText)
                .collect(Collectors.joining("\n"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ToolCallResult)) {
            return false;
        }
        ToolCallResult that = (ToolCallResult) o;
        return error == that.error && content.equals(that.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(content, error);
    }

    @Override
    public String toString() {
        return "ToolCallResult[error=" + error + ", content=" + content + "]";
    }
}
