package hle.mcp.toolkit.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * One piece of content returned by a tool call. Which of the optional fields
 * are set depends on the {@link Type}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ContentItem {

    public enum Type {
        TEXT("text"),
        IMAGE("image"),
        AUDIO("audio"),
        RESOURCE("resource");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String getWireName() {
            return wireName;
        }

        @JsonCreator
        public static Type fromWireName(String value) {
            for (Type type : values()) {
                if (type.wireName.equalsIgnoreCase(value)) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unknown content type: " + value);
        }
    }

    private final Type type;
    private final String text;
    private final String data;
    private final String mimeType;
    private final String uri;

    @JsonCreator
    public ContentItem(@JsonProperty("type") Type type,
                       @JsonProperty("text") String text,
                       @JsonProperty("data") String data,
                       @JsonProperty("mimeType") String mimeType,
                       @JsonProperty("uri") String uri) {
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.text = text;
        this.data = data;
        this.mimeType = mimeType;
        this.uri = uri;
    }

    public static ContentItem text(String text) {
        return new ContentItem(Type.TEXT, text, null, null, null);
    }

    public static ContentItem image(String base64Data, String mimeType) {
        return new ContentItem(Type.IMAGE, null, base64Data, mimeType, null);
    }

    public static ContentItem resource(String uri, String mimeType) {
        return new ContentItem(Type.RESOURCE, null, null, mimeType, uri);
    }

    public Type getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public String getData() {
        return data;
    }

    public String getMimeType() {
        return mimeType;
    }

    public String getUri() {
        return uri;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ContentItem)) {
            return false;
        }
        ContentItem that = (ContentItem) o;
        return type == that.type
                && Objects.equals(text, that.text)
                && Objects.equals(data, that.data)
                && Objects.equals(mimeType, that.mimeType)
                && Objects.equals(uri, that.uri);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, data, mimeType, uri);
    }

    @Override
    public String toString() {
        return type == Type.TEXT ? "ContentItem[text=" + text + "]" : "ContentItem[type=" + type + "]";
    }
}
