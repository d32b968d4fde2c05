package hle.mcp.toolkit.cache;

/**
 * The three listings a {@link DefinitionCacher} keeps. The key doubles as the
 * storage key when entries are persisted.
 */
public enum DefinitionKind {
    TOOLS("tools"),
    RESOURCES("resources"),
    PROMPTS("prompts");

    private final String key;

    DefinitionKind(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static DefinitionKind fromKey(String key) {
        for (DefinitionKind kind : values()) {
            if (kind.key.equals(key)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown definition kind: " + key);
    }
}
