package hle.mcp.toolkit.cache;

/**
 * Notified each time a fetch replaces the cached listing of a kind.
 */
@FunctionalInterface
public interface CacheUpdateListener {

    CacheUpdateListener NO_OP = kind -> { };

    void onUpdate(DefinitionKind kind);
}
