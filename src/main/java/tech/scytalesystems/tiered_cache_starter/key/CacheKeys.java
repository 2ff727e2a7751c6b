package tech.scytalesystems.tiered_cache_starter.key;

import java.util.List;

/**
 * @author Gathariki Ngigi
 * Created on 25/11/2025
 * Time 1130h
 * <p>Builds cache keys of the form {@code <prefix>:<namespace>:<key>}.
 * <p>The same layout is used on every tier, for direct lookups and for invalidation patterns.
 *
 * <p>Examples:
 * <p>- prefix="app", namespace="users", key="user:42" → "app:users:user:42"
 * <p>- prefix="app", namespace="users", pattern="user:*" → "app:users:user:*"
 */
public final class CacheKeys {
    public static final String SEPARATOR = ":";
    public static final String DEFAULT_NAMESPACE = "default";
    public static final String OTHER_CATEGORY = "other";

    private final String prefix;
    private final List<String> categories;

    public CacheKeys(String prefix, List<String> categories) {
        if (prefix == null || prefix.isBlank()) throw new IllegalArgumentException("Key prefix cannot be blank");

        this.prefix = prefix;
        this.categories = categories != null ? List.copyOf(categories) : List.of();
    }

    /**
     * Full key of {@code key} inside {@code namespace}. A null or blank namespace means {@value #DEFAULT_NAMESPACE}.
     */
    public String build(String key, String namespace) {
        if (key == null || key.isEmpty()) throw new IllegalArgumentException("Cache key cannot be empty");

        return prefix + SEPARATOR + namespaceOrDefault(namespace) + SEPARATOR + key;
    }

    /**
     * Pattern matching every key of the application, on every namespace.
     */
    public String allKeysPattern() {
        return prefix + SEPARATOR + "*";
    }

    /**
     * Metric category of a logical key: the first configured category the key starts with
     * (followed by {@code :}), {@value #OTHER_CATEGORY} otherwise.
     */
    public String category(String key) {
        if (key == null) return OTHER_CATEGORY;

        for (String category : categories) {
            if (key.startsWith(category + SEPARATOR)) return category;
        }

        return OTHER_CATEGORY;
    }

    public String getPrefix() {
        return prefix;
    }

    public static String namespaceOrDefault(String namespace) {
        return namespace == null || namespace.isBlank() ? DEFAULT_NAMESPACE : namespace;
    }
}
