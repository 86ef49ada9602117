package tollgate.system.filter;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

import tollgate.core.config.MeteringConfig;

/**
 * Decides which paths are metered and which category a path belongs to.
 *
 * <p>A prefix matches the path itself and anything below it on a segment
 * boundary, so {@code /api/chat} matches {@code /api/chat/stream} but not
 * {@code /api/chatter}. When several category prefixes match, the longest wins.
 */
final class MeteredPaths {

    private final List<String> meteredPrefixes;
    private final List<Map.Entry<String, String>> categoriesByPrefix;
    private final String defaultCategory;

    MeteredPaths(List<String> meteredPrefixes, Map<String, String> categories, String defaultCategory) {
        this.meteredPrefixes =
                meteredPrefixes.stream().map(MeteredPaths::normalize).toList();
        this.categoriesByPrefix = categories.entrySet().stream()
                .map(e -> Map.entry(normalize(e.getValue()), e.getKey()))
                .sorted(Comparator.comparingInt((Map.Entry<String, String> e) -> e.getKey().length())
                        .reversed())
                .toList();
        this.defaultCategory = defaultCategory;
    }

    static MeteredPaths from(MeteringConfig config) {
        return new MeteredPaths(config.paths(), config.categories(), config.defaultCategory());
    }

    boolean isMetered(String path) {
        final var normalized = normalize(path);
        return meteredPrefixes.stream().anyMatch(prefix -> matches(normalized, prefix));
    }

    String categoryFor(String path) {
        final var normalized = normalize(path);
        return categoriesByPrefix.stream()
                .filter(e -> matches(normalized, e.getKey()))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(defaultCategory);
    }

    private static boolean matches(String path, String prefix) {
        if (prefix.equals("/")) {
            return true;
        }
        return path.equals(prefix) || path.startsWith(prefix + "/");
    }

    private static String normalize(String path) {
        if (path == null || path.isBlank()) {
            return "/";
        }
        var normalized = path.trim();
        if (!normalized.startsWith("/")) {
            normalized = "/" + normalized;
        }
        while (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }
}
