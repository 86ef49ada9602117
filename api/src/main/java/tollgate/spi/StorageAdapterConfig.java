package tollgate.spi;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Read-only view of the {@code tollgate.*} settings a usage storage provider
 * needs, such as Cassandra contact points or record retention.
 *
 * <p>Only {@link #get(String)} is backed by a configuration source; the typed
 * accessors parse its raw values.
 */
public interface StorageAdapterConfig {

    Optional<String> get(String key);

    default String getOrDefault(String key, String defaultValue) {
        return get(key).filter(value -> !value.isBlank()).orElse(defaultValue);
    }

    default Optional<Boolean> getBoolean(String key) {
        return get(key).map(String::trim).map(Boolean::parseBoolean);
    }

    /**
     * Comma-separated values, trimmed, with blanks dropped.
     */
    default List<String> getList(String key) {
        return get(key).map(value -> Arrays.stream(value.split(","))
                        .map(String::trim)
                        .filter(item -> !item.isEmpty())
                        .toList())
                .orElse(List.of());
    }

    /**
     * Accepts ISO-8601 ({@code P90D}, {@code PT5M}) or a number with a
     * {@code ms}, {@code s}, {@code m}, {@code h} or {@code d} suffix.
     *
     * @throws StorageProviderException if the value is neither
     */
    default Optional<Duration> getDuration(String key) {
        return get(key).map(String::trim).filter(value -> !value.isEmpty()).map(value -> parseDuration(key, value));
    }

    private static Duration parseDuration(String key, String value) {
        final var lower = value.toLowerCase(Locale.ROOT);
        try {
            if (lower.startsWith("p")) {
                return Duration.parse(value.toUpperCase(Locale.ROOT));
            }
            if (lower.endsWith("ms")) {
                return Duration.ofMillis(Long.parseLong(lower.substring(0, lower.length() - 2)));
            }
            final var amount = Long.parseLong(lower.substring(0, lower.length() - 1));
            return switch (lower.charAt(lower.length() - 1)) {
                case 's' -> Duration.ofSeconds(amount);
                case 'm' -> Duration.ofMinutes(amount);
                case 'h' -> Duration.ofHours(amount);
                case 'd' -> Duration.ofDays(amount);
                default -> throw new NumberFormatException(value);
            };
        } catch (RuntimeException e) {
            throw new StorageProviderException("storage", "Invalid duration for " + key + ": " + value, e);
        }
    }
}
