package tollgate.core.model.window;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * The fixed windows every tier is limited over.
 *
 * <p>Each kind carries its default size. Deployments may override sizes through
 * configuration, which is mostly useful for tests that want short windows.
 */
public enum WindowKind {
    MINUTE("minute", Duration.ofMinutes(1)),
    HOUR("hour", Duration.ofHours(1)),
    DAY("day", Duration.ofDays(1));

    private final String value;
    private final Duration defaultSize;

    WindowKind(String value, Duration defaultSize) {
        this.value = value;
        this.defaultSize = defaultSize;
    }

    /**
     * Lower-case name used in counter keys, headers, and JSON.
     */
    public String value() {
        return value;
    }

    public Duration defaultSize() {
        return defaultSize;
    }

    public static Optional<WindowKind> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        final var normalized = value.trim().toLowerCase(Locale.ROOT);
        for (var kind : values()) {
            if (kind.value.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
