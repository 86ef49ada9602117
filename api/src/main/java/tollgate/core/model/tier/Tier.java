package tollgate.core.model.tier;

import java.util.Locale;
import java.util.Optional;

/**
 * Subscription tiers, ordered from least to most capable.
 */
public enum Tier {
    FREE("free"),
    BASIC("basic"),
    PRO("pro"),
    ENTERPRISE("enterprise");

    private final String value;

    Tier(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Parse a wire value such as {@code "pro"}. Case and surrounding whitespace are ignored.
     *
     * @param value the tier value, may be null
     * @return the tier, or empty when the value is missing or unknown
     */
    public static Optional<Tier> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        final var normalized = value.trim().toLowerCase(Locale.ROOT);
        for (var tier : values()) {
            if (tier.value.equals(normalized)) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }
}
