package tollgate.adapter.in.rest;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Parses ISO-8601 date query parameters.
 */
final class QueryDates {

    private QueryDates() {}

    /**
     * Parse a {@code yyyy-MM-dd} value, falling back to a default when absent.
     *
     * @throws IllegalArgumentException if the value is present but not a date
     */
    static LocalDate parse(String value, String name, LocalDate defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("%s must be a date (yyyy-MM-dd), got '%s'".formatted(name, value), e);
        }
    }

    /**
     * Parse a required {@code yyyy-MM-dd} value.
     */
    static LocalDate require(String value, String name) {
        final var parsed = parse(value, name, null);
        if (parsed == null) {
            throw new IllegalArgumentException(name + " is required");
        }
        return parsed;
    }
}
