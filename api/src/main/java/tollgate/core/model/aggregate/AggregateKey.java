package tollgate.core.model.aggregate;

import java.time.LocalDate;

/**
 * Identifies one daily aggregate row.
 */
public record AggregateKey(String identity, LocalDate date, String category) {

    public AggregateKey {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("Identity cannot be null or blank");
        }
        if (date == null) {
            throw new IllegalArgumentException("Date cannot be null");
        }
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("Category cannot be null or blank");
        }
    }
}
