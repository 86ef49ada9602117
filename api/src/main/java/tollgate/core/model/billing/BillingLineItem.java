package tollgate.core.model.billing;

import java.math.BigDecimal;

/**
 * One priced quantity on a statement.
 *
 * @param name     item name: {@code requests}, {@code compute_units}, {@code tokens}, or {@code storage_bytes}
 * @param quantity billed quantity
 * @param rate     price per unit
 * @param amount   quantity times rate, rounded to cents
 */
public record BillingLineItem(String name, BigDecimal quantity, BigDecimal rate, BigDecimal amount) {}
