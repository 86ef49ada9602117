package tollgate.core.model.tier;

import java.math.BigDecimal;

import tollgate.core.model.window.WindowKind;

/**
 * Limits and prices for one subscription tier.
 *
 * <p>A limit equal to {@link #UNLIMITED} is still counted but never compared,
 * so usage stays visible for analytics. Monetary values are in the billing
 * currency and must be non-negative.
 *
 * @param tier               the tier this policy applies to
 * @param limitPerMinute     max requests per minute window
 * @param limitPerHour       max requests per hour window
 * @param limitPerDay        max requests per day window
 * @param baseFee            flat fee added once per billing statement
 * @param ratePerRequest     price per request
 * @param ratePerComputeUnit price per compute unit
 * @param ratePerToken       price per token (in + out)
 * @param ratePerByte        price per stored byte
 */
public record TierPolicy(
        Tier tier,
        long limitPerMinute,
        long limitPerHour,
        long limitPerDay,
        BigDecimal baseFee,
        BigDecimal ratePerRequest,
        BigDecimal ratePerComputeUnit,
        BigDecimal ratePerToken,
        BigDecimal ratePerByte) {

    public static final long UNLIMITED = Long.MAX_VALUE;

    public TierPolicy {
        if (tier == null) {
            throw new IllegalArgumentException("Tier cannot be null");
        }
        requirePositive(limitPerMinute, "limitPerMinute", tier);
        requirePositive(limitPerHour, "limitPerHour", tier);
        requirePositive(limitPerDay, "limitPerDay", tier);
        baseFee = requireNonNegative(baseFee, "baseFee", tier);
        ratePerRequest = requireNonNegative(ratePerRequest, "ratePerRequest", tier);
        ratePerComputeUnit = requireNonNegative(ratePerComputeUnit, "ratePerComputeUnit", tier);
        ratePerToken = requireNonNegative(ratePerToken, "ratePerToken", tier);
        ratePerByte = requireNonNegative(ratePerByte, "ratePerByte", tier);
    }

    /**
     * Limit for the given window kind, possibly {@link #UNLIMITED}.
     */
    public long limitFor(WindowKind kind) {
        return switch (kind) {
            case MINUTE -> limitPerMinute;
            case HOUR -> limitPerHour;
            case DAY -> limitPerDay;
        };
    }

    public boolean isUnlimited(WindowKind kind) {
        return limitFor(kind) == UNLIMITED;
    }

    public static Builder builder(Tier tier) {
        return new Builder(tier);
    }

    private static void requirePositive(long value, String field, Tier tier) {
        if (value <= 0) {
            throw new IllegalArgumentException(
                    "%s for tier %s must be positive, got %d".formatted(field, tier.value(), value));
        }
    }

    private static BigDecimal requireNonNegative(BigDecimal value, String field, Tier tier) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException(
                    "%s for tier %s cannot be negative, got %s".formatted(field, tier.value(), value));
        }
        return value;
    }

    public static final class Builder {
        private final Tier tier;
        private long limitPerMinute = UNLIMITED;
        private long limitPerHour = UNLIMITED;
        private long limitPerDay = UNLIMITED;
        private BigDecimal baseFee = BigDecimal.ZERO;
        private BigDecimal ratePerRequest = BigDecimal.ZERO;
        private BigDecimal ratePerComputeUnit = BigDecimal.ZERO;
        private BigDecimal ratePerToken = BigDecimal.ZERO;
        private BigDecimal ratePerByte = BigDecimal.ZERO;

        private Builder(Tier tier) {
            this.tier = tier;
        }

        public Builder limits(long perMinute, long perHour, long perDay) {
            this.limitPerMinute = perMinute;
            this.limitPerHour = perHour;
            this.limitPerDay = perDay;
            return this;
        }

        public Builder limitPerMinute(long limit) {
            this.limitPerMinute = limit;
            return this;
        }

        public Builder limitPerHour(long limit) {
            this.limitPerHour = limit;
            return this;
        }

        public Builder limitPerDay(long limit) {
            this.limitPerDay = limit;
            return this;
        }

        public Builder baseFee(BigDecimal baseFee) {
            this.baseFee = baseFee;
            return this;
        }

        public Builder baseFee(String baseFee) {
            return baseFee(new BigDecimal(baseFee));
        }

        public Builder ratePerRequest(BigDecimal rate) {
            this.ratePerRequest = rate;
            return this;
        }

        public Builder ratePerComputeUnit(BigDecimal rate) {
            this.ratePerComputeUnit = rate;
            return this;
        }

        public Builder ratePerToken(BigDecimal rate) {
            this.ratePerToken = rate;
            return this;
        }

        public Builder ratePerByte(BigDecimal rate) {
            this.ratePerByte = rate;
            return this;
        }

        /**
         * Set all usage rates at once, as plain decimal strings.
         */
        public Builder rates(String perRequest, String perComputeUnit, String perToken, String perByte) {
            this.ratePerRequest = new BigDecimal(perRequest);
            this.ratePerComputeUnit = new BigDecimal(perComputeUnit);
            this.ratePerToken = new BigDecimal(perToken);
            this.ratePerByte = new BigDecimal(perByte);
            return this;
        }

        public TierPolicy build() {
            return new TierPolicy(
                    tier,
                    limitPerMinute,
                    limitPerHour,
                    limitPerDay,
                    baseFee,
                    ratePerRequest,
                    ratePerComputeUnit,
                    ratePerToken,
                    ratePerByte);
        }
    }
}
