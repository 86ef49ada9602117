package tollgate.adapter.out.tier;

import java.math.BigDecimal;
import java.util.List;

import tollgate.core.model.tier.Tier;
import tollgate.core.model.tier.TierPolicy;

/**
 * JSON layout of a tier policy file.
 *
 * <pre>{@code
 * {
 *   "version": 1,
 *   "tiers": [
 *     {"tier": "basic", "limitPerMinute": 100, "limitPerHour": 1000, "limitPerDay": 10000,
 *      "baseFee": "9.99", "ratePerRequest": "0.001", ...}
 *   ]
 * }
 * }</pre>
 *
 * <p>An omitted or null limit means the window is unlimited.
 */
public record TierPolicyFileSchema(int version, List<Entry> tiers) {

    public TierPolicyFileSchema {
        tiers = tiers != null ? tiers : List.of();
    }

    public List<TierPolicy> toPolicies() {
        return tiers.stream().map(Entry::toPolicy).toList();
    }

    public record Entry(
            String tier,
            Long limitPerMinute,
            Long limitPerHour,
            Long limitPerDay,
            BigDecimal baseFee,
            BigDecimal ratePerRequest,
            BigDecimal ratePerComputeUnit,
            BigDecimal ratePerToken,
            BigDecimal ratePerByte) {

        TierPolicy toPolicy() {
            final var parsed = Tier.fromValue(tier)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown tier in policy file: " + tier));
            return new TierPolicy(
                    parsed,
                    limitPerMinute != null ? limitPerMinute : TierPolicy.UNLIMITED,
                    limitPerHour != null ? limitPerHour : TierPolicy.UNLIMITED,
                    limitPerDay != null ? limitPerDay : TierPolicy.UNLIMITED,
                    baseFee,
                    ratePerRequest,
                    ratePerComputeUnit,
                    ratePerToken,
                    ratePerByte);
        }
    }
}
