package tollgate.adapter.in.dto;

import java.math.BigDecimal;

import tollgate.core.model.tier.Tier;
import tollgate.core.model.tier.TierPolicy;

/**
 * DTO for one tier policy in the admin API.
 *
 * <p>Maps between the JSON representation and the domain model. A null limit
 * means the window is unlimited, in both directions.
 */
public record TierPolicyDto(
        String tier,
        Long limitPerMinute,
        Long limitPerHour,
        Long limitPerDay,
        BigDecimal baseFee,
        BigDecimal ratePerRequest,
        BigDecimal ratePerComputeUnit,
        BigDecimal ratePerToken,
        BigDecimal ratePerByte) {

    /**
     * Converts this DTO to a TierPolicy model.
     *
     * @throws IllegalArgumentException if the tier is unknown or a value is invalid
     */
    public TierPolicy toModel() {
        final var parsed = Tier.fromValue(tier).orElseThrow(() -> new IllegalArgumentException("Unknown tier: " + tier));
        return new TierPolicy(
                parsed,
                limitOrUnlimited(limitPerMinute),
                limitOrUnlimited(limitPerHour),
                limitOrUnlimited(limitPerDay),
                baseFee,
                ratePerRequest,
                ratePerComputeUnit,
                ratePerToken,
                ratePerByte);
    }

    /**
     * Creates a DTO from a TierPolicy model.
     */
    public static TierPolicyDto fromModel(TierPolicy policy) {
        return new TierPolicyDto(
                policy.tier().value(),
                limitOrNull(policy.limitPerMinute()),
                limitOrNull(policy.limitPerHour()),
                limitOrNull(policy.limitPerDay()),
                policy.baseFee(),
                policy.ratePerRequest(),
                policy.ratePerComputeUnit(),
                policy.ratePerToken(),
                policy.ratePerByte());
    }

    private static long limitOrUnlimited(Long limit) {
        return limit != null ? limit : TierPolicy.UNLIMITED;
    }

    private static Long limitOrNull(long limit) {
        return limit == TierPolicy.UNLIMITED ? null : limit;
    }
}
