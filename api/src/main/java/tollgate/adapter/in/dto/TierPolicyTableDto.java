package tollgate.adapter.in.dto;

import java.time.Instant;
import java.util.List;

import tollgate.core.model.tier.TierPolicyTable;

/**
 * DTO for the active tier policy table.
 */
public record TierPolicyTableDto(long version, Instant loadedAt, List<TierPolicyDto> tiers) {

    public static TierPolicyTableDto fromModel(TierPolicyTable table) {
        return new TierPolicyTableDto(
                table.version(),
                table.loadedAt(),
                table.policies().stream().map(TierPolicyDto::fromModel).toList());
    }
}
