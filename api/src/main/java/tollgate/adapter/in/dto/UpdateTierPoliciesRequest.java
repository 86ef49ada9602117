package tollgate.adapter.in.dto;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

/**
 * Request body replacing the whole tier policy table.
 */
public record UpdateTierPoliciesRequest(@NotEmpty @Valid List<TierPolicyDto> tiers) {}
