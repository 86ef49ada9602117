package tollgate.adapter.out.tier;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import tollgate.core.config.TierConfig;
import tollgate.core.config.TierConfig.TierDefinition;
import tollgate.core.model.tier.Tier;
import tollgate.core.model.tier.TierPolicy;
import tollgate.core.port.out.TierPolicySource;

/**
 * Builds tier policies from {@code tollgate.tiers.definitions.<tier>.*} properties.
 */
public class ConfiguredTierPolicySource implements TierPolicySource {

    private final Map<String, TierDefinition> definitions;

    public ConfiguredTierPolicySource(TierConfig config) {
        this(config.definitions());
    }

    public ConfiguredTierPolicySource(Map<String, TierDefinition> definitions) {
        this.definitions = definitions;
    }

    @Override
    public List<TierPolicy> load() {
        final var policies = new ArrayList<TierPolicy>(definitions.size());
        for (var entry : definitions.entrySet()) {
            final var tier = Tier.fromValue(entry.getKey())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown tier in configuration: " + entry.getKey()));
            final var definition = entry.getValue();
            policies.add(new TierPolicy(
                    tier,
                    definition.limitPerMinute().orElse(TierPolicy.UNLIMITED),
                    definition.limitPerHour().orElse(TierPolicy.UNLIMITED),
                    definition.limitPerDay().orElse(TierPolicy.UNLIMITED),
                    definition.baseFee(),
                    definition.ratePerRequest(),
                    definition.ratePerComputeUnit(),
                    definition.ratePerToken(),
                    definition.ratePerByte()));
        }
        return policies;
    }

    @Override
    public String describe() {
        return "configuration:tollgate.tiers.definitions";
    }
}
