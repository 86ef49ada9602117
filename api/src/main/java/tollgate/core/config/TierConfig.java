package tollgate.core.config;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for tier policies.
 *
 * <p>Configuration prefix: {@code tollgate.tiers}
 *
 * <p>Policies come from a JSON file when {@code tollgate.tiers.file} is set,
 * otherwise from {@code tollgate.tiers.definitions.<tier>.*} properties.
 * A missing limit means the window is unlimited.
 */
@ConfigMapping(prefix = "tollgate.tiers")
public interface TierConfig {

    /**
     * Path to a JSON tier policy file.
     */
    Optional<String> file();

    /**
     * Currency code reported on billing statements.
     *
     * @return currency (default: USD)
     */
    @WithDefault("USD")
    String currency();

    /**
     * Policy definitions keyed by tier value.
     */
    Map<String, TierDefinition> definitions();

    interface TierDefinition {

        Optional<Long> limitPerMinute();

        Optional<Long> limitPerHour();

        Optional<Long> limitPerDay();

        @WithDefault("0")
        BigDecimal baseFee();

        @WithDefault("0")
        BigDecimal ratePerRequest();

        @WithDefault("0")
        BigDecimal ratePerComputeUnit();

        @WithDefault("0")
        BigDecimal ratePerToken();

        @WithDefault("0")
        BigDecimal ratePerByte();
    }
}
