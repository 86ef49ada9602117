package tollgate.core.config;

import java.util.List;
import java.util.Map;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the request metering pipeline.
 *
 * <p>Configuration prefix: {@code tollgate.metering}
 */
@ConfigMapping(prefix = "tollgate.metering")
public interface MeteringConfig {

    /**
     * Apply the metering pipeline to requests.
     *
     * @return true to meter requests (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Path prefixes that are metered.
     *
     * @return metered path prefixes (default: /api)
     */
    @WithDefault("/api")
    List<String> paths();

    /**
     * Header carrying the authenticated identity.
     *
     * @return header name (default: X-Identity-Id)
     */
    @WithDefault("X-Identity-Id")
    String identityHeader();

    /**
     * Header carrying the identity's subscription tier.
     *
     * @return header name (default: X-Identity-Tier)
     */
    @WithDefault("X-Identity-Tier")
    String tierHeader();

    /**
     * Identity used when a metered request carries none.
     *
     * @return anonymous identity (default: anonymous)
     */
    @WithDefault("anonymous")
    String anonymousIdentity();

    /**
     * Category for requests that match no configured prefix.
     *
     * @return default category (default: default)
     */
    @WithDefault("default")
    String defaultCategory();

    /**
     * Path prefix per category, e.g. {@code tollgate.metering.categories.chat=/api/chat}.
     * The longest matching prefix wins.
     */
    Map<String, String> categories();
}
