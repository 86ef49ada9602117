package tollgate.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for telemetry.
 *
 * <p>Configuration prefix: {@code tollgate.telemetry}
 */
@ConfigMapping(prefix = "tollgate.telemetry")
public interface TelemetryConfig {

    /**
     * Master switch for telemetry.
     *
     * @return true if telemetry is enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    MetricsConfig metrics();

    interface MetricsConfig {

        /**
         * Record Micrometer metrics.
         *
         * @return true if metrics are enabled (default: true)
         */
        @WithDefault("true")
        boolean enabled();
    }
}
