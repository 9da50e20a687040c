package keyward.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for telemetry.
 *
 * <p>Example configuration:
 * <pre>{@code
 * keyward.telemetry.enabled=true
 * keyward.telemetry.metrics.enabled=true
 * }</pre>
 */
@ConfigMapping(prefix = "keyward.telemetry")
public interface TelemetryConfigMapping {

    /**
     * Master toggle for all telemetry features.
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Metrics configuration for Micrometer metrics collection.
     */
    MetricsConfig metrics();

    interface MetricsConfig {
        @WithDefault("true")
        boolean enabled();
    }
}
