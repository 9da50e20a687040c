package keyward.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import keyward.config.TelemetryConfigMapping;
import keyward.core.port.out.Metrics;

/**
 * Records authentication outcomes using Micrometer.
 *
 * <p>All methods are no-ops when metrics are disabled, so callers never check
 * configuration themselves.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code keyward.authn.success.total} - Successful authentications by client</li>
 *   <li>{@code keyward.authn.failures.total} - Refused or failed authentications by client and reason</li>
 * </ul>
 */
@ApplicationScoped
public class AuthnMetrics implements Metrics {

    private static final String NO_CLIENT = "none";

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public AuthnMetrics(MeterRegistry registry, TelemetryConfigMapping config) {
        this(registry, config != null && config.enabled() && config.metrics().enabled());
    }

    public AuthnMetrics(MeterRegistry registry, boolean enabled) {
        this.registry = registry;
        this.enabled = enabled;
    }

    @Override
    public void recordAuthSuccess(String client) {
        if (!enabled) {
            return;
        }

        Counter.builder("keyward.authn.success.total")
                .description("Successful authentications")
                .tag("client", client != null ? client : NO_CLIENT)
                .register(registry)
                .increment();
    }

    @Override
    public void recordAuthFailure(String client, String reason) {
        if (!enabled) {
            return;
        }

        Counter.builder("keyward.authn.failures.total")
                .description("Authentication failures")
                .tag("client", client != null ? client : NO_CLIENT)
                .tag("reason", reason != null ? reason : "unknown")
                .register(registry)
                .increment();
    }
}
