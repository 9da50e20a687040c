package keyward.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for API key authentication.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>{@code keyward.auth.api-keys.usage-tracking.enabled} - Record last-use time of keys (default true)</li>
 *   <li>{@code keyward.auth.api-keys.usage-tracking.threads} - Background threads for usage updates (default 2)</li>
 *   <li>{@code keyward.auth.api-keys.usage-tracking.queue-capacity} - Pending updates held before new ones are
 *       dropped (default 1000)</li>
 * </ul>
 */
@ConfigMapping(prefix = "keyward.auth.api-keys")
public interface ApiKeyConfig {

    UsageTracking usageTracking();

    interface UsageTracking {

        /**
         * Whether successful key lookups update the key's last-used time.
         */
        @WithDefault("true")
        boolean enabled();

        /**
         * Size of the thread pool running last-used updates.
         */
        @WithDefault("2")
        int threads();

        /**
         * Maximum number of pending updates; further updates are dropped while the queue is full.
         */
        @WithDefault("1000")
        int queueCapacity();
    }
}
