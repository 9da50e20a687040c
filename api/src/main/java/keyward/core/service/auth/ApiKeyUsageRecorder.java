package keyward.core.service.auth;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import keyward.core.config.ApiKeyConfig;
import keyward.core.port.out.ApiKeyRepository;

/**
 * Records the last-use time of API keys in the background.
 *
 * <p>Updates are fire-and-forget: {@link #record} returns immediately, the
 * update runs on a dedicated executor, and any failure is logged and dropped.
 * Nothing about an update can reach the request that triggered it.
 */
@ApplicationScoped
public class ApiKeyUsageRecorder {

    private static final Logger LOG = Logger.getLogger(ApiKeyUsageRecorder.class);

    private final ApiKeyRepository repository;
    private final Executor executor;
    private final boolean enabled;

    @Inject
    public ApiKeyUsageRecorder(ApiKeyRepository repository, ApiKeyConfig config) {
        this(
                repository,
                config.usageTracking().enabled()
                        ? newExecutor(
                                config.usageTracking().threads(),
                                config.usageTracking().queueCapacity())
                        : Runnable::run,
                config.usageTracking().enabled());
    }

    ApiKeyUsageRecorder(ApiKeyRepository repository, Executor executor, boolean enabled) {
        this.repository = repository;
        this.executor = executor;
        this.enabled = enabled;
        if (!enabled) {
            LOG.info("API key usage tracking disabled (keyward.auth.api-keys.usage-tracking.enabled=false)");
        }
    }

    /**
     * Schedule a last-used update for a key.
     *
     * @param keyId the key that was just resolved
     */
    public void record(long keyId) {
        if (!enabled) {
            return;
        }
        try {
            executor.execute(() -> update(keyId));
        } catch (RejectedExecutionException e) {
            LOG.warnf("Dropped last-used update for API key %d: %s", keyId, e.getMessage());
        }
    }

    private void update(long keyId) {
        try {
            repository.updateLastUsed(keyId).await().indefinitely();
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to update last use date for API key %d", keyId);
        } catch (Throwable t) {
            LOG.errorf(t, "Unexpected fault while updating last use date for API key %d", keyId);
        }
    }

    @PreDestroy
    void shutdown() {
        if (executor instanceof ExecutorService service) {
            service.shutdown();
        }
    }

    /**
     * Fixed pool with a bounded queue. Updates submitted while the queue is
     * full are rejected and dropped by {@link #record}.
     */
    static ExecutorService newExecutor(int threads, int queueCapacity) {
        var counter = new AtomicInteger();
        int size = Math.max(1, threads);
        return new ThreadPoolExecutor(
                size,
                size,
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(Math.max(1, queueCapacity)),
                r -> {
                    var thread = new Thread(r, "keyward-api-key-usage-" + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }
}
