package keyward.adapter.out.storage.memory;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;

import io.quarkus.arc.DefaultBean;
import io.smallrye.mutiny.Uni;

import keyward.core.model.auth.ApiKey;
import keyward.core.port.out.ApiKeyRepository;

/**
 * In-memory implementation of ApiKeyRepository.
 *
 * <p>Data is NOT persisted across restarts. Suitable for development, tests and
 * single-instance deployments that seed keys at startup. Any other
 * {@link ApiKeyRepository} bean replaces this one.
 *
 * <p>Thread-safety: records are indexed by id, by hash and by (org, name);
 * writes hold a lock so the three indexes stay consistent.
 */
@DefaultBean
@ApplicationScoped
public class InMemoryApiKeyRepository implements ApiKeyRepository {

    private final ConcurrentHashMap<Long, ApiKey> storageById = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ApiKey> storageByHash = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ApiKey> storageByName = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();
    private final Clock clock;

    public InMemoryApiKeyRepository() {
        this(Clock.systemUTC());
    }

    public InMemoryApiKeyRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Uni<Void> save(ApiKey apiKey) {
        return Uni.createFrom().item(() -> {
            synchronized (writeLock) {
                var previous = storageById.put(apiKey.id(), apiKey);
                if (previous != null) {
                    storageByHash.remove(previous.key());
                    storageByName.remove(nameKey(previous.name(), previous.orgId()));
                }
                storageByHash.put(apiKey.key(), apiKey);
                storageByName.put(nameKey(apiKey.name(), apiKey.orgId()), apiKey);
            }
            return null;
        });
    }

    @Override
    public Uni<Optional<ApiKey>> findById(long keyId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(storageById.get(keyId)));
    }

    @Override
    public Uni<Optional<ApiKey>> findByHash(String keyHash) {
        return Uni.createFrom().item(() -> Optional.ofNullable(storageByHash.get(keyHash)));
    }

    @Override
    public Uni<Optional<ApiKey>> findByName(String name, long orgId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(storageByName.get(nameKey(name, orgId))));
    }

    @Override
    public Uni<Void> updateLastUsed(long keyId) {
        return Uni.createFrom().item(() -> {
            synchronized (writeLock) {
                var existing = storageById.get(keyId);
                if (existing == null) {
                    throw new IllegalStateException("API key " + keyId + " does not exist");
                }
                var updated = existing.withLastUsedAt(clock.instant());
                storageById.put(keyId, updated);
                storageByHash.put(updated.key(), updated);
                storageByName.put(nameKey(updated.name(), updated.orgId()), updated);
            }
            return null;
        });
    }

    private static String nameKey(String name, long orgId) {
        return orgId + "/" + name;
    }
}
