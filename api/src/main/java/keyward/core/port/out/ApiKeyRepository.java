package keyward.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import keyward.core.model.auth.ApiKey;

/**
 * Port interface for stored API key records.
 *
 * <p>Failures of the underlying store are reported as failed {@link Uni}s and
 * are passed to callers unchanged.
 */
public interface ApiKeyRepository {

    /**
     * Save or replace an API key record.
     *
     * @param apiKey the record to persist
     * @return Uni completing when the save is durable
     */
    Uni<Void> save(ApiKey apiKey);

    /**
     * Find a record by its identifier.
     *
     * @param keyId the key identifier
     * @return Uni with Optional containing the record if found
     */
    Uni<Optional<ApiKey>> findById(long keyId);

    /**
     * Find a current-format key by the SHA-256 of its secret.
     *
     * @param keyHash hex-encoded SHA-256 of the secret
     * @return Uni with Optional containing the record if found
     */
    Uni<Optional<ApiKey>> findByHash(String keyHash);

    /**
     * Find a legacy key by its name within an organization.
     *
     * @param name  the key name
     * @param orgId the owning organization
     * @return Uni with Optional containing the record if found
     */
    Uni<Optional<ApiKey>> findByName(String name, long orgId);

    /**
     * Stamp the record's last-used time with the current time.
     *
     * @param keyId the key identifier
     * @return Uni completing when the update is stored
     */
    Uni<Void> updateLastUsed(long keyId);
}
