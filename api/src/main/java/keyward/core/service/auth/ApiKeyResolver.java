package keyward.core.service.auth;

import java.util.concurrent.Executor;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;

import keyward.core.model.auth.ApiKey;
import keyward.core.model.auth.DecodedApiKey;
import keyward.core.model.auth.InvalidApiKeyException;
import keyward.core.model.auth.LegacyApiKey;
import keyward.core.model.auth.PrefixedApiKey;
import keyward.core.port.out.ApiKeyRepository;

/**
 * Finds the stored record behind a decoded key.
 *
 * <p>Prefixed keys are looked up directly by the hash of their secret. Legacy
 * keys are looked up by name and then verified against the stored digest,
 * since their secret alone cannot address a record.
 *
 * <p>Legacy verification runs PBKDF2 and is moved onto the worker pool, never
 * the I/O thread the lookup completed on.
 *
 * <p>A miss or a failed verification fails with {@link InvalidApiKeyException};
 * repository failures are passed through unchanged.
 */
@ApplicationScoped
public class ApiKeyResolver {

    private final ApiKeyRepository repository;
    private final Executor verificationExecutor;

    @Inject
    public ApiKeyResolver(ApiKeyRepository repository) {
        this(repository, Infrastructure.getDefaultWorkerPool());
    }

    ApiKeyResolver(ApiKeyRepository repository, Executor verificationExecutor) {
        this.repository = repository;
        this.verificationExecutor = verificationExecutor;
    }

    public Uni<ApiKey> resolve(DecodedApiKey decoded) {
        if (decoded instanceof PrefixedApiKey prefixed) {
            return findByHash(prefixed);
        }
        return findAndVerify((LegacyApiKey) decoded);
    }

    private Uni<ApiKey> findByHash(PrefixedApiKey key) {
        return repository
                .findByHash(key.hash())
                .map(found -> found.orElseThrow(() -> new InvalidApiKeyException("No API key matches hash")));
    }

    private Uni<ApiKey> findAndVerify(LegacyApiKey key) {
        return repository
                .findByName(key.name(), key.orgId())
                .emitOn(verificationExecutor)
                .map(found -> {
                    var apiKey = found.orElseThrow(() -> new InvalidApiKeyException(
                            "No API key named '" + key.name() + "' in org " + key.orgId()));
                    if (!key.verify(apiKey.key())) {
                        throw new InvalidApiKeyException("Legacy API key " + apiKey.id() + " failed verification");
                    }
                    return apiKey;
                });
    }
}
