package keyward.core.service.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import keyward.core.model.auth.ApiKey;
import keyward.core.model.auth.AuthnError;
import keyward.core.model.auth.AuthnException;
import keyward.core.model.auth.AuthnRequest;
import keyward.core.model.auth.ClientParams;
import keyward.core.model.auth.Identity;
import keyward.core.model.auth.InvalidApiKeyException;
import keyward.spi.AuthnClient;

/**
 * Authentication client for API keys.
 *
 * <p>Flow: extract the key from the Authorization header, decode it, find the
 * stored record, schedule a last-used update, enforce expiry and revocation,
 * then resolve the identity (directly or through a linked service account).
 *
 * <p>The last-used update is dispatched as soon as the record is found, before
 * the lifecycle checks, so an expired or revoked key still has its use recorded.
 *
 * <p>Decode failures, unknown keys and failed verification all surface as
 * {@link AuthnError#API_KEY_INVALID}. Repository and account directory failures
 * are passed through unchanged.
 */
@ApplicationScoped
public class ApiKeyClient implements AuthnClient {

    public static final String NAME = "auth.client.api-key";

    private static final Logger LOG = Logger.getLogger(ApiKeyClient.class);

    private final ApiKeyTokenExtractor tokenExtractor;
    private final ApiKeyDecoder decoder;
    private final ApiKeyResolver resolver;
    private final ApiKeyLifecyclePolicy lifecyclePolicy;
    private final ApiKeyIdentityResolver identityResolver;
    private final ApiKeyUsageRecorder usageRecorder;

    @Inject
    public ApiKeyClient(
            ApiKeyTokenExtractor tokenExtractor,
            ApiKeyDecoder decoder,
            ApiKeyResolver resolver,
            ApiKeyLifecyclePolicy lifecyclePolicy,
            ApiKeyIdentityResolver identityResolver,
            ApiKeyUsageRecorder usageRecorder) {
        this.tokenExtractor = tokenExtractor;
        this.decoder = decoder;
        this.resolver = resolver;
        this.lifecyclePolicy = lifecyclePolicy;
        this.identityResolver = identityResolver;
        this.usageRecorder = usageRecorder;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int priority() {
        return 100;
    }

    @Override
    public boolean test(AuthnRequest request) {
        return tokenExtractor.extract(request).isPresent();
    }

    @Override
    public Uni<Identity> authenticate(AuthnRequest request) {
        String token = tokenExtractor.extract(request).orElse("");

        return Uni.createFrom()
                .item(() -> decoder.decode(token))
                .flatMap(resolver::resolve)
                .onFailure(InvalidApiKeyException.class)
                .transform(this::invalid)
                .invoke((ApiKey apiKey) -> usageRecorder.record(apiKey.id()))
                .invoke(lifecyclePolicy::check)
                .flatMap(identityResolver::resolve);
    }

    @Override
    public ClientParams clientParams() {
        return ClientParams.none();
    }

    private Throwable invalid(Throwable cause) {
        LOG.debugf("Rejected API key: %s", cause.getMessage());
        return new AuthnException(AuthnError.API_KEY_INVALID, "API key is invalid", cause);
    }
}
