package keyward.core.service.auth;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;

import keyward.core.model.auth.ApiKey;
import keyward.core.model.auth.AuthnError;
import keyward.core.model.auth.AuthnException;

/**
 * Rejects keys that are past their expiry or revoked.
 *
 * <p>Expiry is checked first, so a key that is both expired and revoked reports
 * {@link AuthnError#API_KEY_EXPIRED}.
 */
@ApplicationScoped
public class ApiKeyLifecyclePolicy {

    private final Clock clock;

    public ApiKeyLifecyclePolicy() {
        this(Clock.systemUTC());
    }

    public ApiKeyLifecyclePolicy(Clock clock) {
        this.clock = clock;
    }

    /**
     * Check a resolved key.
     *
     * @param apiKey the stored record
     * @throws AuthnException if the key is expired or revoked
     */
    public void check(ApiKey apiKey) {
        if (apiKey.isExpiredAt(clock.instant())) {
            throw new AuthnException(AuthnError.API_KEY_EXPIRED, "API key " + apiKey.id() + " has expired");
        }
        if (apiKey.isRevoked()) {
            throw new AuthnException(AuthnError.API_KEY_REVOKED, "API key " + apiKey.id() + " is revoked");
        }
    }
}
